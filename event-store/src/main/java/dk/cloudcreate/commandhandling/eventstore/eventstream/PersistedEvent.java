package dk.cloudcreate.commandhandling.eventstore.eventstream;

import dk.cloudcreate.commandhandling.eventstore.types.*;

import java.time.OffsetDateTime;
import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * An event that has been appended to a stream. Once persisted it's immutable.
 */
public final class PersistedEvent {
    private final StreamName       streamName;
    private final EventOrder       eventOrder;
    private final GlobalEventOrder globalEventOrder;
    private final Object           event;
    private final OffsetDateTime   timestamp;

    private PersistedEvent(StreamName streamName,
                           EventOrder eventOrder,
                           GlobalEventOrder globalEventOrder,
                           Object event,
                           OffsetDateTime timestamp) {
        this.streamName = requireNonNull(streamName, "No streamName provided");
        this.eventOrder = requireNonNull(eventOrder, "No eventOrder provided");
        this.globalEventOrder = requireNonNull(globalEventOrder, "No globalEventOrder provided");
        this.event = requireNonNull(event, "No event provided");
        this.timestamp = requireNonNull(timestamp, "No timestamp provided");
    }

    public static PersistedEvent from(StreamName streamName,
                                      EventOrder eventOrder,
                                      GlobalEventOrder globalEventOrder,
                                      Object event,
                                      OffsetDateTime timestamp) {
        return new PersistedEvent(streamName, eventOrder, globalEventOrder, event, timestamp);
    }

    /**
     * The name of the stream this event belongs to
     */
    public StreamName streamName() {
        return streamName;
    }

    /**
     * The zero based position of the event within its stream
     */
    public EventOrder eventOrder() {
        return eventOrder;
    }

    /**
     * The position of the event across all streams in the event store
     */
    public GlobalEventOrder globalEventOrder() {
        return globalEventOrder;
    }

    /**
     * The event payload as produced by the command decision
     */
    public Object event() {
        return event;
    }

    public OffsetDateTime timestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PersistedEvent)) return false;
        var that = (PersistedEvent) o;
        return streamName.equals(that.streamName) && eventOrder.equals(that.eventOrder) && globalEventOrder.equals(that.globalEventOrder);
    }

    @Override
    public int hashCode() {
        return Objects.hash(streamName, eventOrder, globalEventOrder);
    }

    @Override
    public String toString() {
        return "PersistedEvent{" +
                "streamName=" + streamName +
                ", eventOrder=" + eventOrder +
                ", globalEventOrder=" + globalEventOrder +
                ", eventType=" + event.getClass().getName() +
                ", timestamp=" + timestamp +
                '}';
    }
}
