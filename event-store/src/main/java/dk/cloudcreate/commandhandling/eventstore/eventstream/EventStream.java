package dk.cloudcreate.commandhandling.eventstore.eventstream;

import dk.cloudcreate.commandhandling.eventstore.EventReader;
import dk.cloudcreate.commandhandling.eventstore.types.EventOrder;

import java.util.List;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The events loaded from a single stream using {@link EventReader#readStream(StreamName)} or {@link EventReader#readStream(StreamName, EventOrder)}
 */
public final class EventStream {
    private final StreamName           streamName;
    private final List<PersistedEvent> eventList;
    private final EventOrder           lastEventOrder;

    private EventStream(StreamName streamName, List<PersistedEvent> eventList, EventOrder lastEventOrder) {
        this.streamName = requireNonNull(streamName, "No streamName provided");
        this.eventList = List.copyOf(requireNonNull(eventList, "No eventList provided"));
        this.lastEventOrder = requireNonNull(lastEventOrder, "No lastEventOrder provided");
    }

    /**
     * @param streamName     the name of the stream
     * @param eventList      the events loaded, ordered by {@link PersistedEvent#eventOrder()}
     * @param lastEventOrder the event order of the last event in the stream, which may be beyond the last event in <code>eventList</code>
     *                       in case only part of the stream was loaded
     */
    public static EventStream of(StreamName streamName, List<PersistedEvent> eventList, EventOrder lastEventOrder) {
        return new EventStream(streamName, eventList, lastEventOrder);
    }

    public StreamName streamName() {
        return streamName;
    }

    /**
     * The loaded events ordered by {@link PersistedEvent#eventOrder()}
     */
    public List<PersistedEvent> eventList() {
        return eventList;
    }

    /**
     * The payloads of {@link #eventList()}, in the same order
     */
    public List<Object> events() {
        return eventList.stream()
                        .map(PersistedEvent::event)
                        .collect(Collectors.toUnmodifiableList());
    }

    /**
     * The {@link EventOrder} of the last event in the stream (aka. the current stream version)
     */
    public EventOrder lastEventOrder() {
        return lastEventOrder;
    }

    public boolean isEmpty() {
        return eventList.isEmpty();
    }

    @Override
    public String toString() {
        return "EventStream{" +
                "streamName=" + streamName +
                ", events=" + eventList.size() +
                ", lastEventOrder=" + lastEventOrder +
                '}';
    }
}
