package dk.cloudcreate.commandhandling.eventstore;

import dk.cloudcreate.commandhandling.eventstore.eventstream.*;
import dk.cloudcreate.commandhandling.eventstore.types.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The outcome of {@link EventWriter#appendToStream(StreamName, ExpectedStreamVersion, List)}
 */
public final class AppendEventsResult {
    public final StreamName           streamName;
    /**
     * The appended events - each one corresponds 1-1 and IN-ORDER with the events passed to the writer
     */
    public final List<PersistedEvent> persistedEvents;
    /**
     * The event order of the last event in the stream after the append (aka. the next expected version)
     */
    public final EventOrder           nextExpectedEventOrder;

    public AppendEventsResult(StreamName streamName, List<PersistedEvent> persistedEvents, EventOrder nextExpectedEventOrder) {
        this.streamName = requireNonNull(streamName, "No streamName provided");
        this.persistedEvents = List.copyOf(requireNonNull(persistedEvents, "No persistedEvents provided"));
        this.nextExpectedEventOrder = requireNonNull(nextExpectedEventOrder, "No nextExpectedEventOrder provided");
    }

    /**
     * The {@link GlobalEventOrder} of the last appended event or {@link Optional#empty()} if no events were appended
     */
    public Optional<GlobalEventOrder> globalEventOrder() {
        if (persistedEvents.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(persistedEvents.get(persistedEvents.size() - 1).globalEventOrder());
    }

    @Override
    public String toString() {
        return "AppendEventsResult{" +
                "streamName=" + streamName +
                ", persistedEvents=" + persistedEvents.size() +
                ", nextExpectedEventOrder=" + nextExpectedEventOrder +
                '}';
    }
}
