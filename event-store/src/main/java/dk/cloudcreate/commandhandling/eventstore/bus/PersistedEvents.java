package dk.cloudcreate.commandhandling.eventstore.bus;

import dk.cloudcreate.commandhandling.eventstore.eventstream.*;

import java.util.List;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Encapsulates all events appended to a single stream in one append operation
 */
public class PersistedEvents {
    public final StreamName           streamName;
    public final List<PersistedEvent> events;

    public PersistedEvents(StreamName streamName, List<PersistedEvent> events) {
        this.streamName = requireNonNull(streamName, "No streamName provided");
        this.events = List.copyOf(requireNonNull(events, "No events provided"));
    }

    @Override
    public String toString() {
        return "PersistedEvents{" +
                "streamName=" + streamName + ", " +
                "events=" + events.size() +
                '}';
    }
}
