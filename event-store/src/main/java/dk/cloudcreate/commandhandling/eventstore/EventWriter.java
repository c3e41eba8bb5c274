package dk.cloudcreate.commandhandling.eventstore;

import dk.cloudcreate.commandhandling.eventstore.eventstream.StreamName;
import dk.cloudcreate.commandhandling.eventstore.persistence.*;
import dk.cloudcreate.commandhandling.eventstore.types.ExpectedStreamVersion;

import java.util.List;

/**
 * Write side of an event store: appends events to a single stream under optimistic concurrency control
 */
public interface EventWriter {
    /**
     * Append the <code>events</code> to the stream. The append is atomic: either all events are appended or none of them.
     *
     * @param streamName      the name of the stream
     * @param expectedVersion the version the caller expects the stream to be at
     * @param events          the events to append (may be empty)
     * @return the result of the append
     * @throws OptimisticAppendToStreamException in case <code>expectedVersion</code> doesn't match the current stream version
     * @throws AppendToStreamException           in case the append failed for other reasons
     */
    AppendEventsResult appendToStream(StreamName streamName, ExpectedStreamVersion expectedVersion, List<?> events);
}
