package dk.cloudcreate.commandhandling.eventstore.persistence;

import dk.cloudcreate.commandhandling.eventstore.eventstream.StreamName;
import dk.cloudcreate.commandhandling.eventstore.types.*;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when the stream has moved since the caller read it, i.e. another writer appended events in between
 */
public class OptimisticAppendToStreamException extends AppendToStreamException {
    public final StreamName            streamName;
    public final ExpectedStreamVersion expectedVersion;
    public final EventOrder            actualEventOrder;

    public OptimisticAppendToStreamException(StreamName streamName, ExpectedStreamVersion expectedVersion, EventOrder actualEventOrder) {
        super(msg("Optimistic Concurrency Exception: Failed to append to stream '{}'. Expected version '{}' but the stream is at version '{}'",
                  streamName,
                  expectedVersion,
                  actualEventOrder.isNoEventsPersisted() ? "NoStream" : actualEventOrder));
        this.streamName = streamName;
        this.expectedVersion = expectedVersion;
        this.actualEventOrder = actualEventOrder;
    }
}
