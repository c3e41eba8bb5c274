package dk.cloudcreate.commandhandling.eventstore.persistence;

import dk.cloudcreate.commandhandling.eventstore.EventStoreException;

public class AppendToStreamException extends EventStoreException {
    public AppendToStreamException(String msg) {
        super(msg);
    }

    public AppendToStreamException(String msg, RuntimeException cause) {
        super(msg, cause);
    }
}
