package dk.cloudcreate.commandhandling;

import dk.cloudcreate.commandhandling.eventstore.eventstream.StreamName;
import dk.cloudcreate.commandhandling.eventstore.types.EventOrder;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

public class StreamAlreadyExistsException extends StreamStateConflictException {
    public final EventOrder lastEventOrder;

    public StreamAlreadyExistsException(StreamName streamName, Class<?> commandType, EventOrder lastEventOrder) {
        super(msg("Command '{}' expects stream '{}' to be new, but it already exists with last eventOrder {}",
                  commandType.getName(),
                  streamName,
                  lastEventOrder),
              streamName,
              commandType,
              ExpectedState.New);
        this.lastEventOrder = lastEventOrder;
    }
}
