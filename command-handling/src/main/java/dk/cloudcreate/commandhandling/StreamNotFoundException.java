package dk.cloudcreate.commandhandling;

import dk.cloudcreate.commandhandling.eventstore.eventstream.StreamName;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

public class StreamNotFoundException extends StreamStateConflictException {
    public StreamNotFoundException(StreamName streamName, Class<?> commandType) {
        super(msg("Command '{}' expects stream '{}' to exist, but it couldn't be found",
                  commandType.getName(),
                  streamName),
              streamName,
              commandType,
              ExpectedState.Existing);
    }
}
