package dk.cloudcreate.commandhandling;

import dk.cloudcreate.commandhandling.eventstore.eventstream.StreamName;

/**
 * The {@link ExpectedState} a command was registered with didn't hold for the stream the command targets
 *
 * @see StreamAlreadyExistsException
 * @see StreamNotFoundException
 */
public abstract class StreamStateConflictException extends CommandServiceException {
    public final StreamName    streamName;
    public final Class<?>      commandType;
    public final ExpectedState expectedState;

    protected StreamStateConflictException(String message, StreamName streamName, Class<?> commandType, ExpectedState expectedState) {
        super(message);
        this.streamName = streamName;
        this.commandType = commandType;
        this.expectedState = expectedState;
    }
}
