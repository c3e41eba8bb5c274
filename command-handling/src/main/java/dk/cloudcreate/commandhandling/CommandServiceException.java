package dk.cloudcreate.commandhandling;

public class CommandServiceException extends RuntimeException {
    public CommandServiceException(String message) {
        super(message);
    }

    public CommandServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
