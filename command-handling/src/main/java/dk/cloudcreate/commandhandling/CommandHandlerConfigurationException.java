package dk.cloudcreate.commandhandling;

/**
 * Thrown at registration time when a command handler is configured incorrectly
 */
public class CommandHandlerConfigurationException extends IllegalStateException {
    public CommandHandlerConfigurationException(String message) {
        super(message);
    }
}
