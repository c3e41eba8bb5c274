package dk.cloudcreate.commandhandling;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

public class CommandHandlerNotFoundException extends CommandServiceException {
    public final Class<?> commandType;

    public CommandHandlerNotFoundException(Class<?> commandType) {
        super(msg("No command handler is registered for '{}'", commandType.getName()));
        this.commandType = commandType;
    }
}
