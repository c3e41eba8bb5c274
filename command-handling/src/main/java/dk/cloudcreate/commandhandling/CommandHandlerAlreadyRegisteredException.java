package dk.cloudcreate.commandhandling;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

public class CommandHandlerAlreadyRegisteredException extends CommandHandlerConfigurationException {
    public final Class<?> commandType;

    public CommandHandlerAlreadyRegisteredException(Class<?> commandType) {
        super(msg("A command handler for '{}' has already been registered", commandType.getName()));
        this.commandType = commandType;
    }
}
