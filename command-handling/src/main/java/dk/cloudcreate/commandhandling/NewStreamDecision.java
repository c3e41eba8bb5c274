package dk.cloudcreate.commandhandling;

import java.util.List;

/**
 * Decision for commands that create a new stream, where there's no prior state to consider.<br>
 * Only allowed in combination with {@link ExpectedState#New}
 *
 * @param <CMD> the command type
 */
@FunctionalInterface
public interface NewStreamDecision<CMD> {
    List<?> decide(CMD command);
}
