package dk.cloudcreate.commandhandling;

import dk.cloudcreate.commandhandling.state.AggregateState;

import java.util.List;

/**
 * The domain decision for a command: given the folded state, the events it was folded from and the command,
 * return the new events (may be empty).
 *
 * @param <STATE> the aggregate state type
 * @param <CMD>   the command type
 */
@FunctionalInterface
public interface CommandDecision<STATE extends AggregateState, CMD> {
    List<?> decide(STATE state, List<Object> priorEvents, CMD command);
}
