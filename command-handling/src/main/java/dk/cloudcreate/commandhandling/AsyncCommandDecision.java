package dk.cloudcreate.commandhandling;

import dk.cloudcreate.commandhandling.state.AggregateState;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Asynchronous variant of {@link CommandDecision}. The returned {@link Mono} is cancelled if the
 * command invocation is cancelled, and an empty {@link Mono} is treated as "no new events".
 *
 * @param <STATE> the aggregate state type
 * @param <CMD>   the command type
 */
@FunctionalInterface
public interface AsyncCommandDecision<STATE extends AggregateState, CMD> {
    Mono<? extends List<?>> decide(STATE state, List<Object> priorEvents, CMD command);
}
