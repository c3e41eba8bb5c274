package dk.cloudcreate.commandhandling;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Asynchronous variant of {@link NewStreamDecision}. Only allowed in combination with {@link ExpectedState#New}
 *
 * @param <CMD> the command type
 */
@FunctionalInterface
public interface AsyncNewStreamDecision<CMD> {
    Mono<? extends List<?>> decide(CMD command);
}
