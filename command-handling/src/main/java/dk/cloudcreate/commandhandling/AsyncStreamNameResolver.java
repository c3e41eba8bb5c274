package dk.cloudcreate.commandhandling;

import dk.cloudcreate.commandhandling.eventstore.eventstream.StreamName;
import reactor.core.publisher.Mono;

/**
 * Derives the name of the stream a command targets, e.g. by looking it up in another store.<br>
 * The returned {@link Mono} is cancelled if the command invocation is cancelled.
 *
 * @param <CMD> the command type
 */
@FunctionalInterface
public interface AsyncStreamNameResolver<CMD> {
    Mono<StreamName> resolveStreamName(CMD command);
}
