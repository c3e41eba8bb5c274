package dk.cloudcreate.commandhandling;

import dk.cloudcreate.commandhandling.eventstore.eventstream.StreamName;

/**
 * Derives the name of the stream a command targets
 *
 * @param <CMD> the command type
 */
@FunctionalInterface
public interface StreamNameResolver<CMD> {
    StreamName resolveStreamName(CMD command);
}
