package dk.cloudcreate.commandhandling.eventstore;

/**
 * An event store that can both read and append events, usable wherever an {@link EventReader} or an {@link EventWriter} is requested
 */
public interface EventStore extends EventReader, EventWriter {
}
