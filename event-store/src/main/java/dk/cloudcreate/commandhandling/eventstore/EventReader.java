package dk.cloudcreate.commandhandling.eventstore;

import dk.cloudcreate.commandhandling.eventstore.eventstream.*;
import dk.cloudcreate.commandhandling.eventstore.types.EventOrder;

import java.util.Optional;

/**
 * Read side of an event store: loads the history of a single stream
 */
public interface EventReader {
    /**
     * Load all events in the stream
     *
     * @param streamName the name of the stream
     * @return an {@link Optional} with the {@link EventStream} or {@link Optional#empty()} in case the stream doesn't exist
     */
    default Optional<EventStream> readStream(StreamName streamName) {
        return readStream(streamName, EventOrder.FIRST_EVENT_ORDER);
    }

    /**
     * Load the events in the stream having an {@link PersistedEvent#eventOrder()} greater than or equal to <code>fromEventOrder</code>
     *
     * @param streamName     the name of the stream
     * @param fromEventOrder the event order of the first event to include
     * @return an {@link Optional} with the {@link EventStream} or {@link Optional#empty()} in case the stream doesn't exist
     */
    Optional<EventStream> readStream(StreamName streamName, EventOrder fromEventOrder);

    /**
     * Check if a stream with the given name contains any events
     *
     * @param streamName the name of the stream
     * @return true if the stream exists
     */
    default boolean streamExists(StreamName streamName) {
        return readStream(streamName).map(eventStream -> !eventStream.lastEventOrder().isNoEventsPersisted())
                                     .orElse(false);
    }
}
