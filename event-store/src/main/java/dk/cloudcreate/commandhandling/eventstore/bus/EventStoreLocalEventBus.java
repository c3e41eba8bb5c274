package dk.cloudcreate.commandhandling.eventstore.bus;

import dk.cloudcreate.essentials.reactive.LocalEventBus;
import org.slf4j.*;

import java.util.function.Consumer;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * In process notification of {@link PersistedEvents}. Sync subscribers are called on the appending thread before the append returns,
 * async subscribers are called on the bus' own threads.
 */
public class EventStoreLocalEventBus {
    private static final Logger log = LoggerFactory.getLogger("EventStoreLocalEventBus");

    private final LocalEventBus<PersistedEvents> localEventBus;

    public EventStoreLocalEventBus(String busName) {
        requireNonNull(busName, "No busName provided");
        localEventBus = new LocalEventBus<PersistedEvents>(busName,
                                                           3,
                                                           this::onErrorHandler);
    }

    public LocalEventBus<PersistedEvents> localEventBus() {
        return localEventBus;
    }

    public void publish(PersistedEvents persistedEvents) {
        requireNonNull(persistedEvents, "No persistedEvents provided");
        if (persistedEvents.events.isEmpty()) {
            return;
        }
        log.trace("Publishing {}", persistedEvents);
        localEventBus.publish(persistedEvents);
    }

    private void onErrorHandler(Consumer<PersistedEvents> persistedEventsConsumer, PersistedEvents persistedEvents, Exception e) {
        log.error(msg("Failed to publish {} to consumer {}", persistedEvents, persistedEventsConsumer.getClass().getName()), e);
    }

    public LocalEventBus<PersistedEvents> addAsyncSubscriber(Consumer<PersistedEvents> subscriber) {
        return localEventBus.addAsyncSubscriber(subscriber);
    }

    public LocalEventBus<PersistedEvents> addSyncSubscriber(Consumer<PersistedEvents> subscriber) {
        return localEventBus.addSyncSubscriber(subscriber);
    }
}
