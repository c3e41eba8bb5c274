package dk.cloudcreate.commandhandling.eventstore.inmemory;

import dk.cloudcreate.commandhandling.eventstore.*;
import dk.cloudcreate.commandhandling.eventstore.bus.*;
import dk.cloudcreate.commandhandling.eventstore.eventstream.*;
import dk.cloudcreate.commandhandling.eventstore.persistence.OptimisticAppendToStreamException;
import dk.cloudcreate.commandhandling.eventstore.types.*;
import org.slf4j.*;

import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Non durable {@link EventStore} that keeps every stream in memory.<br>
 * Appends are serialized, so the expected version check and the append itself happen atomically.
 * Reads never block and always see a consistent snapshot of a stream.<br>
 * Every successful append is published as {@link PersistedEvents} on the {@link #localEventBus()}
 */
public class InMemoryEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

    /**
     * Key: the stream name<br>
     * Value: the immutable list of events in the stream, ordered by event order
     */
    private final ConcurrentMap<StreamName, List<PersistedEvent>> streams = new ConcurrentHashMap<>();
    private final Clock                                           clock;
    private final EventStoreLocalEventBus                         localEventBus;
    /**
     * Guarded by <code>this</code>
     */
    private       GlobalEventOrder                                nextGlobalEventOrder;

    public InMemoryEventStore() {
        this(Clock.systemUTC());
    }

    public InMemoryEventStore(Clock clock) {
        this.clock = requireNonNull(clock, "No clock provided");
        this.localEventBus = new EventStoreLocalEventBus("InMemoryEventStoreLocalBus");
        this.nextGlobalEventOrder = GlobalEventOrder.FIRST_GLOBAL_EVENT_ORDER;
    }

    /**
     * The bus on which all appended events are published
     */
    public EventStoreLocalEventBus localEventBus() {
        return localEventBus;
    }

    @Override
    public Optional<EventStream> readStream(StreamName streamName, EventOrder fromEventOrder) {
        requireNonNull(streamName, "No streamName provided");
        requireNonNull(fromEventOrder, "No fromEventOrder provided");
        var events = streams.get(streamName);
        if (events == null) {
            log.trace("Stream '{}' doesn't exist", streamName);
            return Optional.empty();
        }
        var lastEventOrder = events.get(events.size() - 1).eventOrder();
        var eventsToInclude = events.stream()
                                    .filter(persistedEvent -> persistedEvent.eventOrder().longValue() >= fromEventOrder.longValue())
                                    .collect(Collectors.toList());
        log.trace("Read {} event(s) from stream '{}' starting from eventOrder {}", eventsToInclude.size(), streamName, fromEventOrder);
        return Optional.of(EventStream.of(streamName, eventsToInclude, lastEventOrder));
    }

    @Override
    public boolean streamExists(StreamName streamName) {
        requireNonNull(streamName, "No streamName provided");
        return streams.containsKey(streamName);
    }

    /**
     * Appends atomically. The resulting {@link PersistedEvents} are published on the {@link #localEventBus()} after the append
     * has completed and outside the store's lock, so sync subscribers may append to this store themselves.
     * Publications from appends to different streams, racing each other, may therefore be observed out of global event order.
     */
    @Override
    public AppendEventsResult appendToStream(StreamName streamName, ExpectedStreamVersion expectedVersion, List<?> events) {
        requireNonNull(streamName, "No streamName provided");
        requireNonNull(expectedVersion, "No expectedVersion provided");
        requireNonNull(events, "No events provided");

        var result = appendAtomically(streamName, expectedVersion, events);
        if (!result.persistedEvents.isEmpty()) {
            localEventBus.publish(new PersistedEvents(streamName, result.persistedEvents));
        }
        return result;
    }

    private synchronized AppendEventsResult appendAtomically(StreamName streamName, ExpectedStreamVersion expectedVersion, List<?> events) {
        var existingEvents      = streams.getOrDefault(streamName, List.of());
        var currentEventOrder   = existingEvents.isEmpty() ? EventOrder.NO_EVENTS_PERSISTED : existingEvents.get(existingEvents.size() - 1).eventOrder();
        if (!expectedVersion.isSatisfiedBy(currentEventOrder)) {
            log.debug("Rejecting append of {} event(s) to stream '{}' - expected version {} but the stream is at {}",
                      events.size(),
                      streamName,
                      expectedVersion,
                      currentEventOrder);
            throw new OptimisticAppendToStreamException(streamName, expectedVersion, currentEventOrder);
        }
        if (events.isEmpty()) {
            return new AppendEventsResult(streamName, List.of(), currentEventOrder);
        }

        var timestamp       = OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);
        var eventOrder      = currentEventOrder;
        var globalOrder     = nextGlobalEventOrder;
        var persistedEvents = new ArrayList<PersistedEvent>(events.size());
        for (var event : events) {
            requireNonNull(event, "Cannot append a null event");
            eventOrder = eventOrder.increaseAndGet();
            persistedEvents.add(PersistedEvent.from(streamName, eventOrder, globalOrder, event, timestamp));
            globalOrder = globalOrder.increment();
        }

        var allEvents = new ArrayList<PersistedEvent>(existingEvents.size() + persistedEvents.size());
        allEvents.addAll(existingEvents);
        allEvents.addAll(persistedEvents);
        streams.put(streamName, Collections.unmodifiableList(allEvents));
        nextGlobalEventOrder = globalOrder;
        log.debug("Appended {} event(s) to stream '{}' - stream is now at eventOrder {}", persistedEvents.size(), streamName, eventOrder);
        return new AppendEventsResult(streamName, persistedEvents, eventOrder);
    }

    /**
     * Remove all streams. The global event order is not reset.
     */
    public synchronized void clear() {
        streams.clear();
    }
}
