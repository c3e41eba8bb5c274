package dk.cloudcreate.commandhandling.eventstore.types;

import dk.cloudcreate.commandhandling.eventstore.eventstream.*;
import dk.cloudcreate.essentials.types.LongType;

/**
 * Each event has its own unique position within its {@link EventStream}, also known as the event-order,
 * which defines the order in which the events were appended to the stream identified by a {@link StreamName}<br>
 * <br>
 * The first eventOrder has value 0.<br>
 * This is also commonly called the stream version, and it's a sequential ever-growing number
 * related to a <b>specific</b> stream (as opposed to the {@link PersistedEvent#globalEventOrder()} which contains
 * the order of ALL events appended to the same event store)
 */
public class EventOrder extends LongType<EventOrder> {
    /**
     * Special value that signifies that no events have been persisted in relation to a given stream (i.e. the stream doesn't exist)
     */
    public static final EventOrder NO_EVENTS_PERSISTED = EventOrder.of(-1);
    /**
     * Special value that contains the {@link EventOrder} of the FIRST Event persisted in a stream
     */
    public static final EventOrder FIRST_EVENT_ORDER   = EventOrder.of(0);

    public EventOrder(Long value) {
        super(value);
    }

    public static EventOrder of(long value) {
        return new EventOrder(value);
    }

    public EventOrder increaseAndGet() {
        return new EventOrder(value() + 1);
    }

    /**
     * Is this the {@link #NO_EVENTS_PERSISTED} value
     */
    public boolean isNoEventsPersisted() {
        return longValue() == NO_EVENTS_PERSISTED.longValue();
    }
}
