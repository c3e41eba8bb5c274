package dk.cloudcreate.commandhandling.eventstore.types;

import dk.cloudcreate.commandhandling.eventstore.EventStore;
import dk.cloudcreate.commandhandling.eventstore.eventstream.EventStream;
import dk.cloudcreate.essentials.types.LongType;

/**
 * The Global Order is a sequential ever-growing number, which tracks the order in which events have been appended to an {@link EventStore}
 * across all {@link EventStream}'s.<br>
 * The first global-event-order has value 1.
 */
public class GlobalEventOrder extends LongType<GlobalEventOrder> {
    /**
     * Special value that contains the {@link GlobalEventOrder} of the FIRST Event appended to an {@link EventStore}
     */
    public static final GlobalEventOrder FIRST_GLOBAL_EVENT_ORDER = GlobalEventOrder.of(1);

    public GlobalEventOrder(Long value) {
        super(value);
    }

    public static GlobalEventOrder of(long value) {
        return new GlobalEventOrder(value);
    }

    /**
     * @return the global event order that follows this one
     */
    public GlobalEventOrder increment() {
        return new GlobalEventOrder(value + 1);
    }
}
