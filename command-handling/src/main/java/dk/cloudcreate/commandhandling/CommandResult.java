package dk.cloudcreate.commandhandling;

import dk.cloudcreate.commandhandling.eventstore.eventstream.StreamName;
import dk.cloudcreate.commandhandling.eventstore.types.*;
import dk.cloudcreate.commandhandling.state.AggregateState;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The successful outcome of {@link CommandService#handle(Object)}
 *
 * @param <STATE> the aggregate state type
 */
public final class CommandResult<STATE extends AggregateState> {
    public final StreamName   streamName;
    /**
     * The state after the new events have been applied
     */
    public final STATE        state;
    /**
     * The events the decision produced, in the order they were appended
     */
    public final List<Object> newEvents;
    /**
     * The {@link EventOrder} of the last event in the stream after handling the command.
     * If no events were appended, this is the event order the stream was read at
     * (which is {@link EventOrder#NO_EVENTS_PERSISTED} for a stream that doesn't exist)
     */
    public final EventOrder   newVersion;

    private final GlobalEventOrder globalEventOrder;

    CommandResult(StreamName streamName, STATE state, List<Object> newEvents, EventOrder newVersion, GlobalEventOrder globalEventOrder) {
        this.streamName = requireNonNull(streamName, "No streamName provided");
        this.state = requireNonNull(state, "No state provided");
        this.newEvents = List.copyOf(requireNonNull(newEvents, "No newEvents provided"));
        this.newVersion = requireNonNull(newVersion, "No newVersion provided");
        this.globalEventOrder = globalEventOrder;
    }

    /**
     * The {@link GlobalEventOrder} of the last appended event or {@link Optional#empty()} if no events were appended
     */
    public Optional<GlobalEventOrder> globalEventOrder() {
        return Optional.ofNullable(globalEventOrder);
    }

    /**
     * Did handling the command result in any new events
     */
    public boolean hasChanges() {
        return !newEvents.isEmpty();
    }

    @Override
    public String toString() {
        return "CommandResult{" +
                "streamName=" + streamName +
                ", newEvents=" + newEvents.size() +
                ", newVersion=" + newVersion +
                ", globalEventOrder=" + globalEventOrder +
                '}';
    }
}
