package dk.cloudcreate.commandhandling;

import dk.cloudcreate.commandhandling.eventstore.*;
import dk.cloudcreate.commandhandling.eventstore.eventstream.StreamName;
import dk.cloudcreate.commandhandling.eventstore.types.*;
import dk.cloudcreate.commandhandling.state.AggregateState;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.function.Function;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * The immutable result of {@link CommandHandlerBuilder#build()}: everything the {@link CommandService} needs to handle
 * one command type. The functions it holds were specialized to the command type by the builder, so no further type
 * checks are needed when a command is handled. A single instance is shared by all concurrent invocations.
 *
 * @param <STATE> the aggregate state type
 */
public final class RegisteredHandler<STATE extends AggregateState> {
    /**
     * The decision with the command type erased. Synchronous decisions have been adapted to this signature by the builder.
     */
    @FunctionalInterface
    interface UntypedDecision<STATE extends AggregateState> {
        Mono<List<Object>> decide(STATE state, List<Object> priorEvents, Object command);
    }

    private final Class<?>                           commandType;
    private final ExpectedState                      expectedState;
    private final Function<Object, Mono<StreamName>> streamNameResolver;
    private final UntypedDecision<STATE>             decision;
    private final Function<Object, EventReader>      readerResolver;
    private final Function<Object, EventWriter>      writerResolver;

    RegisteredHandler(Class<?> commandType,
                      ExpectedState expectedState,
                      Function<Object, Mono<StreamName>> streamNameResolver,
                      UntypedDecision<STATE> decision,
                      Function<Object, EventReader> readerResolver,
                      Function<Object, EventWriter> writerResolver) {
        this.commandType = requireNonNull(commandType, "No commandType provided");
        this.expectedState = requireNonNull(expectedState, "No expectedState provided");
        this.streamNameResolver = requireNonNull(streamNameResolver, "No streamNameResolver provided");
        this.decision = requireNonNull(decision, "No decision provided");
        this.readerResolver = requireNonNull(readerResolver, "No readerResolver provided");
        this.writerResolver = requireNonNull(writerResolver, "No writerResolver provided");
    }

    public Class<?> commandType() {
        return commandType;
    }

    public ExpectedState expectedState() {
        return expectedState;
    }

    Mono<StreamName> resolveStreamName(Object command) {
        return Mono.defer(() -> streamNameResolver.apply(command))
                   .switchIfEmpty(Mono.error(() -> new CommandServiceException(msg("The stream name resolver for command '{}' didn't resolve a stream name",
                                                                                   commandType.getName()))));
    }

    Mono<List<Object>> decide(STATE state, List<Object> priorEvents, Object command) {
        return Mono.defer(() -> decision.decide(state, priorEvents, command))
                   .defaultIfEmpty(List.of());
    }

    EventReader resolveReader(Object command) {
        return requireNonNull(readerResolver.apply(command),
                              msg("The EventReader resolver for command '{}' returned null", commandType.getName()));
    }

    EventWriter resolveWriter(Object command) {
        return requireNonNull(writerResolver.apply(command),
                              msg("The EventWriter resolver for command '{}' returned null", commandType.getName()));
    }

    /**
     * The version the stream is expected to be at when the new events are appended
     *
     * @param lastEventOrder the event order of the last event read or {@link EventOrder#NO_EVENTS_PERSISTED} if the stream didn't exist
     */
    ExpectedStreamVersion expectedStreamVersion(EventOrder lastEventOrder) {
        switch (expectedState) {
            case New:
                return ExpectedStreamVersion.NO_STREAM;
            case Existing:
                return ExpectedStreamVersion.exactly(lastEventOrder);
            case Any:
                return lastEventOrder.isNoEventsPersisted() ? ExpectedStreamVersion.NO_STREAM : ExpectedStreamVersion.exactly(lastEventOrder);
            default:
                throw new IllegalStateException(msg("Unsupported ExpectedState '{}'", expectedState));
        }
    }

    @Override
    public String toString() {
        return "RegisteredHandler{" +
                "commandType=" + commandType.getName() +
                ", expectedState=" + expectedState +
                '}';
    }
}
