package dk.cloudcreate.commandhandling;

import dk.cloudcreate.commandhandling.eventstore.*;
import dk.cloudcreate.commandhandling.eventstore.eventstream.StreamName;
import dk.cloudcreate.commandhandling.state.AggregateState;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.function.Function;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Fluent configuration of how a single command type is handled. Obtained from {@link CommandService#on(Class)}:
 * <pre>{@code
 * on(BookRoom.class)
 *         .inState(ExpectedState.New)
 *         .getStream(cmd -> StreamName.of("Booking", cmd.bookingId))
 *         .act(cmd -> List.of(new RoomBooked(cmd.bookingId, cmd.roomId, cmd.checkIn, cmd.checkOut, cmd.price)));
 *
 * on(RecordPayment.class)
 *         .inState(ExpectedState.Existing)
 *         .getStream(cmd -> StreamName.of("Booking", cmd.bookingId))
 *         .act((state, priorEvents, cmd) -> Bookings.recordPayment(state, cmd));
 * }</pre>
 * The configuration is validated once, when the {@link CommandService} builds its handlers (see {@link CommandService#buildHandlers()}).
 *
 * @param <CMD>   the command type
 * @param <STATE> the aggregate state type
 */
public final class CommandHandlerBuilder<CMD, STATE extends AggregateState> {
    private final Class<CMD>  commandType;
    private final EventReader defaultReader;
    private final EventWriter defaultWriter;

    private ExpectedState                                expectedState = ExpectedState.Any;
    private Function<Object, Mono<StreamName>>           streamNameResolver;
    private RegisteredHandler.UntypedDecision<STATE>     decision;
    private Function<? super CMD, ? extends EventReader> readerResolver;
    private Function<? super CMD, ? extends EventWriter> writerResolver;

    /**
     * @param commandType   the command type
     * @param defaultReader the reader used if no reader resolver is configured (may be null)
     * @param defaultWriter the writer used if no writer resolver is configured (may be null)
     */
    CommandHandlerBuilder(Class<CMD> commandType, EventReader defaultReader, EventWriter defaultWriter) {
        this.commandType = requireNonNull(commandType, "No commandType provided");
        this.defaultReader = defaultReader;
        this.defaultWriter = defaultWriter;
    }

    /**
     * Defines the expected stream state for handling the command. Defaults to {@link ExpectedState#Any}
     *
     * @param expectedState the expected stream state
     * @return this builder
     */
    public CommandHandlerBuilder<CMD, STATE> inState(ExpectedState expectedState) {
        this.expectedState = requireNonNull(expectedState, "No expectedState provided");
        return this;
    }

    /**
     * Defines how to get the stream name from the command
     *
     * @param streamNameResolver function that resolves the stream name from the command
     * @return this builder
     */
    public CommandHandlerBuilder<CMD, STATE> getStream(StreamNameResolver<CMD> streamNameResolver) {
        requireNonNull(streamNameResolver, "No streamNameResolver provided");
        this.streamNameResolver = command -> Mono.fromCallable(() -> streamNameResolver.resolveStreamName(commandType.cast(command)));
        return this;
    }

    /**
     * Defines how to get the stream name from the command, asynchronously
     *
     * @param streamNameResolver function that resolves the stream name from the command
     * @return this builder
     */
    public CommandHandlerBuilder<CMD, STATE> getStreamAsync(AsyncStreamNameResolver<CMD> streamNameResolver) {
        requireNonNull(streamNameResolver, "No streamNameResolver provided");
        this.streamNameResolver = command -> requireNonNull(streamNameResolver.resolveStreamName(commandType.cast(command)),
                                                            msg("The async stream name resolver for command '{}' returned null", commandType.getName()));
        return this;
    }

    /**
     * Defines the decision to take on the stream for the command
     *
     * @param decision function that decides which new events the command results in
     * @return this builder
     */
    public CommandHandlerBuilder<CMD, STATE> act(CommandDecision<STATE, CMD> decision) {
        requireNonNull(decision, "No decision provided");
        this.decision = (state, priorEvents, command) -> Mono.fromCallable(() -> toEventList(decision.decide(state, priorEvents, commandType.cast(command))));
        return this;
    }

    /**
     * Defines the decision to take on the stream for the command, asynchronously
     *
     * @param decision function that decides which new events the command results in
     * @return this builder
     */
    public CommandHandlerBuilder<CMD, STATE> actAsync(AsyncCommandDecision<STATE, CMD> decision) {
        requireNonNull(decision, "No decision provided");
        this.decision = (state, priorEvents, command) -> requireNonNull(decision.decide(state, priorEvents, commandType.cast(command)),
                                                                        msg("The async decision for command '{}' returned null", commandType.getName()))
                .map(this::toEventList);
        return this;
    }

    /**
     * Defines the decision to take on a new stream for the command.<br>
     * Only allowed after {@link #inState(ExpectedState)} has been called with {@link ExpectedState#New}
     *
     * @param decision function that decides which new events the command results in
     * @return this builder
     * @throws CommandHandlerConfigurationException if the expected state isn't {@link ExpectedState#New}
     */
    public CommandHandlerBuilder<CMD, STATE> act(NewStreamDecision<CMD> decision) {
        requireNonNull(decision, "No decision provided");
        requireExpectedStateIsNew();
        this.decision = (state, priorEvents, command) -> Mono.fromCallable(() -> toEventList(decision.decide(commandType.cast(command))));
        return this;
    }

    /**
     * Defines the decision to take on a new stream for the command, asynchronously.<br>
     * Only allowed after {@link #inState(ExpectedState)} has been called with {@link ExpectedState#New}
     *
     * @param decision function that decides which new events the command results in
     * @return this builder
     * @throws CommandHandlerConfigurationException if the expected state isn't {@link ExpectedState#New}
     */
    public CommandHandlerBuilder<CMD, STATE> actAsync(AsyncNewStreamDecision<CMD> decision) {
        requireNonNull(decision, "No decision provided");
        requireExpectedStateIsNew();
        this.decision = (state, priorEvents, command) -> requireNonNull(decision.decide(commandType.cast(command)),
                                                                        msg("The async decision for command '{}' returned null", commandType.getName()))
                .map(this::toEventList);
        return this;
    }

    /**
     * Defines how to resolve the event reader from the command.
     * If not defined, the reader provided to the {@link CommandService} will be used.
     *
     * @param readerResolver function to resolve the event reader
     * @return this builder
     */
    public CommandHandlerBuilder<CMD, STATE> resolveReader(Function<? super CMD, ? extends EventReader> readerResolver) {
        this.readerResolver = requireNonNull(readerResolver, "No readerResolver provided");
        return this;
    }

    /**
     * Defines how to resolve the event writer from the command.
     * If not defined, the writer provided to the {@link CommandService} will be used.
     *
     * @param writerResolver function to resolve the event writer
     * @return this builder
     */
    public CommandHandlerBuilder<CMD, STATE> resolveWriter(Function<? super CMD, ? extends EventWriter> writerResolver) {
        this.writerResolver = requireNonNull(writerResolver, "No writerResolver provided");
        return this;
    }

    /**
     * Defines how to resolve the event store from the command. It's used as reader and writer,
     * unless {@link #resolveReader(Function)} or {@link #resolveWriter(Function)} has already been called.
     *
     * @param storeResolver function to resolve the event store
     * @return this builder
     */
    public CommandHandlerBuilder<CMD, STATE> resolveStore(Function<? super CMD, ? extends EventStore> storeResolver) {
        requireNonNull(storeResolver, "No storeResolver provided");
        if (readerResolver == null) {
            readerResolver = storeResolver;
        }
        if (writerResolver == null) {
            writerResolver = storeResolver;
        }
        return this;
    }

    /**
     * Validate the configuration and create the {@link RegisteredHandler}. Doesn't change the builder.
     *
     * @return the immutable handler
     * @throws CommandHandlerConfigurationException if the stream name resolver or the decision is missing, or
     *                                              if there's no reader or writer for the command
     */
    RegisteredHandler<STATE> build() {
        if (streamNameResolver == null) {
            throw new CommandHandlerConfigurationException(msg("Function to get the stream name from '{}' is not defined", commandType.getName()));
        }
        if (decision == null) {
            throw new CommandHandlerConfigurationException(msg("Function to act on the stream for command '{}' is not defined", commandType.getName()));
        }
        return new RegisteredHandler<>(commandType,
                                       expectedState,
                                       streamNameResolver,
                                       decision,
                                       readerFunction(),
                                       writerFunction());
    }

    private Function<Object, EventReader> readerFunction() {
        if (readerResolver != null) {
            var resolver = readerResolver;
            return command -> resolver.apply(commandType.cast(command));
        }
        if (defaultReader == null) {
            throw new CommandHandlerConfigurationException(msg("No EventReader is available for command '{}'. Either call resolveReader/resolveStore or provide a default EventReader to the CommandService",
                                                               commandType.getName()));
        }
        var reader = defaultReader;
        return command -> reader;
    }

    private Function<Object, EventWriter> writerFunction() {
        if (writerResolver != null) {
            var resolver = writerResolver;
            return command -> resolver.apply(commandType.cast(command));
        }
        if (defaultWriter == null) {
            throw new CommandHandlerConfigurationException(msg("No EventWriter is available for command '{}'. Either call resolveWriter/resolveStore or provide a default EventWriter to the CommandService",
                                                               commandType.getName()));
        }
        var writer = defaultWriter;
        return command -> writer;
    }

    private void requireExpectedStateIsNew() {
        if (expectedState != ExpectedState.New) {
            throw new CommandHandlerConfigurationException(msg("A decision without state is only allowed for new streams, but command '{}' is registered with ExpectedState.{}",
                                                               commandType.getName(),
                                                               expectedState));
        }
    }

    private List<Object> toEventList(List<?> events) {
        requireNonNull(events, msg("The decision for command '{}' returned null instead of a list of events", commandType.getName()));
        return List.copyOf(events);
    }

    Class<CMD> commandType() {
        return commandType;
    }
}
