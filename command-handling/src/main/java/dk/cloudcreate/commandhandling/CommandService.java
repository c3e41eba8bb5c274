package dk.cloudcreate.commandhandling;

import dk.cloudcreate.commandhandling.eventstore.*;
import dk.cloudcreate.commandhandling.eventstore.eventstream.*;
import dk.cloudcreate.commandhandling.eventstore.types.EventOrder;
import dk.cloudcreate.commandhandling.state.AggregateState;
import dk.cloudcreate.essentials.shared.reflection.Reflector;
import org.slf4j.*;
import reactor.core.publisher.Mono;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Handles commands against event-sourced streams.<br>
 * Subclasses (or the code that owns the service) register one handler per command type using {@link #on(Class)} and
 * afterwards handle commands using {@link #handle(Object)}:
 * <pre>{@code
 * public class BookingService extends CommandService<BookingState> {
 *     public BookingService(EventStore eventStore) {
 *         super(BookingState.class, eventStore);
 *
 *         on(BookRoom.class)
 *                 .inState(ExpectedState.New)
 *                 .getStream(cmd -> StreamName.of("Booking", cmd.bookingId))
 *                 .act(cmd -> List.of(new RoomBooked(cmd.bookingId, cmd.roomId, cmd.price)));
 *     }
 * }
 * }</pre>
 * Handlers can just as well be registered on a plain instance:
 * <pre>{@code
 * var bookingService = new CommandService<>(BookingState.class, eventStore);
 * bookingService.on(BookRoom.class)
 *               .inState(ExpectedState.New)
 *               .getStream(cmd -> StreamName.of("Booking", cmd.bookingId))
 *               .act(cmd -> List.of(new RoomBooked(cmd.bookingId, cmd.roomId, cmd.price)));
 * }</pre>
 * Handling a command performs these steps:
 * <ol>
 *     <li>Resolve the stream name from the command</li>
 *     <li>Read the stream and check it against the handlers {@link ExpectedState}</li>
 *     <li>Fold the history into a fresh instance of the state type</li>
 *     <li>Call the decision</li>
 *     <li>Append the new events (if any) using the version that was read as the expected version</li>
 * </ol>
 * If another writer appended to the stream between the read and the append, the append fails with an
 * {@link dk.cloudcreate.commandhandling.eventstore.persistence.OptimisticAppendToStreamException}. No retry is performed.<br>
 * The handlers are built (and validated) by {@link #buildHandlers()}, which is otherwise called implicitly when the
 * first command is handled. After that no more handlers can be registered.
 *
 * @param <STATE> the aggregate state type
 */
public class CommandService<STATE extends AggregateState> {
    private static final Logger log = LoggerFactory.getLogger(CommandService.class);

    private final Class<STATE> stateType;
    private final EventReader  defaultReader;
    private final EventWriter  defaultWriter;

    /**
     * Guarded by <code>this</code>. Set to null when the handlers are built
     */
    private          Map<Class<?>, CommandHandlerBuilder<?, STATE>> builders = new LinkedHashMap<>();
    private volatile Map<Class<?>, RegisteredHandler<STATE>>        handlers;

    /**
     * Create a service where every handler must resolve its own reader and writer
     *
     * @param stateType the aggregate state type
     */
    public CommandService(Class<STATE> stateType) {
        this(stateType, null, null);
    }

    /**
     * @param stateType  the aggregate state type
     * @param eventStore the default reader and writer for handlers that don't resolve their own
     */
    public CommandService(Class<STATE> stateType, EventStore eventStore) {
        this(stateType, eventStore, requireNonNull(eventStore, "No eventStore provided"));
    }

    /**
     * @param stateType the aggregate state type
     * @param reader    the default reader for handlers that don't resolve their own (may be null)
     * @param writer    the default writer for handlers that don't resolve their own (may be null)
     */
    public CommandService(Class<STATE> stateType, EventReader reader, EventWriter writer) {
        this.stateType = requireNonNull(stateType, "No stateType provided");
        this.defaultReader = reader;
        this.defaultWriter = writer;
    }

    /**
     * Register the handler for a command type
     *
     * @param commandType the command type
     * @param <CMD>       the command type
     * @return the builder used to configure the handler
     * @throws CommandHandlerAlreadyRegisteredException if a handler for the command type has already been registered
     * @throws IllegalStateException                    if the handlers have already been built
     */
    public synchronized <CMD> CommandHandlerBuilder<CMD, STATE> on(Class<CMD> commandType) {
        requireNonNull(commandType, "No commandType provided");
        if (builders == null) {
            throw new IllegalStateException(msg("Cannot register a handler for '{}' after the handlers of '{}' have been built",
                                                commandType.getName(),
                                                getClass().getName()));
        }
        if (builders.containsKey(commandType)) {
            throw new CommandHandlerAlreadyRegisteredException(commandType);
        }
        var builder = new CommandHandlerBuilder<CMD, STATE>(commandType, defaultReader, defaultWriter);
        builders.put(commandType, builder);
        log.debug("[{}] Registered handler for command '{}'", getClass().getSimpleName(), commandType.getName());
        return builder;
    }

    /**
     * Validate and build all registered handlers. Calling this method more than once has no effect.
     *
     * @throws CommandHandlerConfigurationException if a handler is incompletely configured
     */
    public synchronized void buildHandlers() {
        if (handlers != null) {
            return;
        }
        var built = new LinkedHashMap<Class<?>, RegisteredHandler<STATE>>();
        builders.forEach((commandType, builder) -> built.put(commandType, builder.build()));
        handlers = Collections.unmodifiableMap(built);
        builders = null;
        log.info("[{}] Built {} command handler(s): {}", getClass().getSimpleName(), handlers.size(), handlers.values());
    }

    /**
     * The command types that have a registered handler
     */
    public Set<Class<?>> registeredCommandTypes() {
        return registeredHandlers().keySet();
    }

    /**
     * Handle the command. Nothing happens until the returned {@link Mono} is subscribed to and disposing the
     * subscription before the append stops the handling without writing anything.
     *
     * @param command the command
     * @return a {@link Mono} with the {@link CommandResult} or an error if the command couldn't be handled:
     * <ul>
     *     <li>{@link CommandHandlerNotFoundException} if no handler is registered for the command type</li>
     *     <li>{@link StreamAlreadyExistsException} if the handler expects a new stream, but it exists</li>
     *     <li>{@link StreamNotFoundException} if the handler expects an existing stream, but it doesn't exist</li>
     *     <li>{@link dk.cloudcreate.commandhandling.eventstore.persistence.OptimisticAppendToStreamException} if the stream changed concurrently</li>
     *     <li>any error raised by the resolvers, the decision or the event store</li>
     * </ul>
     */
    public Mono<CommandResult<STATE>> handle(Object command) {
        requireNonNull(command, "No command provided");
        return Mono.defer(() -> {
            var handler = registeredHandlers().get(command.getClass());
            if (handler == null) {
                return Mono.<CommandResult<STATE>>error(new CommandHandlerNotFoundException(command.getClass()));
            }
            return handler.resolveStreamName(command)
                          .flatMap(streamName -> handleOnStream(handler, streamName, command));
        });
    }

    private Mono<CommandResult<STATE>> handleOnStream(RegisteredHandler<STATE> handler, StreamName streamName, Object command) {
        var commandType = command.getClass();
        log.debug("[{}] Handling command '{}' on stream '{}' in ExpectedState.{}", getClass().getSimpleName(), commandType.getName(), streamName, handler.expectedState());
        return Mono.fromCallable(() -> loadHistory(handler, streamName, command))
                   .flatMap(history -> {
                       var state = newState();
                       state.applyAll(history.events);
                       return handler.decide(state, history.events, command)
                                     .flatMap(newEvents -> append(handler, streamName, command, state, history.lastEventOrder, newEvents));
                   })
                   .doOnError(e -> log.debug("[{}] Failed to handle command '{}' on stream '{}': {}", getClass().getSimpleName(), commandType.getName(), streamName, e.getMessage()));
    }

    private History loadHistory(RegisteredHandler<STATE> handler, StreamName streamName, Object command) {
        // A stream without any persisted events doesn't exist, no matter how the reader represents it
        var eventStream = handler.resolveReader(command)
                                 .readStream(streamName)
                                 .filter(stream -> !stream.lastEventOrder().isNoEventsPersisted());
        var commandType = command.getClass();
        switch (handler.expectedState()) {
            case New:
                if (eventStream.isPresent()) {
                    throw new StreamAlreadyExistsException(streamName, commandType, eventStream.get().lastEventOrder());
                }
                break;
            case Existing:
                if (eventStream.isEmpty()) {
                    throw new StreamNotFoundException(streamName, commandType);
                }
                break;
            case Any:
                break;
        }
        var history = eventStream.map(stream -> new History(stream.events(), stream.lastEventOrder()))
                                 .orElseGet(History::empty);
        log.trace("[{}] Loaded {} event(s) from stream '{}' - last eventOrder {}", getClass().getSimpleName(), history.events.size(), streamName, history.lastEventOrder);
        return history;
    }

    private Mono<CommandResult<STATE>> append(RegisteredHandler<STATE> handler,
                                              StreamName streamName,
                                              Object command,
                                              STATE state,
                                              EventOrder lastEventOrder,
                                              List<Object> newEvents) {
        if (newEvents.isEmpty()) {
            log.debug("[{}] Command '{}' on stream '{}' didn't result in any new events", getClass().getSimpleName(), command.getClass().getName(), streamName);
            return Mono.just(new CommandResult<>(streamName, state, List.of(), lastEventOrder, null));
        }
        var expectedVersion = handler.expectedStreamVersion(lastEventOrder);
        return Mono.fromCallable(() -> handler.resolveWriter(command).appendToStream(streamName, expectedVersion, newEvents))
                   .map(appendResult -> {
                       state.applyAll(newEvents);
                       log.debug("[{}] Command '{}' appended {} event(s) to stream '{}' - stream is now at eventOrder {}",
                                 getClass().getSimpleName(),
                                 command.getClass().getName(),
                                 newEvents.size(),
                                 streamName,
                                 appendResult.nextExpectedEventOrder);
                       return new CommandResult<>(streamName,
                                                  state,
                                                  newEvents,
                                                  appendResult.nextExpectedEventOrder,
                                                  appendResult.globalEventOrder().orElse(null));
                   });
    }

    private STATE newState() {
        return Reflector.reflectOn(stateType).newInstance();
    }

    private Map<Class<?>, RegisteredHandler<STATE>> registeredHandlers() {
        var currentHandlers = handlers;
        if (currentHandlers == null) {
            buildHandlers();
            currentHandlers = handlers;
        }
        return currentHandlers;
    }

    private static final class History {
        private final List<Object> events;
        private final EventOrder   lastEventOrder;

        private History(List<Object> events, EventOrder lastEventOrder) {
            this.events = events;
            this.lastEventOrder = lastEventOrder;
        }

        private static History empty() {
            return new History(List.of(), EventOrder.NO_EVENTS_PERSISTED);
        }
    }
}
