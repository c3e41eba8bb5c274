package dk.cloudcreate.commandhandling;

import dk.cloudcreate.commandhandling.eventstore.*;
import dk.cloudcreate.commandhandling.eventstore.eventstream.StreamName;
import dk.cloudcreate.commandhandling.eventstore.inmemory.InMemoryEventStore;
import dk.cloudcreate.commandhandling.eventstore.types.*;
import dk.cloudcreate.commandhandling.test_data.*;
import org.junit.jupiter.api.*;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static dk.cloudcreate.commandhandling.test_data.BookingCommands.*;
import static dk.cloudcreate.commandhandling.test_data.BookingEvents.*;
import static org.assertj.core.api.Assertions.*;

class CommandHandlerBuilderTest {
    private static final BookRoom BOOK_ROOM = new BookRoom(BookingId.of("B1"), "R1", LocalDate.of(2023, 10, 1), LocalDate.of(2023, 10, 4), BigDecimal.TEN);

    private InMemoryEventStore eventStore;

    @BeforeEach
    void setup() {
        eventStore = new InMemoryEventStore();
    }

    @Test
    void build_fails_if_the_stream_name_resolver_is_missing() {
        // Given
        var builder = builder(BookRoom.class)
                .inState(ExpectedState.New)
                .act(cmd -> List.of());

        // When / Then
        assertThatThrownBy(builder::build)
                .isExactlyInstanceOf(CommandHandlerConfigurationException.class)
                .hasMessageContaining("stream name")
                .hasMessageContaining(BookRoom.class.getName());
    }

    @Test
    void build_fails_if_the_decision_is_missing() {
        // Given
        var builder = builder(BookRoom.class)
                .inState(ExpectedState.New)
                .getStream(cmd -> StreamName.of("Booking", cmd.bookingId));

        // When / Then
        assertThatThrownBy(builder::build)
                .isExactlyInstanceOf(CommandHandlerConfigurationException.class)
                .hasMessageContaining("act on the stream")
                .hasMessageContaining(BookRoom.class.getName());
    }

    @Test
    void a_decision_without_state_is_rejected_unless_the_stream_is_new() {
        assertThatThrownBy(() -> builder(BookRoom.class).inState(ExpectedState.Existing).act(cmd -> List.of()))
                .isExactlyInstanceOf(CommandHandlerConfigurationException.class)
                .hasMessageContaining("only allowed for new streams");
        assertThatThrownBy(() -> builder(BookRoom.class).act(cmd -> List.of()))
                .isExactlyInstanceOf(CommandHandlerConfigurationException.class);
        assertThatThrownBy(() -> builder(BookRoom.class).inState(ExpectedState.Any).actAsync(cmd -> Mono.just(List.of())))
                .isExactlyInstanceOf(CommandHandlerConfigurationException.class);
    }

    @Test
    void the_default_expected_state_is_any() {
        // Given
        var handler = builder(AddBookingNote.class)
                .getStream(cmd -> StreamName.of("Booking", cmd.bookingId))
                .act((state, priorEvents, cmd) -> List.of())
                .build();

        // Then
        assertThat(handler.expectedState()).isEqualTo(ExpectedState.Any);
        assertThat(handler.commandType()).isEqualTo(AddBookingNote.class);
    }

    @Test
    void null_arguments_are_rejected() {
        var builder = builder(BookRoom.class);

        assertThatThrownBy(() -> builder.inState(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.getStream(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.getStreamAsync(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.resolveReader(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.resolveWriter(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.resolveStore(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void build_fails_without_a_reader_or_writer() {
        // Given
        var withoutReader = new CommandHandlerBuilder<BookRoom, BookingState>(BookRoom.class, null, eventStore)
                .inState(ExpectedState.New)
                .getStream(cmd -> StreamName.of("Booking", cmd.bookingId))
                .act(cmd -> List.of());
        var withoutWriter = new CommandHandlerBuilder<BookRoom, BookingState>(BookRoom.class, eventStore, null)
                .inState(ExpectedState.New)
                .getStream(cmd -> StreamName.of("Booking", cmd.bookingId))
                .act(cmd -> List.of());

        // When / Then
        assertThatThrownBy(withoutReader::build)
                .isExactlyInstanceOf(CommandHandlerConfigurationException.class)
                .hasMessageContaining("EventReader");
        assertThatThrownBy(withoutWriter::build)
                .isExactlyInstanceOf(CommandHandlerConfigurationException.class)
                .hasMessageContaining("EventWriter");
    }

    @Test
    void the_default_reader_and_writer_are_used_when_no_resolver_is_configured() {
        // Given
        var handler = builder(BookRoom.class)
                .inState(ExpectedState.New)
                .getStream(cmd -> StreamName.of("Booking", cmd.bookingId))
                .act(cmd -> List.of())
                .build();

        // Then
        assertThat(handler.resolveReader(BOOK_ROOM)).isSameAs(eventStore);
        assertThat(handler.resolveWriter(BOOK_ROOM)).isSameAs(eventStore);
    }

    @Test
    void an_explicit_resolver_wins_over_the_default() {
        // Given
        var otherStore = new InMemoryEventStore();
        var handler = builder(BookRoom.class)
                .inState(ExpectedState.New)
                .getStream(cmd -> StreamName.of("Booking", cmd.bookingId))
                .resolveReader(cmd -> otherStore)
                .act(cmd -> List.of())
                .build();

        // Then
        assertThat(handler.resolveReader(BOOK_ROOM)).isSameAs(otherStore);
        assertThat(handler.resolveWriter(BOOK_ROOM)).isSameAs(eventStore);
    }

    @Test
    void resolve_store_does_not_override_an_explicit_reader_or_writer() {
        // Given
        var readerStore = new InMemoryEventStore();
        var writerStore = new InMemoryEventStore();
        var otherStore  = new InMemoryEventStore();

        // When
        var readerFirst = builder(BookRoom.class)
                .inState(ExpectedState.New)
                .getStream(cmd -> StreamName.of("Booking", cmd.bookingId))
                .resolveReader(cmd -> readerStore)
                .resolveStore(cmd -> otherStore)
                .act(cmd -> List.of())
                .build();
        var writerFirst = builder(BookRoom.class)
                .inState(ExpectedState.New)
                .getStream(cmd -> StreamName.of("Booking", cmd.bookingId))
                .resolveWriter(cmd -> writerStore)
                .resolveStore(cmd -> otherStore)
                .act(cmd -> List.of())
                .build();

        // Then
        assertThat(readerFirst.resolveReader(BOOK_ROOM)).isSameAs(readerStore);
        assertThat(readerFirst.resolveWriter(BOOK_ROOM)).isSameAs(otherStore);
        assertThat(writerFirst.resolveReader(BOOK_ROOM)).isSameAs(otherStore);
        assertThat(writerFirst.resolveWriter(BOOK_ROOM)).isSameAs(writerStore);
    }

    @Test
    void an_explicit_resolver_after_resolve_store_replaces_that_role() {
        // Given
        var readerStore = new InMemoryEventStore();
        var otherStore  = new InMemoryEventStore();

        // When
        var handler = builder(BookRoom.class)
                .inState(ExpectedState.New)
                .getStream(cmd -> StreamName.of("Booking", cmd.bookingId))
                .resolveStore(cmd -> otherStore)
                .resolveReader(cmd -> readerStore)
                .act(cmd -> List.of())
                .build();

        // Then
        assertThat(handler.resolveReader(BOOK_ROOM)).isSameAs(readerStore);
        assertThat(handler.resolveWriter(BOOK_ROOM)).isSameAs(otherStore);
    }

    @Test
    void build_is_idempotent() {
        // Given
        var builder = builder(BookRoom.class)
                .inState(ExpectedState.New)
                .getStream(cmd -> StreamName.of("Booking", cmd.bookingId))
                .act(cmd -> List.of(new RoomBooked(cmd.bookingId, cmd.roomId, cmd.checkIn, cmd.checkOut, cmd.price)));

        // When
        var first  = builder.build();
        var second = builder.build();

        // Then
        assertThat(first).isNotSameAs(second);
        assertThat(first.expectedState()).isEqualTo(second.expectedState());
        assertThat(first.decide(new BookingState(), List.of(), BOOK_ROOM).block())
                .isEqualTo(second.decide(new BookingState(), List.of(), BOOK_ROOM).block());
    }

    @Test
    void expected_stream_version_follows_the_expected_state() {
        var lastEventOrder = EventOrder.of(4);

        var newHandler      = handlerInState(ExpectedState.New);
        var existingHandler = handlerInState(ExpectedState.Existing);
        var anyHandler      = handlerInState(ExpectedState.Any);

        assertThat(newHandler.expectedStreamVersion(EventOrder.NO_EVENTS_PERSISTED).isNoStream()).isTrue();
        assertThat(existingHandler.expectedStreamVersion(lastEventOrder).longValue()).isEqualTo(4);
        assertThat(anyHandler.expectedStreamVersion(lastEventOrder).longValue()).isEqualTo(4);
        assertThat(anyHandler.expectedStreamVersion(EventOrder.NO_EVENTS_PERSISTED).isNoStream()).isTrue();
        assertThat(anyHandler.expectedStreamVersion(lastEventOrder).isAny()).isFalse();
    }

    @Test
    void registering_the_same_command_twice_fails() {
        // Given
        var service = new CommandService<>(BookingState.class, eventStore);
        service.on(BookRoom.class);

        // When / Then
        assertThatThrownBy(() -> service.on(BookRoom.class))
                .isExactlyInstanceOf(CommandHandlerAlreadyRegisteredException.class)
                .hasMessageContaining(BookRoom.class.getName());
    }

    @Test
    void an_incomplete_handler_fails_when_the_handlers_are_built() {
        // Given
        var service = new CommandService<>(BookingState.class, eventStore);
        service.on(BookRoom.class)
               .inState(ExpectedState.New);

        // When / Then
        assertThatThrownBy(service::buildHandlers)
                .isExactlyInstanceOf(CommandHandlerConfigurationException.class);
    }

    @Test
    void registering_after_the_handlers_are_built_fails() {
        // Given
        var service = new BookingService(eventStore);
        service.buildHandlers();

        // When / Then
        assertThatThrownBy(() -> service.on(String.class))
                .isExactlyInstanceOf(IllegalStateException.class);
    }

    @Test
    void the_handlers_are_built_on_the_first_command() {
        // Given
        var service = new BookingService(eventStore);

        // When
        service.handle(BOOK_ROOM).block();

        // Then
        assertThatThrownBy(() -> service.on(String.class))
                .isExactlyInstanceOf(IllegalStateException.class);
        assertThat(eventStore.streamExists(BookingService.streamName(BOOK_ROOM.bookingId))).isTrue();
    }

    private RegisteredHandler<BookingState> handlerInState(ExpectedState expectedState) {
        return builder(AddBookingNote.class)
                .inState(expectedState)
                .getStream(cmd -> StreamName.of("Booking", cmd.bookingId))
                .act((state, priorEvents, cmd) -> List.of())
                .build();
    }

    private <CMD> CommandHandlerBuilder<CMD, BookingState> builder(Class<CMD> commandType) {
        return new CommandHandlerBuilder<>(commandType, eventStore, eventStore);
    }
}
