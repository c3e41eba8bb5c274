package dk.cloudcreate.commandhandling.state;

import org.junit.jupiter.api.Test;

import java.util.*;

import static org.assertj.core.api.Assertions.*;

class AggregateStateTest {
    @Test
    void events_are_applied_in_order() {
        // Given
        var state = new CounterState();

        // When
        state.applyAll(List.of(new Incremented(2), new Incremented(3), new Reset(), new Incremented(4)));

        // Then
        assertThat(state.value).isEqualTo(4);
        assertThat(state.appliedEvents).isEqualTo(4);
    }

    @Test
    void events_without_a_handler_are_ignored() {
        // Given
        var state = new CounterState();

        // When
        state.apply(new Incremented(1));
        state.apply("Unknown event");

        // Then
        assertThat(state.value).isEqualTo(1);
        assertThat(state.appliedEvents).isEqualTo(1);
    }

    @Test
    void the_most_specific_handler_is_invoked() {
        // Given
        var state = new CounterState();

        // When
        state.apply(new IncrementedTwice(5));

        // Then
        assertThat(state.value).isEqualTo(10);
    }

    @Test
    void a_failing_handler_is_propagated() {
        // Given
        var state = new CounterState();

        // When
        var thrown = catchThrowable(() -> state.apply(new Incremented(-1)));

        // Then
        assertThat(thrown).isNotNull();
        var rootCause = thrown;
        while (rootCause.getCause() != null) {
            rootCause = rootCause.getCause();
        }
        assertThat(rootCause).isInstanceOf(IllegalArgumentException.class)
                             .hasMessage("Cannot increment with a negative amount");
        assertThat(state.value).isEqualTo(0);
    }

    @Test
    void null_events_are_rejected() {
        var state = new CounterState();

        assertThatThrownBy(() -> state.apply(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> state.applyAll(null)).isInstanceOf(IllegalArgumentException.class);
    }

    private static class Incremented {
        final int amount;

        Incremented(int amount) {
            this.amount = amount;
        }
    }

    private static class IncrementedTwice extends Incremented {
        IncrementedTwice(int amount) {
            super(amount);
        }
    }

    private static class Reset {
    }

    static class CounterState extends AggregateState {
        int value;
        int appliedEvents;

        @EventHandler
        private void on(Incremented e) {
            if (e.amount < 0) {
                throw new IllegalArgumentException("Cannot increment with a negative amount");
            }
            value += e.amount;
            appliedEvents++;
        }

        @EventHandler
        private void on(IncrementedTwice e) {
            value += 2 * e.amount;
            appliedEvents++;
        }

        @EventHandler
        private void on(Reset e) {
            value = 0;
            appliedEvents++;
        }
    }
}
