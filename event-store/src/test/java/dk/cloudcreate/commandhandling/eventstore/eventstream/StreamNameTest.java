package dk.cloudcreate.commandhandling.eventstore.eventstream;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class StreamNameTest {
    @Test
    void category_and_id_are_joined_by_the_separator() {
        var streamName = StreamName.of("Booking", "B1");

        assertThat(streamName.toString()).isEqualTo("Booking-B1");
        assertThat(streamName.category()).isEqualTo("Booking");
        assertThat(streamName.id()).isEqualTo("B1");
    }

    @Test
    void id_may_contain_the_separator() {
        var streamName = StreamName.of("Booking", "2023-01-B1");

        assertThat(streamName.category()).isEqualTo("Booking");
        assertThat(streamName.id()).isEqualTo("2023-01-B1");
    }

    @Test
    void a_stream_name_without_separator_is_both_category_and_id() {
        var streamName = StreamName.of("B1");

        assertThat(streamName.category()).isEqualTo("B1");
        assertThat(streamName.id()).isEqualTo("B1");
    }

    @Test
    void stream_names_with_the_same_value_are_equal() {
        assertThat((CharSequence) StreamName.of("Booking", "B1")).isEqualTo(StreamName.of("Booking-B1"));
    }

    @Test
    void empty_or_invalid_stream_names_are_rejected() {
        assertThatThrownBy(() -> StreamName.of(""))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> StreamName.of("Room-Booking", "B1"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
