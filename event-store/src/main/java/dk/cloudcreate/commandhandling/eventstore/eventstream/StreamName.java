package dk.cloudcreate.commandhandling.eventstore.eventstream;

import dk.cloudcreate.essentials.types.CharSequenceType;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Identifies an append-only {@link EventStream}.<br>
 * A stream name is opaque to the event store, but by convention streams belonging to the same kind of aggregate
 * share a category, e.g. all booking streams are named <code>Booking-{bookingId}</code> (see {@link #of(CharSequence, CharSequence)})
 */
public class StreamName extends CharSequenceType<StreamName> {
    public static final char CATEGORY_SEPARATOR = '-';

    public StreamName(CharSequence value) {
        super(value);
        if (value.length() == 0) {
            throw new IllegalArgumentException("A StreamName cannot be empty");
        }
    }

    public static StreamName of(CharSequence value) {
        return new StreamName(value);
    }

    /**
     * Create a stream name following the <code>{category}-{id}</code> convention
     *
     * @param category the stream category, typically the aggregate type name (e.g. "Booking")
     * @param id       the aggregate id
     * @return the stream name
     */
    public static StreamName of(CharSequence category, CharSequence id) {
        requireNonNull(category, "No category provided");
        requireNonNull(id, "No id provided");
        if (category.toString().indexOf(CATEGORY_SEPARATOR) >= 0) {
            throw new IllegalArgumentException(msg("Stream category '{}' cannot contain '{}'", category, CATEGORY_SEPARATOR));
        }
        return new StreamName(category.toString() + CATEGORY_SEPARATOR + id);
    }

    /**
     * @return the part of the stream name before the first {@link #CATEGORY_SEPARATOR}, or the entire name if it doesn't contain a separator
     */
    public String category() {
        var name           = toString();
        var separatorIndex = name.indexOf(CATEGORY_SEPARATOR);
        return separatorIndex < 0 ? name : name.substring(0, separatorIndex);
    }

    /**
     * @return the part of the stream name after the first {@link #CATEGORY_SEPARATOR}, or the entire name if it doesn't contain a separator
     */
    public String id() {
        var name           = toString();
        var separatorIndex = name.indexOf(CATEGORY_SEPARATOR);
        return separatorIndex < 0 ? name : name.substring(separatorIndex + 1);
    }
}
