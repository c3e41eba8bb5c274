package dk.cloudcreate.commandhandling.eventstore.types;

import dk.cloudcreate.commandhandling.eventstore.EventWriter;
import dk.cloudcreate.essentials.types.LongType;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * The optimistic concurrency token handed to {@link EventWriter#appendToStream(dk.cloudcreate.commandhandling.eventstore.eventstream.StreamName, ExpectedStreamVersion, java.util.List)}.<br>
 * Either one of the special values {@link #NO_STREAM} or {@link #ANY}, or the exact {@link EventOrder} of the last event
 * the caller saw in the stream (see {@link #exactly(EventOrder)})
 */
public class ExpectedStreamVersion extends LongType<ExpectedStreamVersion> {
    private static final long ANY_VALUE = -2L;

    /**
     * The stream MUST NOT contain any events at append time
     */
    public static final ExpectedStreamVersion NO_STREAM = new ExpectedStreamVersion(EventOrder.NO_EVENTS_PERSISTED.longValue());
    /**
     * Append without any concurrency check
     */
    public static final ExpectedStreamVersion ANY       = new ExpectedStreamVersion(ANY_VALUE);

    public ExpectedStreamVersion(Long value) {
        super(requireNonNull(value, "No value provided"));
        if (value < ANY_VALUE) {
            throw new IllegalArgumentException(msg("Invalid ExpectedStreamVersion {}. Use NO_STREAM, ANY or exactly(eventOrder)", value));
        }
    }

    /**
     * The last event in the stream MUST have the given <code>eventOrder</code> at append time
     *
     * @param eventOrder the event order of the last event the caller has seen
     * @return the expected version
     */
    public static ExpectedStreamVersion exactly(EventOrder eventOrder) {
        requireNonNull(eventOrder, "No eventOrder provided");
        return new ExpectedStreamVersion(eventOrder.longValue());
    }

    public boolean isAny() {
        return longValue() == ANY.longValue();
    }

    public boolean isNoStream() {
        return longValue() == NO_STREAM.longValue();
    }

    /**
     * Check if the stream, whose last event has the given <code>currentEventOrder</code>, satisfies this expected version
     *
     * @param currentEventOrder the {@link EventOrder} of the last event in the stream or {@link EventOrder#NO_EVENTS_PERSISTED}
     * @return true if an append is allowed
     */
    public boolean isSatisfiedBy(EventOrder currentEventOrder) {
        requireNonNull(currentEventOrder, "No currentEventOrder provided");
        if (isAny()) {
            return true;
        }
        return longValue() == currentEventOrder.longValue();
    }

    @Override
    public String toString() {
        if (isAny()) {
            return "Any";
        }
        if (isNoStream()) {
            return "NoStream";
        }
        return super.toString();
    }
}
