package dk.cloudcreate.commandhandling.state;

import dk.cloudcreate.essentials.shared.reflection.invocation.*;
import org.slf4j.*;

import java.lang.reflect.Method;
import java.util.List;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Base class for the folded state of an event-sourced aggregate.<br>
 * Events are applied through methods annotated with {@link EventHandler}. Events without a matching
 * {@link EventHandler} method are ignored. Subclasses MUST have a no-arguments constructor, which
 * creates the initial/default state that the history of a stream is folded on to.<br>
 * Example:
 * <pre>{@code
 * public class BookingState extends AggregateState {
 *     private String     roomId;
 *     private BigDecimal amountPaid = BigDecimal.ZERO;
 *
 *     @EventHandler
 *     private void on(RoomBooked e) {
 *         roomId = e.roomId;
 *     }
 *
 *     @EventHandler
 *     private void on(PaymentRecorded e) {
 *         amountPaid = amountPaid.add(e.amount);
 *     }
 * }
 * }</pre>
 * A state instance is owned by a single command invocation and is never shared between invocations.
 */
public abstract class AggregateState {
    private static final Logger log = LoggerFactory.getLogger(AggregateState.class);

    private transient PatternMatchingMethodInvoker<Object> invoker;

    /**
     * Apply a single event to this state by calling the {@link EventHandler} method that matches the event type most specifically
     *
     * @param event the event to apply
     */
    public final void apply(Object event) {
        requireNonNull(event, "No event provided");
        invoker().invoke(event, unmatchedEvent -> {
            log.trace("No @EventHandler method in '{}' matches event '{}' - ignoring it", getClass().getName(), unmatchedEvent.getClass().getName());
        });
    }

    /**
     * Effectively performs a leftFold over the <code>events</code>
     *
     * @param events the events to apply, in order
     */
    public final void applyAll(List<?> events) {
        requireNonNull(events, "No events provided");
        events.forEach(this::apply);
    }

    private PatternMatchingMethodInvoker<Object> invoker() {
        if (invoker == null) {
            invoker = new PatternMatchingMethodInvoker<>(this,
                                                         new EventHandlerMethodPatternMatcher(),
                                                         InvocationStrategy.InvokeMostSpecificTypeMatched);
        }
        return invoker;
    }

    private static class EventHandlerMethodPatternMatcher implements MethodPatternMatcher<Object> {
        @Override
        public boolean isInvokableMethod(Method method) {
            requireNonNull(method, "No candidate method supplied");
            return method.isAnnotationPresent(EventHandler.class) &&
                    method.getParameterCount() == 1;
        }

        @Override
        public Class<?> resolveInvocationArgumentTypeFromMethodDefinition(Method method) {
            requireNonNull(method, "No method supplied");
            return method.getParameterTypes()[0];
        }

        @Override
        public Class<?> resolveInvocationArgumentTypeFromObject(Object argument) {
            requireNonNull(argument, "No argument supplied");
            return argument.getClass();
        }

        @Override
        public void invokeMethod(Method methodToInvoke, Object argument, Object invokeMethodOn, Class<?> resolvedInvokeMethodWithArgumentOfType) throws Exception {
            requireNonNull(methodToInvoke, "No methodToInvoke supplied");
            requireNonNull(argument, "No argument supplied");
            requireNonNull(invokeMethodOn, "No invokeMethodOn supplied");
            if (!methodToInvoke.canAccess(invokeMethodOn)) {
                methodToInvoke.setAccessible(true);
            }
            methodToInvoke.invoke(invokeMethodOn, argument);
        }
    }
}
