package dk.cloudcreate.commandhandling.state;

import java.lang.annotation.*;

/**
 * Methods annotated with this Annotation will automatically be called when an event is being applied on to an {@link AggregateState} instance.<br>
 * The method must accept exactly one parameter, which is the type of event it handles.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface EventHandler {
}
