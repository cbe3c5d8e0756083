package tether.core.navigation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method whose executable body has been compiled into a generated state machine type.
 *
 * The state machine type must declare a {@value #CONTINUATION_METHOD} method holding the method's real instructions
 * and line information. Source navigation follows this marker to that method. Any annotation with the simple name
 * {@code AsyncStateMachine} and a class-valued {@code value} element is honoured, so code generators can emit their
 * own copy of the marker.
 */
@Documented
@Retention(RetentionPolicy.CLASS)
@Target(ElementType.METHOD)
public @interface AsyncStateMachine {
    String CONTINUATION_METHOD = "moveNext";

    Class<?> value();
}
