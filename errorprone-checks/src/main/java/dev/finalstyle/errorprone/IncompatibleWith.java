package dev.finalstyle.errorprone;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Names the checks that enforce the opposite convention to the annotated {@link com.google.errorprone.BugPattern}.
 * Enabling both sides would flag every declaration one way or the other.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface IncompatibleWith {
    String[] value();
}
