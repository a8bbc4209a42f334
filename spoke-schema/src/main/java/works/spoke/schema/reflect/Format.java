package works.spoke.schema.reflect;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.RECORD_COMPONENT;
import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Overrides the format of the derived schema, such as {@code "email"} or {@code "password"}.
 */
@Retention(RUNTIME)
@Target({RECORD_COMPONENT, TYPE})
public @interface Format {
	String value();
}
