package works.spoke.schema.reflect;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.RECORD_COMPONENT;
import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * The value assumed when the input omits this field, in its encoded form.
 * <p>
 * Integers, numbers, and booleans are parsed according to the field type;
 * anything else is kept as a string.
 */
@Retention(RUNTIME)
@Target({RECORD_COMPONENT, TYPE})
public @interface Default {
	String value();
}
