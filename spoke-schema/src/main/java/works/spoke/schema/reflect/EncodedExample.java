package works.spoke.schema.reflect;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.RECORD_COMPONENT;
import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * An example value, as it would appear on the wire.
 */
@Retention(RUNTIME)
@Target({RECORD_COMPONENT, TYPE})
public @interface EncodedExample {
	String value();
}
