package works.spoke.schema.reflect;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.RECORD_COMPONENT;
import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Human-readable documentation for a field or type.
 */
@Retention(RUNTIME)
@Target({RECORD_COMPONENT, TYPE})
public @interface Description {
	String value();
}
