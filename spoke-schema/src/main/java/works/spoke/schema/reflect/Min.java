package works.spoke.schema.reflect;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.RECORD_COMPONENT;
import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

@Retention(RUNTIME)
@Target({RECORD_COMPONENT, TYPE})
public @interface Min {
	long value();

	/**
	 * If true, the value must be strictly greater than {@link #value}.
	 */
	boolean exclusive() default false;
}
