package works.spoke.schema.reflect;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.RECORD_COMPONENT;
import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Documentation should omit the annotated field or type.
 */
@Retention(RUNTIME)
@Target({RECORD_COMPONENT, TYPE})
public @interface Hidden {
}
