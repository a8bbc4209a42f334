package works.spoke.schema.reflect;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.RECORD_COMPONENT;
import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * On a record component, the name the field has on the wire,
 * overriding the configured {@link works.spoke.schema.derivation.FieldNaming FieldNaming}.
 * On a permitted subtype of a sealed interface, the label of that variant.
 */
@Retention(RUNTIME)
@Target({RECORD_COMPONENT, TYPE})
public @interface EncodedName {
	String value();
}
