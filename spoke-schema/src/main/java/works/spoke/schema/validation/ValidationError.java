package works.spoke.schema.validation;

import org.jetbrains.annotations.Nullable;

/**
 * One violated constraint.
 *
 * @param validator the leaf validator that rejected the value
 * @param invalidValue the rejected value, after any {@link Validator.Mapped projection}
 * @param message human-readable explanation
 */
public record ValidationError(
	Validator.Primitive validator,
	@Nullable Object invalidValue,
	String message
) { }
