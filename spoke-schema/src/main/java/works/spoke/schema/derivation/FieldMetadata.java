package works.spoke.schema.derivation;

import lombok.With;
import org.jetbrains.annotations.Nullable;
import works.spoke.schema.validation.Validator;

import static java.util.Objects.requireNonNull;

/**
 * Explicitly declared metadata for a field, or for a type as a whole,
 * to be overlaid on the derived schema by {@link AnnotationResolver}.
 * <p>
 * Null components are not declared and leave the derived schema alone.
 * The {@link #validator} is added to the derived one rather than replacing it.
 *
 * @param encodedName the field's wire name; takes precedence over the {@link FieldNaming}.
 *                    Ignored at the type level.
 */
@With
public record FieldMetadata(
	@Nullable String encodedName,
	@Nullable String description,
	@Nullable Object defaultValue,
	@Nullable Object encodedExample,
	@Nullable String format,
	@Nullable Boolean deprecated,
	@Nullable Boolean hidden,
	Validator validator
) {
	public static final FieldMetadata NONE = new FieldMetadata(null, null, null, null, null, null, null, Validator.pass());

	public FieldMetadata {
		requireNonNull(validator);
	}

	public boolean isEmpty() {
		return this.equals(NONE);
	}

	/**
	 * @return metadata like this, additionally requiring {@code v}
	 */
	public FieldMetadata plusValidator(Validator v) {
		return withValidator(validator.and(v));
	}
}
