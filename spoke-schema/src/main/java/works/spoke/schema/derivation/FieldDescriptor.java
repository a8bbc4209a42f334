package works.spoke.schema.derivation;

import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * One field of a {@link ProductDescriptor}.
 *
 * @param name the field's name in the source type, before any {@link FieldNaming} is applied
 * @param defaultValue the value assumed when the field is missing, if any
 * @param metadata overrides for this field's schema
 */
public record FieldDescriptor(
	String name,
	TypeDescriptor type,
	@Nullable Object defaultValue,
	FieldMetadata metadata
) {
	public FieldDescriptor {
		requireNonNull(name);
		requireNonNull(type);
		requireNonNull(metadata);
	}

	public static FieldDescriptor of(String name, TypeDescriptor type) {
		return new FieldDescriptor(name, type, null, FieldMetadata.NONE);
	}
}
