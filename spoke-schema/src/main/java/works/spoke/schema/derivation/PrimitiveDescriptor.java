package works.spoke.schema.derivation;

import org.jetbrains.annotations.Nullable;
import works.spoke.schema.PrimitiveKind;
import works.spoke.schema.SName;

import static java.util.Objects.requireNonNull;

/**
 * A scalar type with a built-in wire representation.
 *
 * @param format refines {@code kind}; becomes the schema's {@link works.spoke.schema.Schema#format() format}
 */
public record PrimitiveDescriptor(SName name, PrimitiveKind kind, @Nullable String format) implements TypeDescriptor {
	public PrimitiveDescriptor {
		requireNonNull(name);
		requireNonNull(kind);
	}
}
