package works.spoke.schema.derivation;

import java.util.List;
import works.spoke.schema.SName;

import static java.util.Objects.requireNonNull;

/**
 * A type with a fixed set of values, each encoded as a string.
 *
 * @param values the encoded values, in declaration order
 */
public record EnumerationDescriptor(SName name, List<String> values, FieldMetadata metadata) implements TypeDescriptor {
	public EnumerationDescriptor {
		requireNonNull(name);
		values = List.copyOf(values);
		requireNonNull(metadata);
	}

	public EnumerationDescriptor(SName name, List<String> values) {
		this(name, values, FieldMetadata.NONE);
	}
}
