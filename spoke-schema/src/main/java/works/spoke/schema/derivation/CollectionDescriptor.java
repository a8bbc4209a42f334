package works.spoke.schema.derivation;

import works.spoke.schema.SName;

import static java.util.Objects.requireNonNull;

/**
 * A list, set, array, or other sequence of {@link #element}s.
 */
public record CollectionDescriptor(SName name, TypeDescriptor element) implements TypeDescriptor {
	public CollectionDescriptor {
		requireNonNull(name);
		requireNonNull(element);
	}
}
