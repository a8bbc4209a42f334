package works.spoke.schema.derivation;

import works.spoke.schema.SName;

import static java.util.Objects.requireNonNull;

/**
 * A map from strings to {@link #value}s.
 */
public record MapDescriptor(SName name, TypeDescriptor value) implements TypeDescriptor {
	public MapDescriptor {
		requireNonNull(name);
		requireNonNull(value);
	}
}
