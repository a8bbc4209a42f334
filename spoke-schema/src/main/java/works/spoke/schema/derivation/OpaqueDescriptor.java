package works.spoke.schema.derivation;

import works.spoke.schema.SName;

import static java.util.Objects.requireNonNull;

/**
 * A type with no structural description.
 * Its schema must come from a {@link SchemaRegistry};
 * otherwise, deriving it throws {@link works.spoke.schema.exceptions.DerivationUnavailableException}.
 */
public record OpaqueDescriptor(SName name) implements TypeDescriptor {
	public OpaqueDescriptor {
		requireNonNull(name);
	}
}
