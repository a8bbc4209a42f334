package works.spoke.schema;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Stands in for the schema of the named type, which is defined elsewhere in the same tree.
 * <p>
 * This indirection is what lets a self-referential type have a finite schema.
 * Use {@link SchemaDefinitions} to find the schema a reference denotes.
 */
public record SRef(SName name) implements SchemaType {
	public SRef {
		requireNonNull(name);
	}

	@Override
	public List<Schema> children() {
		return List.of();
	}

	@Override
	public String toString() {
		return "@" + name.show();
	}
}
