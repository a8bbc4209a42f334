package works.spoke.schema;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A sequence of values all described by {@link #element}.
 */
public record SArray(Schema element) implements SchemaType {
	public SArray {
		requireNonNull(element);
	}

	@Override
	public List<Schema> children() {
		return List.of(element);
	}

	@Override
	public String toString() {
		return "[" + element + "]";
	}
}
