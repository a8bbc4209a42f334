package works.spoke.schema;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * An object with arbitrary string keys whose values are all described by {@link #valueSchema}.
 */
public record SOpenProduct(Schema valueSchema) implements SchemaType {
	public SOpenProduct {
		requireNonNull(valueSchema);
	}

	@Override
	public List<Schema> children() {
		return List.of(valueSchema);
	}

	@Override
	public String toString() {
		return "{*: " + valueSchema + "}";
	}
}
