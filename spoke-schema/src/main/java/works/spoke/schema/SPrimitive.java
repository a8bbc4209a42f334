package works.spoke.schema;

import java.util.List;

import static java.util.Objects.requireNonNull;

public record SPrimitive(PrimitiveKind kind) implements SchemaType {
	public SPrimitive {
		requireNonNull(kind);
	}

	@Override
	public List<Schema> children() {
		return List.of();
	}

	@Override
	public String toString() {
		return kind.show();
	}
}
