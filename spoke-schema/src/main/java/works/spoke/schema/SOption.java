package works.spoke.schema;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A value that may be absent.
 * Metadata attached to {@link #element} describes the value when it is present.
 */
public record SOption(Schema element) implements SchemaType {
	public SOption {
		requireNonNull(element);
	}

	@Override
	public List<Schema> children() {
		return List.of(element);
	}

	@Override
	public String toString() {
		return element + "?";
	}
}
