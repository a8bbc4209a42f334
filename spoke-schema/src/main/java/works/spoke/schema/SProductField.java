package works.spoke.schema;

import static java.util.Objects.requireNonNull;

/**
 * One field of an {@link SProduct}.
 *
 * @param name the field's name in the source type; {@link works.spoke.schema.modify.FieldPath FieldPath}s refer to this
 * @param encodedName the field's name on the wire
 * @param schema describes the field's value
 */
public record SProductField(String name, String encodedName, Schema schema) {
	public SProductField {
		requireNonNull(name);
		requireNonNull(encodedName);
		requireNonNull(schema);
	}

	public static SProductField of(String name, Schema schema) {
		return new SProductField(name, name, schema);
	}

	public SProductField withSchema(Schema schema) {
		return new SProductField(name, encodedName, schema);
	}

	public SProductField withEncodedName(String encodedName) {
		return new SProductField(name, encodedName, schema);
	}

	@Override
	public String toString() {
		if (name.equals(encodedName)) {
			return name + ": " + schema;
		} else {
			return name + "(\"" + encodedName + "\"): " + schema;
		}
	}
}
