package works.spoke.schema;

import static java.util.Objects.requireNonNull;

/**
 * Names the field whose value tells which {@link Variant} of an {@link SCoproduct}
 * a given value is.
 *
 * @param fieldName the encoded name of the discriminator field
 * @param valueSchema describes the discriminator field's values; usually a string
 */
public record Discriminator(String fieldName, Schema valueSchema) {
	public Discriminator {
		requireNonNull(fieldName);
		requireNonNull(valueSchema);
	}

	public static Discriminator stringField(String fieldName) {
		return new Discriminator(fieldName, Schema.string());
	}

	@Override
	public String toString() {
		return fieldName;
	}
}
