package works.spoke.schema;

import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * One alternative of an {@link SCoproduct}.
 *
 * @param label the discriminator value identifying this variant, if any
 * @param schema describes values of this variant
 */
public record Variant(@Nullable String label, Schema schema) {
	public Variant {
		requireNonNull(schema);
	}

	public static Variant unlabeled(Schema schema) {
		return new Variant(null, schema);
	}

	public Variant withLabel(String label) {
		return new Variant(requireNonNull(label), schema);
	}

	public Variant withSchema(Schema schema) {
		return new Variant(label, schema);
	}

	@Override
	public String toString() {
		return (label == null) ? schema.toString() : label + "=" + schema;
	}
}
