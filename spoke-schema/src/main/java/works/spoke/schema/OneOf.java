package works.spoke.schema;

import java.util.Optional;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * A discriminated {@link SCoproduct} schema, together with the means to tell
 * which of its variants a given instance belongs to.
 * <p>
 * The schema alone suffices for documentation.
 * The {@link #labelOf labeller} is for whatever dispatches on concrete values,
 * such as a codec choosing which variant to encode.
 *
 * @param schema the coproduct schema
 * @param labeller computes the discriminator value of an instance
 * @param <T> the type whose instances are being discriminated
 */
public record OneOf<T>(Schema schema, Function<? super T, String> labeller) {
	public OneOf {
		requireNonNull(labeller);
		if (!(schema.schemaType() instanceof SCoproduct c) || c.discriminator() == null) {
			throw new IllegalArgumentException("Expected a discriminated coproduct schema: " + schema);
		}
	}

	public SCoproduct coproduct() {
		return (SCoproduct) schema.schemaType();
	}

	public String discriminatorField() {
		return coproduct().discriminatorField().orElseThrow().fieldName();
	}

	public String labelOf(T instance) {
		return labeller.apply(instance);
	}

	/**
	 * @return the variant for {@code instance}'s label, or empty if there is no such variant
	 */
	public Optional<Variant> variantFor(T instance) {
		return coproduct().variant(labelOf(instance));
	}
}
