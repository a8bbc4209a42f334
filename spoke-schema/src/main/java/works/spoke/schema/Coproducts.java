package works.spoke.schema;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.spoke.schema.exceptions.SchemaConstructionException;
import works.spoke.schema.validation.Validator;

/**
 * Ways to build and adjust {@link SCoproduct} schemas by hand,
 * for when derivation doesn't produce the desired encoding.
 */
public final class Coproducts {
	private Coproducts() { }

	/**
	 * Builds a coproduct whose variants are told apart by the value of a field.
	 * <p>
	 * Each mapping entry becomes one variant, labeled with {@code asString} of its key,
	 * in the order given.
	 *
	 * @param fieldName the encoded name of the discriminator field
	 * @param extractor gets the discriminator value from an instance
	 * @param asString renders a discriminator value as it appears on the wire
	 * @param mapping discriminator values and the schemas of the corresponding variants
	 * @throws SchemaConstructionException if two values render to the same label
	 */
	public static <T, V> OneOf<T> oneOfUsingField(
		String fieldName,
		Function<? super T, ? extends V> extractor,
		Function<? super V, String> asString,
		List<Map.Entry<V, Schema>> mapping
	) {
		return oneOfUsingField(null, fieldName, extractor, asString, mapping);
	}

	public static <T, V> OneOf<T> oneOfUsingField(
		@Nullable SName name,
		String fieldName,
		Function<? super T, ? extends V> extractor,
		Function<? super V, String> asString,
		List<Map.Entry<V, Schema>> mapping
	) {
		List<Variant> variants = new ArrayList<>(mapping.size());
		List<String> labels = new ArrayList<>(mapping.size());
		for (var entry: mapping) {
			String label = asString.apply(entry.getKey());
			variants.add(new Variant(label, entry.getValue()));
			labels.add(label);
		}
		var discriminator = new Discriminator(fieldName, Schema.string().withValidator(Validator.enumeration(labels)));
		Schema schema = Schema.coproduct(name, variants, discriminator);
		LOGGER.debug("oneOfUsingField({}) produced {}", fieldName, schema);
		return new OneOf<>(schema, instance -> asString.apply(extractor.apply(instance)));
	}

	/**
	 * Builds a coproduct in which each variant is wrapped in an object
	 * having a single field, named by the variant's label.
	 * No discriminator field is needed, since the wrapper's field name serves that purpose.
	 *
	 * @param variants labels and the schemas of the corresponding variants
	 */
	public static Schema oneOfWrapped(@Nullable SName name, List<Map.Entry<String, Schema>> variants) {
		List<Variant> wrapped = new ArrayList<>(variants.size());
		for (var entry: variants) {
			String label = entry.getKey();
			Schema wrapper = Schema.product(List.of(SProductField.of(label, entry.getValue())));
			wrapped.add(new Variant(label, wrapper));
		}
		Schema result = Schema.coproduct(wrapped, null);
		return (name == null) ? result : result.withName(name);
	}

	/**
	 * Attaches a discriminator to a coproduct that doesn't have one.
	 * The variants' schemas are not altered; only their labels are set.
	 * Variants not mentioned in {@code mapping} keep any label they already have.
	 *
	 * @param coproduct a schema whose type is an {@link SCoproduct} without a discriminator
	 * @param fieldName the encoded name of the discriminator field
	 * @param valueSchema describes the values of the discriminator field
	 * @param mapping for each discriminator value, the {@link Schema#typeName type name} of the corresponding variant
	 * @throws SchemaConstructionException if {@code coproduct} already has a discriminator,
	 * if the mapping mentions a type that is not a variant, maps two values to one variant,
	 * or leaves a variant without a label
	 */
	public static Schema addDiscriminatorField(Schema coproduct, String fieldName, Schema valueSchema, Map<String, SName> mapping) {
		if (!(coproduct.schemaType() instanceof SCoproduct c)) {
			throw new SchemaConstructionException("Can't add a discriminator to non-coproduct schema " + coproduct);
		}
		if (c.discriminator() != null) {
			throw new SchemaConstructionException("Coproduct already has discriminator field \"" + c.discriminator().fieldName() + "\"");
		}
		Map<SName, String> labelsByType = new HashMap<>();
		mapping.forEach((label, type) -> {
			String old = labelsByType.put(type, label);
			if (old != null) {
				throw new SchemaConstructionException("Variant " + type.show() + " is mapped to both \"" + old + "\" and \"" + label + "\"");
			}
		});
		List<Variant> variants = new ArrayList<>(c.variants().size());
		for (var variant: c.variants()) {
			SName type = variant.schema().typeName();
			String label = (type == null) ? null : labelsByType.remove(type);
			variants.add(label == null ? variant : variant.withLabel(label));
		}
		if (!labelsByType.isEmpty()) {
			throw new SchemaConstructionException("Discriminator mapping refers to types that are not variants: " + labelsByType.keySet());
		}
		return coproduct.withSchemaType(new SCoproduct(variants, new Discriminator(fieldName, valueSchema)));
	}

	/**
	 * Like {@link #addDiscriminatorField(Schema, String, Schema, Map)}
	 * with a string discriminator restricted to the variants' labels.
	 */
	public static Schema addDiscriminatorField(Schema coproduct, String fieldName, Map<String, SName> mapping) {
		Schema result = addDiscriminatorField(coproduct, fieldName, Schema.string(), mapping);
		SCoproduct c = (SCoproduct) result.schemaType();
		List<String> labels = c.variants().stream().map(Variant::label).toList();
		Schema valueSchema = Schema.string().withValidator(Validator.enumeration(labels));
		return result.withSchemaType(new SCoproduct(c.variants(), new Discriminator(fieldName, valueSchema)));
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Coproducts.class);
}
