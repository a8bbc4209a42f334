package works.spoke.schema;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.pcollections.PVector;
import org.pcollections.TreePVector;
import works.spoke.schema.exceptions.SchemaConstructionException;

import static java.util.stream.Collectors.joining;

/**
 * A tagged union: a value is exactly one of the {@link #variants}.
 * <p>
 * Variant labels are unique. When there is a {@link #discriminator},
 * every variant must have a label, since the label is the value
 * the discriminator field takes for that variant.
 */
public record SCoproduct(
	PVector<Variant> variants,
	@Nullable Discriminator discriminator
) implements SchemaType {
	public SCoproduct {
		Set<String> labels = new HashSet<>();
		for (var variant: variants) {
			if (variant.label() == null) {
				if (discriminator != null) {
					throw new SchemaConstructionException("Variant " + variant.schema()
						+ " has no label, but discriminator field \"" + discriminator.fieldName() + "\" requires one");
				}
			} else if (!labels.add(variant.label())) {
				throw new SchemaConstructionException("Duplicate variant label \"" + variant.label() + "\"");
			}
		}
	}

	public SCoproduct(List<Variant> variants, @Nullable Discriminator discriminator) {
		this(TreePVector.from(variants), discriminator);
	}

	public Optional<Variant> variant(String label) {
		return variants.stream()
			.filter(v -> label.equals(v.label()))
			.findFirst();
	}

	public Optional<Discriminator> discriminatorField() {
		return Optional.ofNullable(discriminator);
	}

	public SCoproduct withVariant(int index, Variant variant) {
		return new SCoproduct(variants.with(index, variant), discriminator);
	}

	@Override
	public List<Schema> children() {
		return variants.stream().map(Variant::schema).toList();
	}

	@Override
	public String toString() {
		String prefix = (discriminator == null) ? "oneOf(" : "oneOf[" + discriminator + "](";
		return variants.stream()
			.map(Object::toString)
			.collect(joining(" | ", prefix, ")"));
	}
}
