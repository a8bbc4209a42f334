package works.spoke.schema.derivation;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import works.spoke.schema.SName;

import static java.util.Objects.requireNonNull;

/**
 * A sum type: every value is exactly one of the {@link #variants}.
 *
 * @param metadata overrides for the schema of the type as a whole
 */
@Builder(toBuilder = true)
public record CoproductDescriptor(
	SName name,
	@Singular("variantDescriptor") List<VariantDescriptor> variants,
	FieldMetadata metadata
) implements TypeDescriptor {
	public CoproductDescriptor {
		requireNonNull(name);
		variants = List.copyOf(variants);
		if (metadata == null) {
			metadata = FieldMetadata.NONE;
		}
	}

	public static CoproductDescriptorBuilder named(SName name) {
		return new CoproductDescriptorBuilder().name(name);
	}

	public static class CoproductDescriptorBuilder {
		public CoproductDescriptorBuilder variant(VariantDescriptor variant) {
			return variantDescriptor(variant);
		}

		public CoproductDescriptorBuilder variant(TypeDescriptor type) {
			return variant(VariantDescriptor.of(type));
		}

		public CoproductDescriptorBuilder variant(String label, TypeDescriptor type) {
			return variant(new VariantDescriptor(label, type));
		}
	}
}
