package works.spoke.schema.derivation;

import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * One alternative of a {@link CoproductDescriptor}.
 *
 * @param label the discriminator value for this variant;
 *              if null, the {@link Configuration} decides
 */
public record VariantDescriptor(@Nullable String label, TypeDescriptor type) {
	public VariantDescriptor {
		requireNonNull(type);
	}

	public static VariantDescriptor of(TypeDescriptor type) {
		return new VariantDescriptor(null, type);
	}
}
