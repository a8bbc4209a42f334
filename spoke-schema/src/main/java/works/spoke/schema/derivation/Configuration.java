package works.spoke.schema.derivation;

import java.util.Optional;
import java.util.function.Function;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import lombok.With;
import org.jetbrains.annotations.Nullable;
import works.spoke.schema.SName;

/**
 * Policy for how a {@link SchemaDeriver} names things.
 * <p>
 * A configuration is fixed for the lifetime of the deriver that uses it,
 * so every schema derived in one pass follows the same policy.
 */
@Value
@With
@Builder(toBuilder = true)
public class Configuration {
	public static final Configuration DEFAULT = Configuration.builder().build();

	/**
	 * Applied to every product field name, unless the field's
	 * {@link FieldMetadata#encodedName() encodedName} is given explicitly.
	 */
	@Default FieldNaming fieldNaming = FieldNaming.IDENTITY;

	/**
	 * If not null, derived coproducts are discriminated by a field with this (encoded) name.
	 */
	@Nullable String discriminator;

	/**
	 * Computes a variant's discriminator value from its type name
	 * when the variant has no explicit label.
	 * If null, the {@link #fieldNaming} is applied to the type's {@link SName#shortName() short name}.
	 */
	@Nullable Function<SName, String> discriminatorValue;

	public Optional<String> discriminatorField() {
		return Optional.ofNullable(discriminator);
	}

	public String discriminatorValueFor(SName variantType) {
		if (discriminatorValue == null) {
			return fieldNaming.encode(variantType.shortName());
		}
		return discriminatorValue.apply(variantType);
	}

	public Configuration withSnakeCaseMemberNames() {
		return withFieldNaming(FieldNaming.SNAKE_CASE);
	}

	public Configuration withKebabCaseMemberNames() {
		return withFieldNaming(FieldNaming.KEBAB_CASE);
	}
}
