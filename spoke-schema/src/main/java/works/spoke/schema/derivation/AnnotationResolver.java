package works.spoke.schema.derivation;

import works.spoke.schema.SProductField;
import works.spoke.schema.Schema;

/**
 * Overlays explicitly declared {@link FieldMetadata} onto derived schemas.
 * <p>
 * Declared values replace derived ones, except that validators accumulate.
 * A declared {@link FieldMetadata#encodedName() encodedName} replaces whatever
 * name the {@link FieldNaming} produced, so it must be applied after naming.
 */
public final class AnnotationResolver {
	private AnnotationResolver() { }

	public static SProductField resolveField(SProductField field, FieldMetadata metadata) {
		if (metadata.isEmpty()) {
			return field;
		}
		SProductField result = field.withSchema(resolveType(field.schema(), metadata));
		if (metadata.encodedName() != null) {
			result = result.withEncodedName(metadata.encodedName());
		}
		return result;
	}

	/**
	 * Applies everything in {@code metadata} except {@link FieldMetadata#encodedName() encodedName}.
	 */
	public static Schema resolveType(Schema schema, FieldMetadata metadata) {
		if (metadata.isEmpty()) {
			return schema;
		}
		Schema result = schema;
		if (metadata.description() != null) {
			result = result.withDescription(metadata.description());
		}
		if (metadata.defaultValue() != null) {
			result = result.withDefault(metadata.defaultValue());
		}
		if (metadata.encodedExample() != null) {
			result = result.withExample(metadata.encodedExample());
		}
		if (metadata.format() != null) {
			result = result.withFormat(metadata.format());
		}
		if (metadata.deprecated() != null) {
			result = result.withDeprecated(metadata.deprecated());
		}
		if (metadata.hidden() != null) {
			result = result.withHidden(metadata.hidden());
		}
		return result.withValidator(metadata.validator());
	}
}
