package works.spoke.schema.modify;

import java.util.Optional;
import works.spoke.schema.Schema;
import works.spoke.schema.derivation.TypeDescriptor;

/**
 * Teaches a {@link SchemaModifier} where the elements of some container type live,
 * so that {@link FieldPath#each() each} steps can descend into it
 * just as they do for built-in collections.
 * <p>
 * For example, a {@code NonEmptyList<T>} encoded as {@code {"head": T, "tail": [T]}}
 * could designate the {@code head} field's schema as its element schema.
 */
public interface ContainerUnwrapper {
	/**
	 * @return the schema of the elements within {@code container}
	 * @throws IllegalArgumentException if {@code container} doesn't have the expected shape
	 */
	Schema element(Schema container);

	/**
	 * @return {@code container} with its element schema replaced by {@code element}
	 */
	Schema withElement(Schema container, Schema element);

	/**
	 * Used by {@link CheckedFieldPath} to follow {@code each} steps through type descriptions.
	 *
	 * @return the element type within {@code container}, if known
	 */
	default Optional<TypeDescriptor> elementType(TypeDescriptor container) {
		return Optional.empty();
	}
}
