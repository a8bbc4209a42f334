package works.spoke.schema.derivation;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import org.jetbrains.annotations.Nullable;
import works.spoke.schema.SName;

import static java.util.Objects.requireNonNull;

/**
 * A record-like type with a fixed, ordered list of fields.
 *
 * @param metadata overrides for the schema of the type as a whole
 */
@Builder(toBuilder = true)
public record ProductDescriptor(
	SName name,
	@Singular("fieldDescriptor") List<FieldDescriptor> fields,
	FieldMetadata metadata
) implements TypeDescriptor {
	public ProductDescriptor {
		requireNonNull(name);
		fields = List.copyOf(fields);
		if (metadata == null) {
			metadata = FieldMetadata.NONE;
		}
	}

	public static ProductDescriptorBuilder named(SName name) {
		return new ProductDescriptorBuilder().name(name);
	}

	public @Nullable FieldDescriptor field(String name) {
		for (var f: fields) {
			if (f.name().equals(name)) {
				return f;
			}
		}
		return null;
	}

	public static class ProductDescriptorBuilder {
		public ProductDescriptorBuilder field(FieldDescriptor field) {
			return fieldDescriptor(field);
		}

		public ProductDescriptorBuilder field(String name, TypeDescriptor type) {
			return field(FieldDescriptor.of(name, type));
		}

		public ProductDescriptorBuilder field(String name, TypeDescriptor type, FieldMetadata metadata) {
			return field(new FieldDescriptor(name, type, null, metadata));
		}

		public ProductDescriptorBuilder fieldWithDefault(String name, TypeDescriptor type, Object defaultValue) {
			return field(new FieldDescriptor(name, type, defaultValue, FieldMetadata.NONE));
		}
	}
}
