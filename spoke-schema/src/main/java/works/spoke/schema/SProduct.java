package works.spoke.schema;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.pcollections.PVector;
import org.pcollections.TreePVector;
import works.spoke.schema.exceptions.SchemaConstructionException;

import static java.util.stream.Collectors.joining;

/**
 * A record-like value with a fixed, ordered set of named fields.
 * <p>
 * Field {@link SProductField#name names} are unique, and so are
 * {@link SProductField#encodedName encoded names}.
 */
public record SProduct(PVector<SProductField> fields) implements SchemaType {
	public SProduct {
		Set<String> names = new HashSet<>();
		Set<String> encodedNames = new HashSet<>();
		for (var field: fields) {
			if (!names.add(field.name())) {
				throw new SchemaConstructionException("Duplicate field name \"" + field.name() + "\"");
			}
			if (!encodedNames.add(field.encodedName())) {
				throw new SchemaConstructionException("Duplicate encoded field name \"" + field.encodedName() + "\"");
			}
		}
	}

	public SProduct(List<SProductField> fields) {
		this(TreePVector.from(fields));
	}

	public static SProduct empty() {
		return new SProduct(TreePVector.<SProductField>empty());
	}

	public Optional<SProductField> field(String name) {
		return fields.stream()
			.filter(f -> f.name().equals(name))
			.findFirst();
	}

	public int indexOf(String name) {
		for (int i = 0; i < fields.size(); i++) {
			if (fields.get(i).name().equals(name)) {
				return i;
			}
		}
		return -1;
	}

	/**
	 * @return a product identical to this one except that the field at {@code index} is replaced.
	 * The other fields are shared, not copied.
	 */
	public SProduct withField(int index, SProductField field) {
		return new SProduct(fields.with(index, field));
	}

	public SProduct plus(SProductField field) {
		return new SProduct(fields.plus(field));
	}

	@Override
	public List<Schema> children() {
		return fields.stream().map(SProductField::schema).toList();
	}

	@Override
	public String toString() {
		return fields.stream()
			.map(Object::toString)
			.collect(joining(", ", "{", "}"));
	}
}
