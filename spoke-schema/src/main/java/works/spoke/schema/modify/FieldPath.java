package works.spoke.schema.modify;

import java.util.List;
import org.pcollections.PVector;
import org.pcollections.TreePVector;
import works.spoke.schema.derivation.TypeDescriptor;

import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * Locates a sub-schema within a schema, as a sequence of steps from the root.
 * <p>
 * Paths are built either from the {@link #root()} using {@link #field} and {@link #each},
 * {@link #checked checked} step by step against a type description,
 * or from raw strings using {@link #unsafe}.
 */
public record FieldPath(PVector<Segment> segments) {
	/**
	 * In {@link #unsafe} paths, denotes the elements of a collection or optional value.
	 */
	public static final String EACH = "each";

	private static final FieldPath ROOT = new FieldPath(TreePVector.empty());

	public FieldPath {
		requireNonNull(segments);
	}

	public sealed interface Segment permits Field, Each { }

	/**
	 * Descends into the product field with the given (source, not encoded) name.
	 */
	public record Field(String name) implements Segment {
		public Field {
			requireNonNull(name);
		}

		@Override
		public String toString() {
			return name;
		}
	}

	/**
	 * Descends into the element schema of a collection, optional value, map, or registered container.
	 */
	public record Each() implements Segment {
		@Override
		public String toString() {
			return EACH;
		}
	}

	public static FieldPath root() {
		return ROOT;
	}

	public FieldPath field(String name) {
		return new FieldPath(segments.plus(new Field(name)));
	}

	public FieldPath each() {
		return new FieldPath(segments.plus(new Each()));
	}

	public FieldPath plus(FieldPath other) {
		return new FieldPath(segments.plusAll(other.segments));
	}

	public boolean isRoot() {
		return segments.isEmpty();
	}

	public int size() {
		return segments.size();
	}

	/**
	 * Builds a path from raw field names, where {@value #EACH} denotes collection elements.
	 * <p>
	 * <em>Higher risk:</em> nothing checks that such a path makes sense for any particular type.
	 * A mistake surfaces only when the path is applied, as a
	 * {@link works.spoke.schema.exceptions.PathNotFoundException PathNotFoundException}.
	 * Prefer {@link #checked} where a type description is at hand.
	 * Also note there's no way to name a field that is actually called {@value #EACH}.
	 */
	public static FieldPath unsafe(String... fieldNames) {
		return unsafe(List.of(fieldNames));
	}

	public static FieldPath unsafe(List<String> fieldNames) {
		FieldPath result = ROOT;
		for (String name: fieldNames) {
			result = EACH.equals(name) ? result.each() : result.field(name);
		}
		return result;
	}

	/**
	 * Starts a path that is verified against {@code rootType} as each step is added.
	 */
	public static CheckedFieldPath checked(TypeDescriptor rootType) {
		return CheckedFieldPath.startingAt(rootType, SchemaModifier.standard());
	}

	/**
	 * Like {@link #checked(TypeDescriptor)}, also allowing {@link #each} to descend
	 * into the containers known to {@code modifier}.
	 */
	public static CheckedFieldPath checked(TypeDescriptor rootType, SchemaModifier modifier) {
		return CheckedFieldPath.startingAt(rootType, modifier);
	}

	@Override
	public String toString() {
		if (segments.isEmpty()) {
			return "<root>";
		}
		return segments.stream()
			.map(Object::toString)
			.collect(joining("."));
	}
}
