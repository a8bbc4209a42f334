package works.spoke.schema;

import java.util.List;

import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * Identifies the type a schema was derived from.
 * Two schemas for the same type carry equal names,
 * which is what recursion detection and {@link SRef} resolution rely on.
 *
 * @param fullName usually the fully qualified class name
 * @param typeParameterShortNames short names of any type arguments, in order
 */
public record SName(String fullName, List<String> typeParameterShortNames) {
	public SName {
		requireNonNull(fullName);
		if (fullName.isEmpty()) {
			throw new IllegalArgumentException("Type name can't be empty");
		}
		typeParameterShortNames = List.copyOf(typeParameterShortNames);
	}

	public SName(String fullName) {
		this(fullName, List.of());
	}

	public static SName of(Class<?> type, String... typeParameterShortNames) {
		return new SName(type.getName(), List.of(typeParameterShortNames));
	}

	/**
	 * @return the part of {@link #fullName} after the last {@code .} or {@code $}
	 */
	public String shortName() {
		int cut = Math.max(fullName.lastIndexOf('.'), fullName.lastIndexOf('$'));
		return fullName.substring(cut + 1);
	}

	/**
	 * @return the short name, with type arguments appended in angle brackets
	 */
	public String show() {
		if (typeParameterShortNames.isEmpty()) {
			return shortName();
		}
		return typeParameterShortNames.stream().collect(joining(",", shortName() + "<", ">"));
	}

	@Override
	public String toString() {
		return show();
	}
}
