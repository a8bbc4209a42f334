package works.spoke.schema.derivation;

import java.util.Locale;
import java.util.function.UnaryOperator;

import static java.util.Objects.requireNonNull;

/**
 * Computes the encoded (wire) name of a field from its name in the source type.
 */
@FunctionalInterface
public interface FieldNaming {
	String encode(String fieldName);

	FieldNaming IDENTITY = Standard.IDENTITY;

	/**
	 * {@code fruitAmount} becomes {@code fruit_amount};
	 * {@code HTTPStatus} becomes {@code http_status}.
	 */
	FieldNaming SNAKE_CASE = Standard.SNAKE_CASE;

	/**
	 * {@code fruitAmount} becomes {@code fruit-amount}.
	 */
	FieldNaming KEBAB_CASE = Standard.KEBAB_CASE;

	/**
	 * @param description used only for {@link Object#toString()}
	 */
	static FieldNaming custom(String description, UnaryOperator<String> function) {
		requireNonNull(function);
		return new FieldNaming() {
			@Override
			public String encode(String fieldName) {
				return function.apply(fieldName);
			}

			@Override
			public String toString() {
				return description;
			}
		};
	}

	enum Standard implements FieldNaming {
		IDENTITY {
			@Override
			public String encode(String fieldName) {
				return fieldName;
			}
		},
		SNAKE_CASE {
			@Override
			public String encode(String fieldName) {
				return separateWords(fieldName, "_");
			}
		},
		KEBAB_CASE {
			@Override
			public String encode(String fieldName) {
				return separateWords(fieldName, "-");
			}
		};

		private static String separateWords(String camelCase, String separator) {
			return camelCase
				.replaceAll("([A-Z]+)([A-Z][a-z])", "$1" + separator + "$2")
				.replaceAll("([a-z\\d])([A-Z])", "$1" + separator + "$2")
				.toLowerCase(Locale.ROOT);
		}
	}
}
