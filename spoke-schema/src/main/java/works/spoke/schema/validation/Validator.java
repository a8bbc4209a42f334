package works.spoke.schema.validation;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.PatternSyntaxException;
import org.jetbrains.annotations.Nullable;
import org.pcollections.PVector;
import org.pcollections.TreePVector;

import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * A constraint on decoded values, attached to a {@link works.spoke.schema.Schema Schema}.
 * <p>
 * Validators compose: {@link #and} builds a conjunction, {@link #or} a disjunction,
 * and {@link #contramap} applies a validator to some projection of the value.
 * The {@link Primitive} validators are the leaves;
 * documentation renderers typically only care about those,
 * via {@link #asPrimitiveValidators()}.
 * <p>
 * Equality is structural, except that {@link Custom} validators are equal
 * when their {@link Custom#id ids} are, and {@link Mapped} validators
 * compare their projection functions by identity.
 */
public sealed interface Validator permits
	Validator.Primitive,
	Validator.All,
	Validator.Any,
	Validator.Mapped
{
	/**
	 * @return the constraints {@code value} violates; empty if it satisfies them all
	 */
	List<ValidationError> validate(@Nullable Object value);

	/**
	 * @return the leaf validators, in order, that this one is built from
	 */
	List<Primitive> asPrimitiveValidators();

	/**
	 * @return true if this validator can never reject a value because it has no constraints
	 */
	default boolean isPass() {
		return false;
	}

	/**
	 * @return a validator requiring both {@code this} and {@code other}.
	 * Neither replaces the other; conjunctions are flattened.
	 */
	default Validator and(Validator other) {
		if (other.isPass()) {
			return this;
		} else if (this.isPass()) {
			return other;
		}
		List<Validator> parts = new ArrayList<>();
		addConjuncts(this, parts);
		addConjuncts(other, parts);
		return new All(TreePVector.from(parts));
	}

	/**
	 * @return a validator requiring either {@code this} or {@code other}
	 */
	default Validator or(Validator other) {
		List<Validator> parts = new ArrayList<>();
		addDisjuncts(this, parts);
		addDisjuncts(other, parts);
		return new Any(TreePVector.from(parts));
	}

	/**
	 * @param projectionName identifies {@code projection} in log messages and documentation
	 * @return a validator that applies {@code this} to {@code projection} of the value
	 */
	default Validator contramap(String projectionName, Function<Object, Object> projection) {
		return new Mapped(this, projectionName, projection);
	}

	private static void addConjuncts(Validator v, List<Validator> parts) {
		if (v instanceof All all) {
			parts.addAll(all.validators());
		} else {
			parts.add(v);
		}
	}

	private static void addDisjuncts(Validator v, List<Validator> parts) {
		if (v instanceof Any any) {
			parts.addAll(any.validators());
		} else {
			parts.add(v);
		}
	}

	//
	// Factories
	//

	static Validator pass() {
		return All.PASS;
	}

	static Validator all(Validator... validators) {
		Validator result = pass();
		for (var v: validators) {
			result = result.and(v);
		}
		return result;
	}

	static Validator any(Validator first, Validator... rest) {
		Validator result = first;
		for (var v: rest) {
			result = result.or(v);
		}
		return result;
	}

	static Min min(Number value) {
		return new Min(toDecimal(value), false);
	}

	static Min min(Number value, boolean exclusive) {
		return new Min(toDecimal(value), exclusive);
	}

	static Max max(Number value) {
		return new Max(toDecimal(value), false);
	}

	static Max max(Number value, boolean exclusive) {
		return new Max(toDecimal(value), exclusive);
	}

	static Validator inRange(Number min, Number max) {
		return min(min).and(max(max));
	}

	static Validator positive() {
		return min(0, true);
	}

	static Validator nonNegative() {
		return min(0);
	}

	static Pattern pattern(String regex) {
		return new Pattern(regex);
	}

	static MinLength minLength(int length) {
		return new MinLength(length);
	}

	static MaxLength maxLength(int length) {
		return new MaxLength(length);
	}

	static Validator fixedLength(int length) {
		return minLength(length).and(maxLength(length));
	}

	static Validator nonEmptyString() {
		return minLength(1);
	}

	static MinSize minSize(int size) {
		return new MinSize(size);
	}

	static MaxSize maxSize(int size) {
		return new MaxSize(size);
	}

	static Validator nonEmpty() {
		return minSize(1);
	}

	static Enumeration enumeration(Object... possibleValues) {
		return new Enumeration(TreePVector.<Object>from(Arrays.asList(possibleValues)));
	}

	static Enumeration enumeration(List<?> possibleValues) {
		return new Enumeration(TreePVector.<Object>from(possibleValues));
	}

	/**
	 * @param id identifies the predicate; two custom validators with the same id are equal
	 * @param message describes the constraint for error reports
	 */
	static Custom custom(String id, Predicate<Object> predicate, String message) {
		return new Custom(id, predicate, message);
	}

	private static BigDecimal toDecimal(Number n) {
		if (n instanceof BigDecimal bd) {
			return bd;
		}
		return new BigDecimal(n.toString());
	}

	//
	// Leaves
	//

	/**
	 * A validator that is not composed of other validators.
	 */
	sealed interface Primitive extends Validator permits
		Min,
		Max,
		Pattern,
		MinLength,
		MaxLength,
		MinSize,
		MaxSize,
		Enumeration,
		Custom
	{
		/**
		 * @return true if {@code value} satisfies this constraint
		 */
		boolean test(@Nullable Object value);

		/**
		 * @return a short description of what this validator requires
		 */
		String describe();

		@Override
		default List<ValidationError> validate(@Nullable Object value) {
			if (test(value)) {
				return List.of();
			}
			return List.of(new ValidationError(this, value, "expected " + describe() + " but got " + value));
		}

		@Override
		default List<Primitive> asPrimitiveValidators() {
			return List.of(this);
		}
	}

	record Min(BigDecimal value, boolean exclusive) implements Primitive {
		public Min {
			requireNonNull(value);
		}

		@Override
		public boolean test(@Nullable Object v) {
			BigDecimal d = decimalValue(v);
			if (d == null) {
				return false;
			}
			int c = d.compareTo(value);
			return exclusive ? c > 0 : c >= 0;
		}

		@Override
		public String describe() {
			return (exclusive ? "> " : ">= ") + value;
		}

		@Override
		public String toString() {
			return describe();
		}
	}

	record Max(BigDecimal value, boolean exclusive) implements Primitive {
		public Max {
			requireNonNull(value);
		}

		@Override
		public boolean test(@Nullable Object v) {
			BigDecimal d = decimalValue(v);
			if (d == null) {
				return false;
			}
			int c = d.compareTo(value);
			return exclusive ? c < 0 : c <= 0;
		}

		@Override
		public String describe() {
			return (exclusive ? "< " : "<= ") + value;
		}

		@Override
		public String toString() {
			return describe();
		}
	}

	/**
	 * The whole string must match {@link #regex}.
	 */
	record Pattern(String regex) implements Primitive {
		public Pattern {
			try {
				java.util.regex.Pattern.compile(regex);
			} catch (PatternSyntaxException e) {
				throw new IllegalArgumentException("Invalid pattern: " + regex, e);
			}
		}

		@Override
		public boolean test(@Nullable Object v) {
			return v instanceof CharSequence s
				&& java.util.regex.Pattern.compile(regex).matcher(s).matches();
		}

		@Override
		public String describe() {
			return "/" + regex + "/";
		}

		@Override
		public String toString() {
			return describe();
		}
	}

	record MinLength(int length) implements Primitive {
		@Override
		public boolean test(@Nullable Object v) {
			return v instanceof CharSequence s && s.length() >= length;
		}

		@Override
		public String describe() {
			return "length >= " + length;
		}

		@Override
		public String toString() {
			return describe();
		}
	}

	record MaxLength(int length) implements Primitive {
		@Override
		public boolean test(@Nullable Object v) {
			return v instanceof CharSequence s && s.length() <= length;
		}

		@Override
		public String describe() {
			return "length <= " + length;
		}

		@Override
		public String toString() {
			return describe();
		}
	}

	record MinSize(int size) implements Primitive {
		@Override
		public boolean test(@Nullable Object v) {
			int actual = sizeOf(v);
			return actual >= 0 && actual >= size;
		}

		@Override
		public String describe() {
			return "size >= " + size;
		}

		@Override
		public String toString() {
			return describe();
		}
	}

	record MaxSize(int size) implements Primitive {
		@Override
		public boolean test(@Nullable Object v) {
			int actual = sizeOf(v);
			return actual >= 0 && actual <= size;
		}

		@Override
		public String describe() {
			return "size <= " + size;
		}

		@Override
		public String toString() {
			return describe();
		}
	}

	/**
	 * The value must equal one of {@link #possibleValues}.
	 */
	record Enumeration(PVector<Object> possibleValues) implements Primitive {
		@Override
		public boolean test(@Nullable Object v) {
			return possibleValues.contains(v);
		}

		@Override
		public String describe() {
			return possibleValues.stream()
				.map(String::valueOf)
				.collect(joining(", ", "one of [", "]"));
		}

		@Override
		public String toString() {
			return describe();
		}
	}

	record Custom(String id, Predicate<Object> predicate, String message) implements Primitive {
		public Custom {
			requireNonNull(id);
			requireNonNull(predicate);
			requireNonNull(message);
		}

		@Override
		public boolean test(@Nullable Object v) {
			return predicate.test(v);
		}

		@Override
		public String describe() {
			return message;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Custom c && id.equals(c.id);
		}

		@Override
		public int hashCode() {
			return id.hashCode();
		}

		@Override
		public String toString() {
			return "custom:" + id;
		}
	}

	//
	// Composites
	//

	/**
	 * Conjunction. With no validators, this accepts everything.
	 */
	record All(PVector<Validator> validators) implements Validator {
		static final All PASS = new All(TreePVector.empty());

		@Override
		public List<ValidationError> validate(@Nullable Object value) {
			List<ValidationError> errors = new ArrayList<>();
			validators.forEach(v -> errors.addAll(v.validate(value)));
			return List.copyOf(errors);
		}

		@Override
		public List<Primitive> asPrimitiveValidators() {
			return validators.stream()
				.flatMap(v -> v.asPrimitiveValidators().stream())
				.toList();
		}

		@Override
		public boolean isPass() {
			return validators.isEmpty();
		}

		@Override
		public String toString() {
			if (validators.isEmpty()) {
				return "pass";
			}
			return validators.stream()
				.map(Object::toString)
				.collect(joining(" && ", "(", ")"));
		}
	}

	/**
	 * Disjunction. Always has at least one alternative.
	 */
	record Any(PVector<Validator> validators) implements Validator {
		public Any {
			if (validators.isEmpty()) {
				throw new IllegalArgumentException("Disjunction needs at least one alternative");
			}
		}

		@Override
		public List<ValidationError> validate(@Nullable Object value) {
			List<ValidationError> errors = new ArrayList<>();
			for (var v: validators) {
				List<ValidationError> these = v.validate(value);
				if (these.isEmpty()) {
					return List.of();
				}
				errors.addAll(these);
			}
			return List.copyOf(errors);
		}

		@Override
		public List<Primitive> asPrimitiveValidators() {
			return validators.stream()
				.flatMap(v -> v.asPrimitiveValidators().stream())
				.toList();
		}

		@Override
		public String toString() {
			return validators.stream()
				.map(Object::toString)
				.collect(joining(" || ", "(", ")"));
		}
	}

	/**
	 * Applies {@link #inner} to a projection of the value,
	 * such as the length of a collection or a field of a record.
	 */
	record Mapped(Validator inner, String projectionName, Function<Object, Object> projection) implements Validator {
		public Mapped {
			requireNonNull(inner);
			requireNonNull(projectionName);
			requireNonNull(projection);
		}

		@Override
		public List<ValidationError> validate(@Nullable Object value) {
			return inner.validate(projection.apply(value));
		}

		@Override
		public List<Primitive> asPrimitiveValidators() {
			return inner.asPrimitiveValidators();
		}

		@Override
		public boolean isPass() {
			return inner.isPass();
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Mapped m
				&& inner.equals(m.inner)
				&& projectionName.equals(m.projectionName)
				&& projection == m.projection;
		}

		@Override
		public int hashCode() {
			return Objects.hash(inner, projectionName);
		}

		@Override
		public String toString() {
			return projectionName + ":" + inner;
		}
	}

	private static @Nullable BigDecimal decimalValue(@Nullable Object v) {
		if (v instanceof BigDecimal bd) {
			return bd;
		} else if (v instanceof Number n) {
			try {
				return new BigDecimal(n.toString());
			} catch (NumberFormatException e) {
				// NaN and infinities have no decimal value
				return null;
			}
		} else {
			return null;
		}
	}

	/**
	 * @return the number of elements in {@code v}, or -1 if it isn't a container
	 */
	private static int sizeOf(@Nullable Object v) {
		if (v instanceof Collection<?> c) {
			return c.size();
		} else if (v instanceof Map<?, ?> m) {
			return m.size();
		} else if (v instanceof CharSequence s) {
			return s.length();
		} else if (v != null && v.getClass().isArray()) {
			return Array.getLength(v);
		} else {
			return -1;
		}
	}
}
