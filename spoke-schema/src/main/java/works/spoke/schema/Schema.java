package works.spoke.schema;

import java.util.List;
import java.util.function.UnaryOperator;
import org.jetbrains.annotations.Nullable;
import works.spoke.schema.modify.FieldPath;
import works.spoke.schema.modify.SchemaModifier;
import works.spoke.schema.validation.Validator;

import static java.util.Objects.requireNonNull;

/**
 * Describes the wire representation of some type: its structural {@link #schemaType shape},
 * plus documentation and validation metadata.
 * <p>
 * Schemas are immutable values with structural equality.
 * Every {@code with*} method returns a new schema, sharing unchanged parts with the original.
 *
 * @param schemaType the structure of the value
 * @param name the type this schema was derived from, if known
 * @param description human-readable documentation
 * @param defaultValue the value assumed when the input omits this one
 * @param encodedExample an example of the value in its encoded form
 * @param format a refinement of the primitive kind, such as {@code int64} or {@code uuid}
 * @param deprecated whether the value should no longer be used
 * @param hidden whether documentation should omit this value
 * @param validator constraints on the value; {@link Validator#pass()} if there are none
 */
public record Schema(
	SchemaType schemaType,
	@Nullable SName name,
	@Nullable String description,
	@Nullable Object defaultValue,
	@Nullable Object encodedExample,
	@Nullable String format,
	boolean deprecated,
	boolean hidden,
	Validator validator
) {
	public Schema {
		requireNonNull(schemaType);
		requireNonNull(validator);
	}

	/**
	 * Whether the value may be absent; that is, whether this is an {@link SOption} schema.
	 */
	public boolean isOptional() {
		return schemaType instanceof SOption;
	}

	public static Schema of(SchemaType schemaType) {
		return new Schema(schemaType, null, null, null, null, null, false, false, Validator.pass());
	}

	public static Schema primitive(PrimitiveKind kind) {
		return of(new SPrimitive(kind));
	}

	public static Schema string() {
		return primitive(PrimitiveKind.STRING);
	}

	public static Schema int32() {
		return primitive(PrimitiveKind.INTEGER).withFormat("int32");
	}

	public static Schema int64() {
		return primitive(PrimitiveKind.INTEGER).withFormat("int64");
	}

	public static Schema bigInteger() {
		return primitive(PrimitiveKind.INTEGER);
	}

	public static Schema float32() {
		return primitive(PrimitiveKind.NUMBER).withFormat("float");
	}

	public static Schema float64() {
		return primitive(PrimitiveKind.NUMBER).withFormat("double");
	}

	public static Schema decimal() {
		return primitive(PrimitiveKind.NUMBER);
	}

	public static Schema bool() {
		return primitive(PrimitiveKind.BOOLEAN);
	}

	public static Schema binary() {
		return primitive(PrimitiveKind.BINARY).withFormat("binary");
	}

	public static Schema date() {
		return primitive(PrimitiveKind.DATE).withFormat("date");
	}

	public static Schema dateTime() {
		return primitive(PrimitiveKind.DATE_TIME).withFormat("date-time");
	}

	public static Schema uuid() {
		return string().withFormat("uuid");
	}

	public static Schema array(Schema element) {
		return of(new SArray(element));
	}

	public static Schema optional(Schema element) {
		return of(new SOption(element));
	}

	public static Schema product(SName name, List<SProductField> fields) {
		return of(new SProduct(fields)).withName(name);
	}

	public static Schema product(List<SProductField> fields) {
		return of(new SProduct(fields));
	}

	public static Schema coproduct(List<Variant> variants, @Nullable Discriminator discriminator) {
		return of(new SCoproduct(variants, discriminator));
	}

	public static Schema coproduct(SName name, List<Variant> variants, @Nullable Discriminator discriminator) {
		return coproduct(variants, discriminator).withName(name);
	}

	public static Schema openProduct(Schema valueSchema) {
		return of(new SOpenProduct(valueSchema));
	}

	public static Schema ref(SName name) {
		return of(new SRef(name));
	}

	/**
	 * @return the name of the type this schema describes,
	 * whether it's the schema itself or an {@link SRef} to it
	 */
	public @Nullable SName typeName() {
		if (schemaType instanceof SRef r) {
			return r.name();
		} else {
			return name;
		}
	}

	public Schema withSchemaType(SchemaType schemaType) {
		return new Schema(schemaType, name, description, defaultValue, encodedExample, format, deprecated, hidden, validator);
	}

	public Schema withName(@Nullable SName name) {
		return new Schema(schemaType, name, description, defaultValue, encodedExample, format, deprecated, hidden, validator);
	}

	public Schema withDescription(@Nullable String description) {
		return new Schema(schemaType, name, description, defaultValue, encodedExample, format, deprecated, hidden, validator);
	}

	public Schema withDefault(@Nullable Object defaultValue) {
		return new Schema(schemaType, name, description, defaultValue, encodedExample, format, deprecated, hidden, validator);
	}

	public Schema withExample(@Nullable Object encodedExample) {
		return new Schema(schemaType, name, description, defaultValue, encodedExample, format, deprecated, hidden, validator);
	}

	public Schema withFormat(@Nullable String format) {
		return new Schema(schemaType, name, description, defaultValue, encodedExample, format, deprecated, hidden, validator);
	}

	public Schema withDeprecated(boolean deprecated) {
		return new Schema(schemaType, name, description, defaultValue, encodedExample, format, deprecated, hidden, validator);
	}

	public Schema withHidden(boolean hidden) {
		return new Schema(schemaType, name, description, defaultValue, encodedExample, format, deprecated, hidden, validator);
	}

	/**
	 * Adds a constraint. Existing constraints are kept:
	 * the resulting validator requires both.
	 */
	public Schema withValidator(Validator v) {
		return new Schema(schemaType, name, description, defaultValue, encodedExample, format, deprecated, hidden, validator.and(v));
	}

	/**
	 * @return a schema for an optional value of this type.
	 * Returns {@code this} if it's already optional.
	 */
	public Schema asOptional() {
		if (schemaType instanceof SOption) {
			return this;
		}
		return optional(this);
	}

	public Schema asArray() {
		return array(this);
	}

	/**
	 * Adds {@code v} to the schema of each element of this collection (or optional) value,
	 * rather than to the collection itself.
	 *
	 * @throws works.spoke.schema.exceptions.PathNotFoundException if this schema has no element schema
	 */
	public Schema validateEach(Validator v) {
		return modify(FieldPath.root().each(), element -> element.withValidator(v));
	}

	/**
	 * Applies {@code transformation} to the sub-schema at {@code path},
	 * using {@link SchemaModifier#standard()}.
	 *
	 * @throws works.spoke.schema.exceptions.PathNotFoundException if {@code path} doesn't match this schema
	 */
	public Schema modify(FieldPath path, UnaryOperator<Schema> transformation) {
		return SchemaModifier.standard().modify(this, path).apply(transformation);
	}

	/**
	 * Like {@link #modify}, but with the path given as raw field names,
	 * where {@value FieldPath#EACH} denotes collection elements.
	 * Nothing checks the path against the type beforehand.
	 *
	 * @see FieldPath#unsafe
	 */
	public Schema modifyUnsafe(UnaryOperator<Schema> transformation, String... fieldNames) {
		return modify(FieldPath.unsafe(fieldNames), transformation);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		if (name != null && !(schemaType instanceof SRef)) {
			sb.append(name.show());
		}
		sb.append(schemaType);
		if (format != null && schemaType instanceof SPrimitive) {
			sb.append("(").append(format).append(")");
		}
		if (!validator.isPass()) {
			sb.append(" ").append(validator);
		}
		if (description != null) {
			sb.append(" \"").append(description).append("\"");
		}
		if (deprecated) {
			sb.append(" !deprecated");
		}
		return sb.toString();
	}
}
