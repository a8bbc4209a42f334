package works.spoke.schema.reflect;

import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Stream;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.spoke.schema.PrimitiveKind;
import works.spoke.schema.SName;
import works.spoke.schema.derivation.CollectionDescriptor;
import works.spoke.schema.derivation.CoproductDescriptor;
import works.spoke.schema.derivation.EnumerationDescriptor;
import works.spoke.schema.derivation.FieldDescriptor;
import works.spoke.schema.derivation.FieldMetadata;
import works.spoke.schema.derivation.MapDescriptor;
import works.spoke.schema.derivation.PrimitiveDescriptor;
import works.spoke.schema.derivation.ProductDescriptor;
import works.spoke.schema.derivation.TypeDescriptor;
import works.spoke.schema.derivation.TypeDescriptors;
import works.spoke.schema.derivation.VariantDescriptor;
import works.spoke.schema.validation.Validator;

import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;
import static works.spoke.schema.derivation.TypeDescriptors.opaque;

/**
 * Produces {@link TypeDescriptor}s for Java types by reflection.
 * <p>
 * Records become products, with fields in component order;
 * sealed interfaces (and sealed classes) become coproducts over their permitted subtypes;
 * enums become enumerations of their constant names.
 * {@link Optional}, {@link Collection}s, arrays, and {@link Map}s with {@link String} keys
 * get their usual structural descriptions, and a handful of well-known value types are primitives.
 * Anything else is {@link works.spoke.schema.derivation.OpaqueDescriptor opaque},
 * and needs a schema registered for it before it can be derived.
 * <p>
 * Type arguments are substituted into record components,
 * so {@code Box<Fruit>} and {@code Box<Vegetable>} get distinct descriptions.
 * Permitted subtypes of a generic sealed type are described without type arguments.
 * <p>
 * Metadata is read from the annotations in this package, plus {@link Deprecated}.
 * <p>
 * Descriptions are cached per describer, so each type is examined once.
 * If describing a type fails, nothing examined during that attempt is cached.
 * A type that refers back to itself gets a
 * {@link works.spoke.schema.derivation.DeferredDescriptor DeferredDescriptor} at the point of re-entry.
 */
public class ReflectiveTypeDescriber {
	private final Map<SName, TypeDescriptor> memo = new HashMap<>();
	private final Set<SName> inProgress = new HashSet<>();

	/**
	 * Entries added to {@link #memo} since the outermost description began.
	 */
	private final List<SName> uncommitted = new ArrayList<>();

	private static final Map<Class<?>, PrimitiveDescriptor> WELL_KNOWN = Map.ofEntries(
		Map.entry(String.class, TypeDescriptors.STRING),
		Map.entry(int.class, TypeDescriptors.INT),
		Map.entry(Integer.class, TypeDescriptors.INT),
		Map.entry(short.class, TypeDescriptors.INT),
		Map.entry(Short.class, TypeDescriptors.INT),
		Map.entry(byte.class, TypeDescriptors.INT),
		Map.entry(Byte.class, TypeDescriptors.INT),
		Map.entry(long.class, TypeDescriptors.LONG),
		Map.entry(Long.class, TypeDescriptors.LONG),
		Map.entry(float.class, TypeDescriptors.FLOAT),
		Map.entry(Float.class, TypeDescriptors.FLOAT),
		Map.entry(double.class, TypeDescriptors.DOUBLE),
		Map.entry(Double.class, TypeDescriptors.DOUBLE),
		Map.entry(boolean.class, TypeDescriptors.BOOLEAN),
		Map.entry(Boolean.class, TypeDescriptors.BOOLEAN),
		Map.entry(char.class, TypeDescriptors.primitive(Character.class, PrimitiveKind.STRING, null)),
		Map.entry(Character.class, TypeDescriptors.primitive(Character.class, PrimitiveKind.STRING, null)),
		Map.entry(BigDecimal.class, TypeDescriptors.BIG_DECIMAL),
		Map.entry(BigInteger.class, TypeDescriptors.BIG_INTEGER),
		Map.entry(UUID.class, TypeDescriptors.UUID_STRING),
		Map.entry(byte[].class, TypeDescriptors.BYTES),
		Map.entry(LocalDate.class, TypeDescriptors.LOCAL_DATE),
		Map.entry(Instant.class, TypeDescriptors.INSTANT),
		Map.entry(OffsetDateTime.class, TypeDescriptors.primitive(OffsetDateTime.class, PrimitiveKind.DATE_TIME, "date-time")),
		Map.entry(ZonedDateTime.class, TypeDescriptors.primitive(ZonedDateTime.class, PrimitiveKind.DATE_TIME, "date-time"))
	);

	public TypeDescriptor describe(Class<?> type) {
		return describe((Type) type);
	}

	public TypeDescriptor describe(TypeReference<?> type) {
		return describe(type.reflectionType());
	}

	/**
	 * @param type must not contain unbound type variables;
	 *             any that it does are described as opaque
	 */
	public synchronized TypeDescriptor describe(Type type) {
		requireNonNull(type);
		if (type instanceof Class<?> c) {
			return describeClass(c);
		} else if (type instanceof ParameterizedType p) {
			return describeParameterized(p);
		} else if (type instanceof GenericArrayType g) {
			TypeDescriptor element = describe(g.getGenericComponentType());
			return new CollectionDescriptor(new SName(element.name().fullName() + "[]", element.name().typeParameterShortNames()), element);
		} else if (type instanceof WildcardType w && w.getLowerBounds().length == 0) {
			return describe(w.getUpperBounds()[0]);
		} else {
			LOGGER.debug("Unable to describe {}", type);
			return opaque(new SName(type.getTypeName()));
		}
	}

	private TypeDescriptor describeClass(Class<?> c) {
		PrimitiveDescriptor known = WELL_KNOWN.get(c);
		if (known != null) {
			return known;
		} else if (c.isArray()) {
			TypeDescriptor element = describe(c.getComponentType());
			return new CollectionDescriptor(new SName(c.getTypeName()), element);
		} else if (c.isEnum()) {
			return memoized(SName.of(c), name -> describeEnum(name, c));
		} else if (c.isRecord()) {
			return memoized(SName.of(c), name -> describeRecord(name, c, Map.of()));
		} else if (c.isSealed()) {
			return memoized(SName.of(c), name -> describeSealed(name, c));
		} else {
			return opaque(SName.of(c));
		}
	}

	private TypeDescriptor describeParameterized(ParameterizedType p) {
		Class<?> raw = (Class<?>) p.getRawType();
		Type[] args = p.getActualTypeArguments();
		if (raw == Optional.class) {
			return TypeDescriptors.optionOf(describe(args[0]));
		} else if (Collection.class.isAssignableFrom(raw)) {
			TypeDescriptor element = describe(args[0]);
			return new CollectionDescriptor(SName.of(raw, element.name().show()), element);
		} else if (Map.class.isAssignableFrom(raw)) {
			if (args[0] != String.class) {
				LOGGER.debug("Map keys must be strings: {}", p);
				return opaque(new SName(p.getTypeName()));
			}
			TypeDescriptor value = describe(args[1]);
			return new MapDescriptor(SName.of(raw, "String", value.name().show()), value);
		} else if (raw.isRecord()) {
			String[] argNames = Stream.of(args)
				.map(a -> describe(a).name().show())
				.toArray(String[]::new);
			TypeVariable<?>[] parameters = raw.getTypeParameters();
			Map<String, Type> bindings = new HashMap<>();
			for (int i = 0; i < parameters.length; i++) {
				bindings.put(parameters[i].getName(), args[i]);
			}
			return memoized(SName.of(raw, argNames), name -> describeRecord(name, raw, bindings));
		} else {
			return describeClass(raw);
		}
	}

	private TypeDescriptor memoized(SName name, Function<SName, ? extends TypeDescriptor> describer) {
		TypeDescriptor existing = memo.get(name);
		if (existing != null) {
			return existing;
		}
		if (inProgress.contains(name)) {
			LOGGER.trace("Deferring recursive reference to {}", name);
			return TypeDescriptors.deferred(name, () -> memo.get(name));
		}
		boolean outermost = inProgress.isEmpty();
		inProgress.add(name);
		try {
			TypeDescriptor result = describer.apply(name);
			memo.put(name, result);
			uncommitted.add(name);
			LOGGER.debug("Described {}", name);
			if (outermost) {
				uncommitted.clear();
			}
			return result;
		} catch (RuntimeException e) {
			if (outermost) {
				// Anything finished along the way may hold a deferred reference to a type that never got described
				LOGGER.debug("Discarding {} descriptions after failing to describe {}", uncommitted.size(), name);
				uncommitted.forEach(memo::remove);
				uncommitted.clear();
			}
			throw e;
		} finally {
			inProgress.remove(name);
		}
	}

	private EnumerationDescriptor describeEnum(SName name, Class<?> enumClass) {
		List<String> values = Stream.of(enumClass.getEnumConstants())
			.map(e -> ((Enum<?>) e).name())
			.toList();
		return new EnumerationDescriptor(name, values, metadataOf(enumClass, enumClass, null));
	}

	private ProductDescriptor describeRecord(SName name, Class<?> recordClass, Map<String, Type> bindings) {
		var builder = ProductDescriptor.named(name);
		for (RecordComponent c: recordClass.getRecordComponents()) {
			TypeDescriptor componentType = describe(substitute(c.getGenericType(), bindings));
			FieldMetadata metadata = metadataOf(c, c.getAccessor(), componentType);
			builder.field(new FieldDescriptor(c.getName(), componentType, metadata.defaultValue(), metadata.withDefaultValue(null)));
		}
		return builder
			.metadata(metadataOf(recordClass, recordClass, null).withEncodedName(null))
			.build();
	}

	private CoproductDescriptor describeSealed(SName name, Class<?> sealedClass) {
		var builder = CoproductDescriptor.named(name);
		for (Class<?> subclass: sealedClass.getPermittedSubclasses()) {
			EncodedName label = subclass.getAnnotation(EncodedName.class);
			TypeDescriptor variantType = describe(subclass);
			builder.variant(new VariantDescriptor(label == null ? null : label.value(), variantType));
		}
		return builder
			.metadata(metadataOf(sealedClass, sealedClass, null).withEncodedName(null))
			.build();
	}

	/**
	 * Replaces type variables named in {@code bindings}.
	 * Those not named are left alone, and will be described as opaque.
	 */
	private static Type substitute(Type type, Map<String, Type> bindings) {
		if (bindings.isEmpty()) {
			return type;
		} else if (type instanceof TypeVariable<?> v) {
			return bindings.getOrDefault(v.getName(), v);
		} else if (type instanceof ParameterizedType p) {
			Type[] args = Stream.of(p.getActualTypeArguments())
				.map(a -> substitute(a, bindings))
				.toArray(Type[]::new);
			return new SubstitutedType((Class<?>) p.getRawType(), args, p.getOwnerType());
		} else if (type instanceof WildcardType w && w.getLowerBounds().length == 0) {
			return substitute(w.getUpperBounds()[0], bindings);
		} else if (type instanceof GenericArrayType g) {
			Type component = substitute(g.getGenericComponentType(), bindings);
			if (component instanceof Class<?> c) {
				return c.arrayType();
			}
			return (GenericArrayType) () -> component;
		} else {
			return type;
		}
	}

	private record SubstitutedType(Class<?> rawType, Type[] actualTypeArguments, @Nullable Type ownerType) implements ParameterizedType {
		@Override
		public Type[] getActualTypeArguments() {
			return actualTypeArguments.clone();
		}

		@Override
		public Type getRawType() {
			return rawType;
		}

		@Override
		public @Nullable Type getOwnerType() {
			return ownerType;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof ParameterizedType p
				&& rawType.equals(p.getRawType())
				&& Arrays.equals(actualTypeArguments, p.getActualTypeArguments());
		}

		@Override
		public int hashCode() {
			return rawType.hashCode() ^ Arrays.hashCode(actualTypeArguments);
		}

		@Override
		public String toString() {
			return Stream.of(actualTypeArguments)
				.map(Type::getTypeName)
				.collect(joining(", ", rawType.getName() + "<", ">"));
		}
	}

	/**
	 * @param annotated where the annotations of this package are found
	 * @param deprecatable where {@link Deprecated} is found; for record components, that's the accessor method
	 * @param type the described type of the annotated element, used to interpret {@link Default}; null for types
	 */
	private static FieldMetadata metadataOf(AnnotatedElement annotated, AnnotatedElement deprecatable, @Nullable TypeDescriptor type) {
		FieldMetadata result = FieldMetadata.NONE;
		EncodedName encodedName = annotated.getAnnotation(EncodedName.class);
		if (encodedName != null) {
			result = result.withEncodedName(encodedName.value());
		}
		Description description = annotated.getAnnotation(Description.class);
		if (description != null) {
			result = result.withDescription(description.value());
		}
		Default defaultValue = annotated.getAnnotation(Default.class);
		if (defaultValue != null && type != null) {
			result = result.withDefaultValue(decodeDefault(defaultValue.value(), type));
		}
		EncodedExample example = annotated.getAnnotation(EncodedExample.class);
		if (example != null) {
			result = result.withEncodedExample(example.value());
		}
		Format format = annotated.getAnnotation(Format.class);
		if (format != null) {
			result = result.withFormat(format.value());
		}
		if (deprecatable.isAnnotationPresent(Deprecated.class)) {
			result = result.withDeprecated(true);
		}
		if (annotated.isAnnotationPresent(Hidden.class)) {
			result = result.withHidden(true);
		}
		return result.withValidator(validatorOf(annotated));
	}

	private static Validator validatorOf(AnnotatedElement annotated) {
		Validator result = Validator.pass();
		Min min = annotated.getAnnotation(Min.class);
		if (min != null) {
			result = result.and(Validator.min(min.value(), min.exclusive()));
		}
		Max max = annotated.getAnnotation(Max.class);
		if (max != null) {
			result = result.and(Validator.max(max.value(), max.exclusive()));
		}
		Pattern pattern = annotated.getAnnotation(Pattern.class);
		if (pattern != null) {
			result = result.and(Validator.pattern(pattern.value()));
		}
		MinLength minLength = annotated.getAnnotation(MinLength.class);
		if (minLength != null) {
			result = result.and(Validator.minLength(minLength.value()));
		}
		MaxLength maxLength = annotated.getAnnotation(MaxLength.class);
		if (maxLength != null) {
			result = result.and(Validator.maxLength(maxLength.value()));
		}
		return result;
	}

	private static Object decodeDefault(String encoded, TypeDescriptor type) {
		if (type instanceof PrimitiveDescriptor p) {
			try {
				return switch (p.kind()) {
					case INTEGER -> new BigInteger(encoded);
					case NUMBER -> new BigDecimal(encoded);
					case BOOLEAN -> Boolean.valueOf(encoded);
					default -> encoded;
				};
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException("Default value \"" + encoded + "\" is not valid for " + p.name().show(), e);
			}
		}
		return encoded;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ReflectiveTypeDescriber.class);
}
