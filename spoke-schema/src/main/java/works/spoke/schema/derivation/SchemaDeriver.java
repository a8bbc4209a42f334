package works.spoke.schema.derivation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.spoke.schema.Discriminator;
import works.spoke.schema.SName;
import works.spoke.schema.SProductField;
import works.spoke.schema.Schema;
import works.spoke.schema.Variant;
import works.spoke.schema.exceptions.DerivationUnavailableException;
import works.spoke.schema.validation.Validator;

import static java.util.Objects.requireNonNull;

/**
 * Builds a {@link Schema} from a {@link TypeDescriptor}.
 * <p>
 * For each type encountered, a schema from the {@link SchemaRegistry} is used if one applies;
 * otherwise the schema is derived from the descriptor's structure:
 *
 * <ul>
 *     <li>
 *         primitives, collections, options, and maps have fixed structural mappings;
 *     </li>
 *     <li>
 *         products become {@link works.spoke.schema.SProduct SProduct}s with fields in declared order,
 *         named according to the {@link Configuration}'s {@link FieldNaming};
 *     </li>
 *     <li>
 *         coproducts become {@link works.spoke.schema.SCoproduct SCoproduct}s,
 *         with a {@link Discriminator} if the {@link Configuration} calls for one; and
 *     </li>
 *     <li>
 *         any {@link FieldMetadata} is overlaid last, by the {@link AnnotationResolver}.
 *     </li>
 * </ul>
 *
 * A product or coproduct that refers to itself, directly or indirectly,
 * gets an {@link works.spoke.schema.SRef SRef} at the point of re-entry
 * rather than being expanded again.
 * <p>
 * Derivation keeps no state between calls: deriving the same descriptor twice gives equal schemas,
 * and one deriver can be used from multiple threads at once.
 * Callers that derive the same type repeatedly may wish to cache the result.
 */
public class SchemaDeriver {
	private final Configuration configuration;
	private final SchemaRegistry registry;

	public SchemaDeriver(Configuration configuration, SchemaRegistry registry) {
		this.configuration = requireNonNull(configuration);
		if (registry.isFrozen()) {
			this.registry = registry;
		} else {
			this.registry = SchemaRegistry.copyOf(registry);
			this.registry.freeze();
		}
	}

	public SchemaDeriver(Configuration configuration) {
		this(configuration, SchemaRegistry.empty());
	}

	public static SchemaDeriver standard() {
		return STANDARD;
	}

	public Configuration configuration() {
		return configuration;
	}

	/**
	 * @throws DerivationUnavailableException if {@code type} or any type it refers to
	 * is {@link OpaqueDescriptor opaque} and has no registered schema
	 */
	public Schema derive(TypeDescriptor type) {
		LOGGER.debug("Deriving schema for {}", type.name());
		Schema result = new Pass().derive(type);
		LOGGER.debug("Derived {} -> {}", type.name(), result);
		return result;
	}

	/**
	 * The state of one call to {@link #derive}.
	 */
	private final class Pass {
		/**
		 * Products and coproducts whose derivation has begun but not finished, innermost first.
		 */
		final Deque<SName> inProgress = new ArrayDeque<>();

		/**
		 * Deferred descriptors being resolved, to catch cycles that never reach a product or coproduct.
		 */
		final Set<SName> resolving = new HashSet<>();

		Schema derive(TypeDescriptor type) {
			Optional<Schema> registered = registry.lookup(type);
			if (registered.isPresent()) {
				LOGGER.trace("Using registered schema for {}", type.name());
				return registered.get();
			}
			if (type instanceof PrimitiveDescriptor p) {
				Schema result = Schema.primitive(p.kind());
				return (p.format() == null) ? result : result.withFormat(p.format());
			} else if (type instanceof CollectionDescriptor c) {
				return Schema.array(derive(c.element()));
			} else if (type instanceof OptionDescriptor o) {
				return Schema.optional(derive(o.element()));
			} else if (type instanceof MapDescriptor m) {
				return Schema.openProduct(derive(m.value())).withName(m.name());
			} else if (type instanceof EnumerationDescriptor e) {
				return deriveEnumeration(e);
			} else if (type instanceof ProductDescriptor p) {
				return deriveProduct(p);
			} else if (type instanceof CoproductDescriptor c) {
				return deriveCoproduct(c);
			} else if (type instanceof DeferredDescriptor d) {
				return deriveDeferred(d);
			} else if (type instanceof OpaqueDescriptor o) {
				List<SName> chain = new ArrayList<>(inProgress);
				Collections.reverse(chain);
				throw new DerivationUnavailableException(o.name(), chain);
			} else {
				throw new AssertionError("Unexpected descriptor type: " + type.getClass());
			}
		}

		Schema deriveEnumeration(EnumerationDescriptor e) {
			Schema result = Schema.string()
				.withName(e.name())
				.withValidator(Validator.enumeration(e.values()));
			return AnnotationResolver.resolveType(result, e.metadata());
		}

		Schema deriveProduct(ProductDescriptor p) {
			if (inProgress.contains(p.name())) {
				LOGGER.trace("Recursive reference to {}", p.name());
				return Schema.ref(p.name());
			}
			inProgress.push(p.name());
			try {
				List<SProductField> fields = new ArrayList<>(p.fields().size());
				for (var f: p.fields()) {
					Schema fieldSchema = derive(f.type());
					if (f.defaultValue() != null) {
						fieldSchema = fieldSchema.withDefault(f.defaultValue());
					}
					String encodedName = configuration.getFieldNaming().encode(f.name());
					var field = new SProductField(f.name(), encodedName, fieldSchema);
					fields.add(AnnotationResolver.resolveField(field, f.metadata()));
				}
				return AnnotationResolver.resolveType(Schema.product(p.name(), fields), p.metadata());
			} finally {
				inProgress.pop();
			}
		}

		Schema deriveCoproduct(CoproductDescriptor c) {
			if (inProgress.contains(c.name())) {
				LOGGER.trace("Recursive reference to {}", c.name());
				return Schema.ref(c.name());
			}
			inProgress.push(c.name());
			try {
				Optional<String> discriminatorField = configuration.discriminatorField();
				List<Variant> variants = new ArrayList<>(c.variants().size());
				List<String> labels = new ArrayList<>(c.variants().size());
				for (var v: c.variants()) {
					Schema variantSchema = derive(v.type());
					if (discriminatorField.isPresent()) {
						String label = (v.label() != null) ? v.label() : configuration.discriminatorValueFor(v.type().name());
						variants.add(new Variant(label, variantSchema));
						labels.add(label);
					} else {
						variants.add(new Variant(v.label(), variantSchema));
					}
				}
				Discriminator discriminator = discriminatorField
					.map(name -> new Discriminator(name, Schema.string().withValidator(Validator.enumeration(labels))))
					.orElse(null);
				return AnnotationResolver.resolveType(Schema.coproduct(c.name(), variants, discriminator), c.metadata());
			} finally {
				inProgress.pop();
			}
		}

		Schema deriveDeferred(DeferredDescriptor d) {
			if (inProgress.contains(d.name())) {
				LOGGER.trace("Recursive reference to {} via deferred descriptor", d.name());
				return Schema.ref(d.name());
			}
			if (!resolving.add(d.name())) {
				throw new IllegalArgumentException("Type " + d.name().show()
					+ " refers to itself without an intervening product or coproduct");
			}
			try {
				return derive(d.resolve());
			} finally {
				resolving.remove(d.name());
			}
		}
	}

	private static final SchemaDeriver STANDARD = new SchemaDeriver(Configuration.DEFAULT);
	private static final Logger LOGGER = LoggerFactory.getLogger(SchemaDeriver.class);
}
