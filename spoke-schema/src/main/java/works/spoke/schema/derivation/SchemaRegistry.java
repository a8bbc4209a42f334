package works.spoke.schema.derivation;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.spoke.schema.SName;
import works.spoke.schema.Schema;

import static java.util.Objects.requireNonNull;

/**
 * Schemas supplied by hand, which take precedence over derivation.
 * <p>
 * Entries are {@link Directive}s, each of which says which types it applies to
 * and what schema to use for them. When several directives apply to a type,
 * the one registered most recently wins, unless it was added with {@link #addFallback},
 * in which case it applies only if no other directive does.
 * <p>
 * A registry is mutable until {@link #freeze frozen}; a {@link SchemaDeriver}
 * works from a frozen copy, so later registrations don't affect it.
 */
public class SchemaRegistry {
	private final Deque<Directive> directives;
	private final AtomicBoolean isFrozen = new AtomicBoolean(false);

	private SchemaRegistry(Deque<Directive> directives) {
		this.directives = directives;
	}

	public SchemaRegistry() {
		this(new ArrayDeque<>());
	}

	public static SchemaRegistry copyOf(SchemaRegistry other) {
		return new SchemaRegistry(new ArrayDeque<>(other.directives));
	}

	public static SchemaRegistry empty() {
		SchemaRegistry result = new SchemaRegistry();
		result.freeze();
		return result;
	}

	public void freeze() {
		isFrozen.set(true);
	}

	public boolean isFrozen() {
		return isFrozen.get();
	}

	/**
	 * A rule associating a schema with certain types.
	 *
	 * @param name has no significance other than for troubleshooting
	 * @param pattern selects the types to which the directive applies
	 * @param schema computes the schema for a particular type
	 */
	public record Directive(String name, Predicate<TypeDescriptor> pattern, Function<TypeDescriptor, Schema> schema) {
		public Directive {
			requireNonNull(name);
			requireNonNull(pattern);
			requireNonNull(schema);
		}

		/**
		 * @return a directive that applies only to the type named {@code type}, always returning {@code schema}
		 */
		public static Directive fixed(SName type, Schema schema) {
			requireNonNull(schema);
			return new Directive("<fixed schema for " + type.show() + ">", t -> t.name().equals(type), t -> schema);
		}

		public boolean appliesTo(TypeDescriptor type) {
			return pattern.test(type);
		}
	}

	/**
	 * Uses {@code schema} for the type named {@code type}, overriding any earlier registration.
	 *
	 * @return this
	 */
	public SchemaRegistry specify(SName type, Schema schema) {
		return add(Directive.fixed(type, schema));
	}

	/**
	 * Adds a directive that takes precedence over all previously added ones.
	 *
	 * @return this
	 */
	public SchemaRegistry add(Directive directive) {
		checkNotFrozen();
		LOGGER.debug("Adding directive {}", directive.name());
		directives.addFirst(directive);
		return this;
	}

	/**
	 * Adds a directive that applies only to types no other directive applies to.
	 *
	 * @return this
	 */
	public SchemaRegistry addFallback(Directive directive) {
		checkNotFrozen();
		LOGGER.debug("Adding fallback directive {}", directive.name());
		directives.addLast(directive);
		return this;
	}

	/**
	 * @return the schema from the highest-precedence directive that applies to {@code type}, if any
	 */
	public Optional<Schema> lookup(TypeDescriptor type) {
		for (var directive: directives) {
			if (directive.appliesTo(type)) {
				LOGGER.trace("Type {} matched directive {}", type.name(), directive.name());
				return Optional.of(requireNonNull(directive.schema().apply(type),
					() -> "Directive " + directive.name() + " returned null for " + type.name()));
			}
		}
		return Optional.empty();
	}

	public List<Directive> directives() {
		return List.copyOf(directives);
	}

	private void checkNotFrozen() {
		if (isFrozen.get()) {
			throw new IllegalStateException("SchemaRegistry is frozen");
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SchemaRegistry.class);
}
