package works.spoke.schema;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The named schemas within a schema tree, by which {@link SRef}s can be resolved.
 * <p>
 * When the same type appears more than once, the first occurrence found in a depth-first walk
 * from the root is taken as its definition. That need not be the occurrence nearest the root.
 */
public final class SchemaDefinitions {
	private final Map<SName, Schema> definitions;
	private final Set<SName> references;

	private SchemaDefinitions(Map<SName, Schema> definitions, Set<SName> references) {
		this.definitions = definitions;
		this.references = references;
	}

	public static SchemaDefinitions collect(Schema root) {
		Map<SName, Schema> definitions = new LinkedHashMap<>();
		Set<SName> references = new LinkedHashSet<>();
		Deque<Schema> pending = new ArrayDeque<>();
		pending.push(root);
		while (!pending.isEmpty()) {
			Schema schema = pending.pop();
			if (schema.schemaType() instanceof SRef r) {
				references.add(r.name());
				continue;
			}
			if (schema.name() != null) {
				definitions.putIfAbsent(schema.name(), schema);
			}
			var children = schema.schemaType().children();
			for (int i = children.size() - 1; i >= 0; i--) {
				pending.push(children.get(i));
			}
		}
		return new SchemaDefinitions(Map.copyOf(definitions), Set.copyOf(references));
	}

	public Optional<Schema> get(SName name) {
		return Optional.ofNullable(definitions.get(name));
	}

	/**
	 * @return the definition {@code schema} refers to if it's an {@link SRef}; otherwise {@code schema} itself
	 * @throws IllegalArgumentException if {@code schema} refers to a type with no definition here
	 */
	public Schema resolve(Schema schema) {
		if (schema.schemaType() instanceof SRef r) {
			Schema result = definitions.get(r.name());
			if (result == null) {
				throw new IllegalArgumentException("No definition for " + r.name().show());
			}
			return result;
		}
		return schema;
	}

	public Set<SName> names() {
		return definitions.keySet();
	}

	/**
	 * @return names referred to by some {@link SRef} but not defined in the tree
	 */
	public Set<SName> unresolvedReferences() {
		Set<SName> result = new LinkedHashSet<>(references);
		result.removeAll(definitions.keySet());
		return result;
	}
}
