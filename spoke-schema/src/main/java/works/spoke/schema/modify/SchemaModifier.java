package works.spoke.schema.modify;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;
import org.jetbrains.annotations.Nullable;
import org.pcollections.HashTreePMap;
import org.pcollections.PMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.spoke.schema.SArray;
import works.spoke.schema.SCoproduct;
import works.spoke.schema.SName;
import works.spoke.schema.SOpenProduct;
import works.spoke.schema.SOption;
import works.spoke.schema.SPrimitive;
import works.spoke.schema.SProduct;
import works.spoke.schema.SProductField;
import works.spoke.schema.SRef;
import works.spoke.schema.Schema;
import works.spoke.schema.exceptions.PathNotFoundException;
import works.spoke.schema.modify.FieldPath.Field;

import static java.util.Objects.requireNonNull;

/**
 * Applies transformations to sub-schemas located by {@link FieldPath}s.
 * <p>
 * {@link FieldPath.Each Each} steps descend into arrays, optional values, and the values of open products.
 * Other container types can be taught to the modifier with {@link #withUnwrapper};
 * a registered unwrapper takes precedence over the built-in handling for schemas bearing its name.
 * <p>
 * Modifiers are immutable; {@link #withUnwrapper} returns a new one.
 */
public final class SchemaModifier {
	private final PMap<SName, ContainerUnwrapper> unwrappers;

	private static final SchemaModifier STANDARD = new SchemaModifier(HashTreePMap.empty());

	private SchemaModifier(PMap<SName, ContainerUnwrapper> unwrappers) {
		this.unwrappers = unwrappers;
	}

	/**
	 * @return a modifier that knows only the built-in containers
	 */
	public static SchemaModifier standard() {
		return STANDARD;
	}

	/**
	 * @return a modifier like this one that uses {@code unwrapper} for {@code each} steps
	 * into schemas named {@code containerType}. Replaces any existing unwrapper for that name.
	 */
	public SchemaModifier withUnwrapper(SName containerType, ContainerUnwrapper unwrapper) {
		requireNonNull(containerType);
		requireNonNull(unwrapper);
		LOGGER.debug("Registering container unwrapper for {}", containerType.show());
		return new SchemaModifier(unwrappers.plus(containerType, unwrapper));
	}

	public @Nullable ContainerUnwrapper unwrapperFor(SName containerType) {
		return unwrappers.get(containerType);
	}

	/**
	 * Locates the sub-schema of {@code root} at {@code path}.
	 * <p>
	 * The whole path is resolved here, before any transformation is supplied,
	 * so a path that doesn't fit fails without having modified anything.
	 *
	 * @throws PathNotFoundException if some segment of {@code path} doesn't match the schema at that point
	 */
	public Modification modify(Schema root, FieldPath path) {
		requireNonNull(root);
		requireNonNull(path);
		List<UnaryOperator<Schema>> rebuilders = new ArrayList<>(path.size());
		Schema current = root;
		for (int i = 0; i < path.size(); i++) {
			Step step;
			if (path.segments().get(i) instanceof Field f) {
				step = stepIntoField(current, f, path, i);
			} else {
				step = stepIntoElements(current, path, i);
			}
			rebuilders.add(step.rebuild());
			current = step.child();
		}
		LOGGER.trace("Resolved {} to {}", path, current);
		return new ResolvedModification(root, path, current, List.copyOf(rebuilders));
	}

	/**
	 * @param child the sub-schema one segment down
	 * @param rebuild given a replacement for {@code child}, returns the correspondingly modified parent
	 */
	private record Step(Schema child, UnaryOperator<Schema> rebuild) { }

	private Step stepIntoField(Schema parent, Field segment, FieldPath path, int index) {
		if (!(parent.schemaType() instanceof SProduct product)) {
			throw new PathNotFoundException(path, index, describe(parent));
		}
		int fieldIndex = product.indexOf(segment.name());
		if (fieldIndex < 0) {
			throw new PathNotFoundException(path, index, "product with fields " + fieldNames(product));
		}
		SProductField field = product.fields().get(fieldIndex);
		return new Step(field.schema(), newChild ->
			parent.withSchemaType(product.withField(fieldIndex, field.withSchema(newChild))));
	}

	private Step stepIntoElements(Schema parent, FieldPath path, int index) {
		SName name = parent.name();
		if (name != null) {
			ContainerUnwrapper unwrapper = unwrappers.get(name);
			if (unwrapper != null) {
				return new Step(unwrapper.element(parent), newChild -> unwrapper.withElement(parent, newChild));
			}
		}
		if (parent.schemaType() instanceof SArray a) {
			return new Step(a.element(), newChild -> parent.withSchemaType(new SArray(newChild)));
		} else if (parent.schemaType() instanceof SOption o) {
			return new Step(o.element(), newChild -> parent.withSchemaType(new SOption(newChild)));
		} else if (parent.schemaType() instanceof SOpenProduct p) {
			return new Step(p.valueSchema(), newChild -> parent.withSchemaType(new SOpenProduct(newChild)));
		} else {
			throw new PathNotFoundException(path, index, describe(parent));
		}
	}

	private static List<String> fieldNames(SProduct product) {
		return product.fields().stream().map(SProductField::name).toList();
	}

	private static String describe(Schema schema) {
		if (schema.schemaType() instanceof SPrimitive p) {
			return "primitive " + p.kind().show();
		} else if (schema.schemaType() instanceof SProduct p) {
			return "product with fields " + fieldNames(p);
		} else if (schema.schemaType() instanceof SCoproduct) {
			return "coproduct";
		} else if (schema.schemaType() instanceof SRef r) {
			return "reference to " + r.name().show() + " (references are not followed)";
		} else {
			return schema.schemaType().toString();
		}
	}

	private record ResolvedModification(
		Schema root,
		FieldPath path,
		Schema target,
		List<UnaryOperator<Schema>> rebuilders
	) implements Modification {
		@Override
		public Schema get() {
			return target;
		}

		@Override
		public Schema apply(UnaryOperator<Schema> transformation) {
			Schema result = requireNonNull(transformation.apply(target), "transformation result");
			for (int i = rebuilders.size() - 1; i >= 0; i--) {
				result = rebuilders.get(i).apply(result);
			}
			return result;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SchemaModifier.class);
}
