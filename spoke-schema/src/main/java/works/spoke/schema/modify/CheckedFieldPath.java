package works.spoke.schema.modify;

import java.util.Optional;
import works.spoke.schema.derivation.CollectionDescriptor;
import works.spoke.schema.derivation.DeferredDescriptor;
import works.spoke.schema.derivation.FieldDescriptor;
import works.spoke.schema.derivation.MapDescriptor;
import works.spoke.schema.derivation.OptionDescriptor;
import works.spoke.schema.derivation.ProductDescriptor;
import works.spoke.schema.derivation.TypeDescriptor;
import works.spoke.schema.exceptions.PathNotFoundException;

import static java.util.Objects.requireNonNull;

/**
 * Builds a {@link FieldPath} while tracking the type each step arrives at,
 * so a step that doesn't exist in the type fails immediately,
 * rather than when the path is eventually applied.
 *
 * @see FieldPath#checked
 */
public final class CheckedFieldPath {
	private final FieldPath path;
	private final TypeDescriptor type;
	private final SchemaModifier modifier;

	private CheckedFieldPath(FieldPath path, TypeDescriptor type, SchemaModifier modifier) {
		this.path = path;
		this.type = type;
		this.modifier = modifier;
	}

	static CheckedFieldPath startingAt(TypeDescriptor rootType, SchemaModifier modifier) {
		return new CheckedFieldPath(FieldPath.root(), requireNonNull(rootType), requireNonNull(modifier));
	}

	/**
	 * @throws PathNotFoundException if the current type is not a product with a field called {@code name}
	 */
	public CheckedFieldPath field(String name) {
		FieldPath next = path.field(name);
		TypeDescriptor current = resolved(type);
		if (current instanceof ProductDescriptor p) {
			FieldDescriptor field = p.field(name);
			if (field != null) {
				return new CheckedFieldPath(next, field.type(), modifier);
			}
		}
		throw new PathNotFoundException(next, next.size() - 1, current.name().show());
	}

	/**
	 * @throws PathNotFoundException if the current type has no elements
	 */
	public CheckedFieldPath each() {
		FieldPath next = path.each();
		TypeDescriptor current = resolved(type);
		return elementType(current)
			.map(t -> new CheckedFieldPath(next, t, modifier))
			.orElseThrow(() -> new PathNotFoundException(next, next.size() - 1, current.name().show()));
	}

	private Optional<TypeDescriptor> elementType(TypeDescriptor container) {
		ContainerUnwrapper unwrapper = modifier.unwrapperFor(container.name());
		if (unwrapper != null) {
			return unwrapper.elementType(container);
		} else if (container instanceof CollectionDescriptor c) {
			return Optional.of(c.element());
		} else if (container instanceof OptionDescriptor o) {
			return Optional.of(o.element());
		} else if (container instanceof MapDescriptor m) {
			return Optional.of(m.value());
		} else {
			return Optional.empty();
		}
	}

	private static TypeDescriptor resolved(TypeDescriptor type) {
		TypeDescriptor result = type;
		while (result instanceof DeferredDescriptor d) {
			result = d.resolve();
		}
		return result;
	}

	/**
	 * @return the type at the end of the path so far
	 */
	public TypeDescriptor type() {
		return type;
	}

	public FieldPath build() {
		return path;
	}

	@Override
	public String toString() {
		return path + ": " + type.name().show();
	}
}
