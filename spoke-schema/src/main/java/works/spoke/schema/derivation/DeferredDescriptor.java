package works.spoke.schema.derivation;

import java.util.function.Supplier;
import works.spoke.schema.SName;

import static java.util.Objects.requireNonNull;

/**
 * A late-bound reference to the descriptor of the named type.
 * <p>
 * This is how self-referential types are described:
 * a type's own descriptor can't contain itself, but it can contain
 * a {@code DeferredDescriptor} whose {@link #target} supplies it later.
 * <p>
 * Equality considers only the {@link #name}.
 */
public record DeferredDescriptor(SName name, Supplier<? extends TypeDescriptor> target) implements TypeDescriptor {
	public DeferredDescriptor {
		requireNonNull(name);
		requireNonNull(target);
	}

	/**
	 * @throws IllegalStateException if the target isn't available yet, or describes a different type
	 */
	public TypeDescriptor resolve() {
		TypeDescriptor result = target.get();
		if (result == null) {
			throw new IllegalStateException("Deferred descriptor for " + name.show() + " is not bound yet");
		}
		if (!name.equals(result.name())) {
			throw new IllegalStateException("Deferred descriptor for " + name.show() + " resolved to " + result.name().show());
		}
		return result;
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof DeferredDescriptor d && name.equals(d.name);
	}

	@Override
	public int hashCode() {
		return name.hashCode();
	}

	@Override
	public String toString() {
		return "Deferred[" + name.show() + "]";
	}
}
