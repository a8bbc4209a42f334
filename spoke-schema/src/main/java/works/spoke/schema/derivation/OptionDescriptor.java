package works.spoke.schema.derivation;

import java.util.List;
import java.util.Optional;
import works.spoke.schema.SName;

import static java.util.Objects.requireNonNull;

/**
 * A value of type {@link #element} that may be absent.
 */
public record OptionDescriptor(TypeDescriptor element) implements TypeDescriptor {
	public OptionDescriptor {
		requireNonNull(element);
	}

	@Override
	public SName name() {
		return new SName(Optional.class.getName(), List.of(element.name().show()));
	}
}
