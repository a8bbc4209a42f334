package works.spoke.schema.exceptions;

import java.util.List;
import works.spoke.schema.SName;

import static java.util.stream.Collectors.joining;

/**
 * A type reachable from the one being derived has neither a registered schema
 * nor a structural description from which one could be derived.
 * <p>
 * This is a wiring defect: register a schema for {@link #type()}
 * or describe it structurally.
 */
public final class DerivationUnavailableException extends SchemaException {
	private final SName type;
	private final List<SName> derivationChain;

	public DerivationUnavailableException(SName type, List<SName> derivationChain) {
		super(fullMessage(type, derivationChain));
		this.type = type;
		this.derivationChain = List.copyOf(derivationChain);
	}

	public SName type() {
		return type;
	}

	/**
	 * @return the types whose derivation was in progress, outermost first
	 */
	public List<SName> derivationChain() {
		return derivationChain;
	}

	private static String fullMessage(SName type, List<SName> chain) {
		String message = "No schema available for " + type.show();
		if (chain.isEmpty()) {
			return message;
		}
		return message + " (required by " + chain.stream().map(SName::show).collect(joining(" -> ")) + ")";
	}
}
