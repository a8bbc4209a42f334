package works.spoke.schema.exceptions;

/**
 * Root of the errors raised while building, deriving, or navigating schemas.
 * <p>
 * These all indicate programmer or configuration errors, not transient faults.
 * They are expected to surface once, at startup, and never be retried.
 */
public sealed abstract class SchemaException extends RuntimeException permits
	SchemaConstructionException,
	DerivationUnavailableException,
	PathNotFoundException
{
	protected SchemaException(String message) {
		super(message);
	}

	protected SchemaException(String message, Throwable cause) {
		super(message, cause);
	}
}
