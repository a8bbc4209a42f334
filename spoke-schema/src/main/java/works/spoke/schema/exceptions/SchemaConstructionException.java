package works.spoke.schema.exceptions;

/**
 * A schema was assembled from malformed parts,
 * such as a product with two fields of the same name.
 */
public final class SchemaConstructionException extends SchemaException {
	public SchemaConstructionException(String message) {
		super(message);
	}

	public SchemaConstructionException(String message, Throwable cause) {
		super(message, cause);
	}
}
