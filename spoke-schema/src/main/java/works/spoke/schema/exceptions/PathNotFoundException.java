package works.spoke.schema.exceptions;

import works.spoke.schema.modify.FieldPath;

/**
 * A {@link FieldPath} segment does not match the shape of the schema
 * (or type description) at that point.
 * No modification is ever partially applied when this is thrown.
 */
public final class PathNotFoundException extends SchemaException {
	private final FieldPath path;
	private final int segmentIndex;

	public PathNotFoundException(FieldPath path, int segmentIndex, String found) {
		super("Path " + path + " does not match at segment " + segmentIndex
			+ " (" + path.segments().get(segmentIndex) + "): found " + found);
		this.path = path;
		this.segmentIndex = segmentIndex;
	}

	public FieldPath path() {
		return path;
	}

	public int segmentIndex() {
		return segmentIndex;
	}
}
