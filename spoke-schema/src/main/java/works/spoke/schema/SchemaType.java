package works.spoke.schema;

import java.util.List;

/**
 * The structural part of a {@link Schema}: what kind of JSON-ish value it describes,
 * and the schemas of any nested values.
 * <p>
 * Each variant's {@link Object#toString() toString} gives a compact
 * rendering suitable for log messages.
 */
public sealed interface SchemaType permits
	SPrimitive,
	SArray,
	SOption,
	SProduct,
	SOpenProduct,
	SCoproduct,
	SRef
{
	/**
	 * @return the schemas nested directly within this one, in declaration order
	 */
	List<Schema> children();
}
