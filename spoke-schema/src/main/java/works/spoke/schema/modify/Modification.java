package works.spoke.schema.modify;

import java.util.function.UnaryOperator;
import works.spoke.schema.Schema;

/**
 * A resolved location within a root schema, through which the sub-schema there
 * can be read or replaced.
 * <p>
 * Obtain one from {@link SchemaModifier#modify}. The path has already been verified
 * by then, so {@link #apply} can't fail on account of it.
 */
public interface Modification {
	FieldPath path();

	/**
	 * @return the sub-schema at {@link #path()}
	 */
	Schema get();

	/**
	 * @return a new root schema in which the sub-schema at {@link #path()}
	 * has been replaced by {@code transformation} of it, and nothing else has changed
	 */
	Schema apply(UnaryOperator<Schema> transformation);

	default Schema set(Schema replacement) {
		return apply(s -> replacement);
	}
}
