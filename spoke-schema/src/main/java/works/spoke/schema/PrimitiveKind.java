package works.spoke.schema;

import java.util.Locale;

/**
 * The scalar shapes a value can take on the wire.
 * Finer distinctions, such as integer width, are carried by {@link Schema#format()}.
 */
public enum PrimitiveKind {
	STRING,
	INTEGER,
	NUMBER,
	BOOLEAN,
	BINARY,
	DATE,
	DATE_TIME;

	public String show() {
		return name().toLowerCase(Locale.ROOT).replace('_', '-');
	}
}
