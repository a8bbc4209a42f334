package works.spoke.schema.derivation;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;
import org.jetbrains.annotations.Nullable;
import works.spoke.schema.PrimitiveKind;
import works.spoke.schema.SName;

/**
 * Descriptors for common types, and factories for building others by hand.
 */
public final class TypeDescriptors {
	private TypeDescriptors() { }

	public static final PrimitiveDescriptor STRING  = primitive(String.class, PrimitiveKind.STRING, null);
	public static final PrimitiveDescriptor INT     = primitive(Integer.class, PrimitiveKind.INTEGER, "int32");
	public static final PrimitiveDescriptor LONG    = primitive(Long.class, PrimitiveKind.INTEGER, "int64");
	public static final PrimitiveDescriptor FLOAT   = primitive(Float.class, PrimitiveKind.NUMBER, "float");
	public static final PrimitiveDescriptor DOUBLE  = primitive(Double.class, PrimitiveKind.NUMBER, "double");
	public static final PrimitiveDescriptor BOOLEAN = primitive(Boolean.class, PrimitiveKind.BOOLEAN, null);
	public static final PrimitiveDescriptor BIG_DECIMAL = primitive(BigDecimal.class, PrimitiveKind.NUMBER, null);
	public static final PrimitiveDescriptor BIG_INTEGER = primitive(BigInteger.class, PrimitiveKind.INTEGER, null);
	public static final PrimitiveDescriptor UUID_STRING = primitive(UUID.class, PrimitiveKind.STRING, "uuid");
	public static final PrimitiveDescriptor BYTES = primitive(byte[].class, PrimitiveKind.BINARY, "binary");
	public static final PrimitiveDescriptor LOCAL_DATE = primitive(LocalDate.class, PrimitiveKind.DATE, "date");
	public static final PrimitiveDescriptor INSTANT = primitive(Instant.class, PrimitiveKind.DATE_TIME, "date-time");

	public static PrimitiveDescriptor primitive(Class<?> type, PrimitiveKind kind, @Nullable String format) {
		return new PrimitiveDescriptor(SName.of(type), kind, format);
	}

	public static CollectionDescriptor listOf(TypeDescriptor element) {
		return new CollectionDescriptor(new SName(List.class.getName(), List.of(element.name().show())), element);
	}

	public static OptionDescriptor optionOf(TypeDescriptor element) {
		return new OptionDescriptor(element);
	}

	public static MapDescriptor mapOf(TypeDescriptor value) {
		return new MapDescriptor(new SName(Map.class.getName(), List.of("String", value.name().show())), value);
	}

	public static EnumerationDescriptor enumeration(SName name, String... values) {
		return new EnumerationDescriptor(name, List.of(values));
	}

	public static ProductDescriptor.ProductDescriptorBuilder product(SName name) {
		return ProductDescriptor.named(name);
	}

	public static CoproductDescriptor.CoproductDescriptorBuilder coproduct(SName name) {
		return CoproductDescriptor.named(name);
	}

	public static DeferredDescriptor deferred(SName name, Supplier<? extends TypeDescriptor> target) {
		return new DeferredDescriptor(name, target);
	}

	public static OpaqueDescriptor opaque(SName name) {
		return new OpaqueDescriptor(name);
	}
}
