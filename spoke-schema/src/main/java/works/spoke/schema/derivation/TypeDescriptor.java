package works.spoke.schema.derivation;

import works.spoke.schema.SName;

/**
 * A structural description of a type, from which a {@link SchemaDeriver} builds a schema.
 * <p>
 * Descriptors are supplied by the caller, either built by hand
 * using {@link TypeDescriptors} or produced by some
 * description mechanism such as {@link works.spoke.schema.reflect.ReflectiveTypeDescriber}.
 * The engine never inspects types itself.
 * <p>
 * Descriptors are compared by structure, except that a {@link DeferredDescriptor}
 * is identified only by its {@link #name()}, which is what lets descriptor graphs be cyclic.
 */
public sealed interface TypeDescriptor permits
	PrimitiveDescriptor,
	CollectionDescriptor,
	OptionDescriptor,
	MapDescriptor,
	EnumerationDescriptor,
	ProductDescriptor,
	CoproductDescriptor,
	DeferredDescriptor,
	OpaqueDescriptor
{
	/**
	 * @return identifies the described type
	 */
	SName name();
}
