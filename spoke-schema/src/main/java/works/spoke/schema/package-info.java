/**
 * The schema model: immutable descriptions of the wire shape of types.
 * <p>
 * A {@link works.spoke.schema.Schema} pairs a structural {@link works.spoke.schema.SchemaType}
 * with documentation and validation metadata.
 * Schemas are usually produced by the {@link works.spoke.schema.derivation derivation engine},
 * refined using the {@link works.spoke.schema.modify modification engine},
 * and then consumed by codecs and documentation renderers, which live elsewhere.
 */
package works.spoke.schema;
