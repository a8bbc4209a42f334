/**
 * Derivation of {@link works.spoke.schema.Schema}s from structural type descriptions.
 * <p>
 * The {@link works.spoke.schema.derivation.SchemaDeriver} consumes
 * {@link works.spoke.schema.derivation.TypeDescriptor}s, which the caller supplies;
 * it does no reflection of its own.
 * Hand-written schemas can be supplied through a {@link works.spoke.schema.derivation.SchemaRegistry},
 * naming policy through a {@link works.spoke.schema.derivation.Configuration},
 * and per-field overrides through {@link works.spoke.schema.derivation.FieldMetadata}.
 */
package works.spoke.schema.derivation;
