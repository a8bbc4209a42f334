/**
 * Targeted changes deep inside an existing schema.
 * <p>
 * A {@link works.spoke.schema.modify.FieldPath} names a location;
 * {@link works.spoke.schema.modify.SchemaModifier#modify} resolves it against a schema,
 * and the resulting {@link works.spoke.schema.modify.Modification} replaces what it finds there,
 * leaving everything else as it was.
 */
package works.spoke.schema.modify;
