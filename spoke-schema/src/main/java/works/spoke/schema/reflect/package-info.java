/**
 * Describes Java records, sealed interfaces, and enums for the
 * {@link works.spoke.schema.derivation.SchemaDeriver SchemaDeriver} by reflection,
 * taking field metadata from annotations.
 */
package works.spoke.schema.reflect;
