/**
 * Composable constraints on decoded values.
 * <p>
 * This package only describes and evaluates constraints.
 * Deciding when to evaluate them, and what to do about failures,
 * is up to the codec or server that consumes the schema.
 */
package works.spoke.schema.validation;
