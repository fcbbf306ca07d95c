/**
 * Argument validation helpers shared by the engines and the configuration layer; violations raise
 * {@link java.lang.IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.fitsio.validation;
