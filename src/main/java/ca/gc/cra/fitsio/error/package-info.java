/**
 * Checked exception hierarchy of the FITS access layer.
 *
 * <p><strong>Purpose:</strong> Every cfitsio status code that reaches Java is translated into one of
 * these types by {@code StatusTranslator}; checks that run before a native call raise the same types
 * with status {@code 0}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.fitsio.error;
