/**
 * Ownership of the native file pointer.
 *
 * <p><strong>Purpose:</strong> {@link ca.gc.cra.fitsio.application.file.NativeHandle} is the only holder
 * of a {@code fitsfile*}; engines borrow the pointer per call.</p>
 */
package ca.gc.cra.fitsio.application.file;
