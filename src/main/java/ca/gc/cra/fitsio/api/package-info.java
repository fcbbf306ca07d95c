/**
 * Public entry points of the FITS access layer.
 *
 * <p><strong>Purpose:</strong> {@link ca.gc.cra.fitsio.api.Fitsio} binds configuration and the native
 * library; {@link ca.gc.cra.fitsio.api.FitsFile} owns an open file; {@link ca.gc.cra.fitsio.api.FitsHdu}
 * reads and writes one HDU; {@link ca.gc.cra.fitsio.api.ThreadsafeFitsFile} serializes access from
 * several threads.</p>
 * <p><strong>Indexing:</strong> HDU, column, row and pixel positions are zero-based; ranges are
 * half-open; image axes are row-major.</p>
 * <p><strong>Errors:</strong> Every failure is a checked
 * {@link ca.gc.cra.fitsio.error.FitsException}; iterators wrap it in
 * {@link ca.gc.cra.fitsio.error.UncheckedFitsException}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.fitsio.api;
