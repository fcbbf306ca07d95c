/**
 * JNR-FFI binding of cfitsio.
 *
 * <p><strong>Purpose:</strong> {@link ca.gc.cra.fitsio.infrastructure.cfitsio.LibCfitsio} declares the
 * native symbols and {@link ca.gc.cra.fitsio.infrastructure.cfitsio.JnrFitsioNative} adapts them to the
 * {@link ca.gc.cra.fitsio.application.port.FitsioNative} port.</p>
 * <p><strong>Platform:</strong> Requires a shared cfitsio library on the loader path or in the directory
 * configured by {@code fitsio.library.path}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.fitsio.infrastructure.cfitsio;
