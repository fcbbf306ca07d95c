/**
 * Ports of the application layer.
 *
 * <p><strong>Purpose:</strong> {@link ca.gc.cra.fitsio.application.port.FitsioNative} mirrors the consumed
 * cfitsio functions and {@link ca.gc.cra.fitsio.application.port.MetricsPort} abstracts metrics; adapters
 * live under {@code ca.gc.cra.fitsio.infrastructure}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.fitsio.application.port;
