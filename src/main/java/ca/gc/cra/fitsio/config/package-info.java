/**
 * Configuration of the FITS access layer.
 *
 * <p><strong>Purpose:</strong> {@link ca.gc.cra.fitsio.config.FitsioConfig} holds the settings and
 * {@link ca.gc.cra.fitsio.config.FitsioPropertiesLoader} reads them from {@code fitsio.properties} and
 * system properties.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.fitsio.config;
