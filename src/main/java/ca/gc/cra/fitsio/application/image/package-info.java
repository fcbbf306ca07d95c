/**
 * Image engine and the axis-order translation between row-major Java shapes and cfitsio's
 * {@code NAXISn} order.
 *
 * @since 0.1.0
 */
package ca.gc.cra.fitsio.application.image;
