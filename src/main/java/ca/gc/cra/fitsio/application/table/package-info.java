/**
 * Column engine: type dispatch, row-range translation, vector and logical columns and null tracking
 * for table HDUs.
 *
 * @since 0.1.0
 */
package ca.gc.cra.fitsio.application.table;
