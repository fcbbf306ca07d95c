/**
 * HDU cursor: navigation, metadata and structural changes of the current header-data unit.
 */
package ca.gc.cra.fitsio.application.hdu;
