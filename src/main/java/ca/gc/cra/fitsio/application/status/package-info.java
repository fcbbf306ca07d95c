/**
 * Status translation: the single seam between cfitsio status codes and the checked exception
 * hierarchy in {@code ca.gc.cra.fitsio.error}.
 */
package ca.gc.cra.fitsio.application.status;
