/** Header keyword value types. */
package ca.gc.cra.fitsio.domain.header;
