/** Header keyword reads and writes on the current HDU. */
package ca.gc.cra.fitsio.application.header;
