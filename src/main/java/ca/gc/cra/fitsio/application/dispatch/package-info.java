/** Type dispatch between Java enums and cfitsio integer codes. */
package ca.gc.cra.fitsio.application.dispatch;
