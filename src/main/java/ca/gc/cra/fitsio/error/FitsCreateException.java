package ca.gc.cra.fitsio.error;

import java.util.List;

/**
 * Raised when a FITS file cannot be created, including when the path exists and overwrite was not
 * requested.
 *
 * @since 0.1.0
 */
public final class FitsCreateException extends FitsException {
  private static final long serialVersionUID = 1L;

  public FitsCreateException(String message, int status, List<String> libraryMessages) {
    super(FitsErrorKind.CREATE, message, status, libraryMessages, null);
  }
}
