package ca.gc.cra.fitsio.error;

import java.util.List;

/**
 * Raised when cfitsio reports a failure while closing a file. The handle is released regardless.
 *
 * @since 0.1.0
 */
public final class FitsCloseException extends FitsException {
  private static final long serialVersionUID = 1L;

  public FitsCloseException(String message, int status, List<String> libraryMessages) {
    super(FitsErrorKind.CLOSE, message, status, libraryMessages, null);
  }
}
