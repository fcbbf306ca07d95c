package ca.gc.cra.fitsio.error;

import java.util.List;

/**
 * Raised when a FITS file cannot be opened (missing path, unreadable file, not a FITS file).
 *
 * @since 0.1.0
 */
public final class FitsOpenException extends FitsException {
  private static final long serialVersionUID = 1L;

  public FitsOpenException(String message) {
    this(message, 0, List.of());
  }

  public FitsOpenException(String message, int status, List<String> libraryMessages) {
    super(FitsErrorKind.OPEN, message, status, libraryMessages, null);
  }
}
