package ca.gc.cra.fitsio.error;

import java.util.List;

/**
 * Generic library failure: any non-zero status without a more specific category.
 *
 * @since 0.1.0
 */
public final class FitsStatusException extends FitsException {
  private static final long serialVersionUID = 1L;

  public FitsStatusException(String message, int status, List<String> libraryMessages) {
    super(FitsErrorKind.STATUS, message, status, libraryMessages, null);
  }
}
