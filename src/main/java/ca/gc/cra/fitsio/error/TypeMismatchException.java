package ca.gc.cra.fitsio.error;

import java.util.List;

/**
 * Raised when a Java value type cannot be exchanged with the declared type of a column, an image or
 * a header keyword, or when cfitsio reports a data conversion failure.
 *
 * <p>Exceptions created by the type checks carry status {@code 0}: the request never reached the
 * library.</p>
 *
 * @since 0.1.0
 */
public final class TypeMismatchException extends FitsException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception for a request rejected before any native call.
   *
   * @param target column name or HDU description
   * @param declared declared type of the target
   * @param requested requested Java value type
   */
  public TypeMismatchException(String target, String declared, String requested) {
    super(
        FitsErrorKind.TYPE_MISMATCH,
        "cannot exchange " + requested + " values with " + target + " of type " + declared,
        0,
        List.of(),
        null);
  }

  public TypeMismatchException(String message, int status, List<String> libraryMessages) {
    super(FitsErrorKind.TYPE_MISMATCH, message, status, libraryMessages, null);
  }
}
