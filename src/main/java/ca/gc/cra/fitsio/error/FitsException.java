package ca.gc.cra.fitsio.error;

import java.util.List;
import java.util.Objects;

/**
 * Base checked exception for every failure reported by the FITS access layer.
 *
 * <p><strong>What:</strong> Carries the {@link FitsErrorKind}, the cfitsio status code that caused the
 * failure (zero when the layer rejected the call itself) and the messages drained from the cfitsio
 * error stack at the time of failure.</p>
 * <p><strong>Why:</strong> Native status codes never escape as raw integers; callers branch on the
 * exception type or {@link #kind()}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public abstract class FitsException extends Exception {
  private static final long serialVersionUID = 1L;

  private final FitsErrorKind kind;
  private final int status;
  private final List<String> libraryMessages;

  /**
   * Creates an exception.
   *
   * @param kind error category
   * @param message human-readable description including the failing operation
   * @param status cfitsio status code, or {@code 0} when raised before any native call
   * @param libraryMessages messages drained from the cfitsio error stack; may be empty
   * @param cause optional cause
   */
  protected FitsException(
      FitsErrorKind kind, String message, int status, List<String> libraryMessages, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
    this.status = status;
    this.libraryMessages = List.copyOf(libraryMessages == null ? List.of() : libraryMessages);
  }

  public FitsErrorKind kind() {
    return kind;
  }

  /**
   * Returns the cfitsio status code.
   *
   * @return status code, {@code 0} when the failure was detected before calling cfitsio
   */
  public int status() {
    return status;
  }

  public boolean hasStatus() {
    return status != 0;
  }

  /**
   * Returns the library's own messages, oldest first.
   *
   * @return immutable list of messages
   */
  public List<String> libraryMessages() {
    return libraryMessages;
  }
}
