package ca.gc.cra.fitsio.error;

import java.util.Objects;

/**
 * Unchecked carrier for a {@link FitsException} raised where a checked exception cannot be thrown,
 * such as inside {@link java.util.Iterator#next()}.
 *
 * @since 0.1.0
 */
public final class UncheckedFitsException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public UncheckedFitsException(FitsException cause) {
    super(Objects.requireNonNull(cause, "cause").getMessage(), cause);
  }

  @Override
  public synchronized FitsException getCause() {
    return (FitsException) super.getCause();
  }
}
