package ca.gc.cra.fitsio.error;

import java.util.List;
import java.util.Locale;

/**
 * Raised when a row, pixel or axis range falls outside the current HDU.
 *
 * <p>Ranges checked on the Java side carry the row-major {@link #axis()} (or {@link #NO_AXIS} for row
 * and flat pixel ranges), the violated {@link Bound}, the offending value and the limit it exceeded.
 * Bounds failures reported by the library itself carry the status and {@link #NO_AXIS}.</p>
 *
 * @since 0.1.0
 */
public final class BoundsException extends FitsException {
  private static final long serialVersionUID = 1L;

  /** Axis value used when the range is not tied to an image axis. */
  public static final int NO_AXIS = -1;

  /** Which end of a range was violated. */
  public enum Bound {
    START,
    END
  }

  private final int axis;
  private final Bound bound;
  private final long value;
  private final long limit;

  /**
   * Creates an exception for a range rejected before any native call.
   *
   * @param what short description of the range, e.g. {@code "row range"} or {@code "axis 1"}
   * @param axis row-major axis, or {@link #NO_AXIS}
   * @param bound violated end of the range
   * @param value offending value
   * @param limit limit that was exceeded
   */
  public BoundsException(String what, int axis, Bound bound, long value, long limit) {
    super(
        FitsErrorKind.BOUNDS,
        what + " " + bound.name().toLowerCase(Locale.ROOT) + " " + value + " out of bounds (limit " + limit + ")",
        0,
        List.of(),
        null);
    this.axis = axis;
    this.bound = bound;
    this.value = value;
    this.limit = limit;
  }

  public BoundsException(String message, int status, List<String> libraryMessages) {
    super(FitsErrorKind.BOUNDS, message, status, libraryMessages, null);
    this.axis = NO_AXIS;
    this.bound = null;
    this.value = -1;
    this.limit = -1;
  }

  public int axis() {
    return axis;
  }

  /**
   * Returns the violated bound.
   *
   * @return bound, or {@code null} when the library detected the violation
   */
  public Bound bound() {
    return bound;
  }

  public long value() {
    return value;
  }

  public long limit() {
    return limit;
  }
}
