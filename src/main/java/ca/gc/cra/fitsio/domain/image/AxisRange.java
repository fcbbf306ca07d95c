package ca.gc.cra.fitsio.domain.image;

/**
 * Half-open, zero-based range {@code [start, end)} along one row-major image axis.
 *
 * @param start first index, inclusive
 * @param end index after the last one
 */
public record AxisRange(long start, long end) {

  public AxisRange {
    if (start < 0) {
      throw new IllegalArgumentException("start must be >= 0");
    }
    if (end < start) {
      throw new IllegalArgumentException("end must be >= start");
    }
  }

  public static AxisRange of(long start, long end) {
    return new AxisRange(start, end);
  }

  public long length() {
    return end - start;
  }

  public boolean isEmpty() {
    return end == start;
  }
}
