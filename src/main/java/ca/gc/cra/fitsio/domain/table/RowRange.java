package ca.gc.cra.fitsio.domain.table;

/**
 * Half-open, zero-based row range {@code [start, end)}.
 *
 * @param start first row, inclusive
 * @param end row after the last one
 */
public record RowRange(long start, long end) {

  public RowRange {
    if (start < 0) {
      throw new IllegalArgumentException("start must be >= 0");
    }
    if (end < start) {
      throw new IllegalArgumentException("end must be >= start");
    }
  }

  public static RowRange of(long start, long end) {
    return new RowRange(start, end);
  }

  /**
   * Range covering every row of a table.
   *
   * @param rows row count
   * @return {@code [0, rows)}
   */
  public static RowRange all(long rows) {
    return new RowRange(0, rows);
  }

  public static RowRange single(long row) {
    return new RowRange(row, row + 1);
  }

  public long count() {
    return end - start;
  }

  public boolean isEmpty() {
    return end == start;
  }
}
