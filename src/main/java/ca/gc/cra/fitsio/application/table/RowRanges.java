package ca.gc.cra.fitsio.application.table;

import ca.gc.cra.fitsio.domain.table.LibraryRowSpan;
import ca.gc.cra.fitsio.domain.table.RowRange;
import ca.gc.cra.fitsio.error.BoundsException;

/**
 * Conversion between the Java row convention (zero-based, half-open) and cfitsio's (one-based,
 * closed).
 *
 * <p>{@code [start, end)} maps to {@code start + 1 .. end}; the element count is {@code end - start}
 * in both conventions.</p>
 *
 * @since 0.1.0
 */
public final class RowRanges {
  private RowRanges() {
    // Utility
  }

  /**
   * Converts without checking the table size.
   *
   * @param range zero-based half-open range
   * @return one-based closed span
   */
  public static LibraryRowSpan toLibrary(RowRange range) {
    return new LibraryRowSpan(range.start() + 1, range.end());
  }

  /**
   * Converts after checking the range against the table's row count.
   *
   * @param range zero-based half-open range
   * @param rowCount rows in the table
   * @return one-based closed span
   * @throws BoundsException when the range ends past the last row
   */
  public static LibraryRowSpan toLibrary(RowRange range, long rowCount) throws BoundsException {
    if (range.end() > rowCount) {
      throw new BoundsException(
          "row range", BoundsException.NO_AXIS, BoundsException.Bound.END, range.end(), rowCount);
    }
    return toLibrary(range);
  }

  public static RowRange fromLibrary(LibraryRowSpan span) {
    return new RowRange(span.firstRow() - 1, span.lastRow());
  }
}
