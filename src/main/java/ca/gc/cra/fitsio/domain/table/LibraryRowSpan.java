package ca.gc.cra.fitsio.domain.table;

/**
 * Closed, one-based row span as cfitsio addresses rows: {@code firstRow..lastRow}.
 *
 * <p>An empty span has {@code lastRow == firstRow - 1}.</p>
 *
 * @param firstRow first row, one-based
 * @param lastRow last row, inclusive
 */
public record LibraryRowSpan(long firstRow, long lastRow) {

  public LibraryRowSpan {
    if (firstRow < 1) {
      throw new IllegalArgumentException("firstRow must be >= 1");
    }
    if (lastRow < firstRow - 1) {
      throw new IllegalArgumentException("lastRow must be >= firstRow - 1");
    }
  }

  public long count() {
    return lastRow - firstRow + 1;
  }

  public boolean isEmpty() {
    return count() == 0;
  }
}
