package ca.gc.cra.fitsio.application.image;

import ca.gc.cra.fitsio.domain.image.AxisRange;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Axis-order translation between row-major Java shapes and cfitsio's column-major {@code NAXISn}
 * order.
 *
 * <p>cfitsio lists the fastest-varying axis first ({@code NAXIS1}); Java callers see it last. Reversal
 * and the one-based corner conversion are kept as separate steps.</p>
 *
 * @since 0.1.0
 */
public final class AxisOrder {
  private AxisOrder() {
    // Utility
  }

  /**
   * Reverses library axis lengths into row-major order.
   *
   * @param libraryAxes {@code NAXIS1..NAXISn}
   * @return row-major shape
   */
  public static List<Long> toRowMajor(long[] libraryAxes) {
    List<Long> shape = new ArrayList<>(libraryAxes.length);
    for (int i = libraryAxes.length - 1; i >= 0; i--) {
      shape.add(libraryAxes[i]);
    }
    return List.copyOf(shape);
  }

  /**
   * Reverses row-major axis lengths into {@code NAXIS1..NAXISn} order.
   *
   * @param rowMajor row-major shape
   * @return library axis lengths
   */
  public static long[] toLibraryOrder(List<Long> rowMajor) {
    long[] axes = new long[rowMajor.size()];
    for (int i = 0; i < axes.length; i++) {
      axes[i] = rowMajor.get(rowMajor.size() - 1 - i);
    }
    return axes;
  }

  public static <T> List<T> reverse(List<T> values) {
    List<T> reversed = new ArrayList<>(values);
    Collections.reverse(reversed);
    return reversed;
  }

  /**
   * Converts one half-open zero-based range to cfitsio's closed one-based pair.
   *
   * @param range zero-based range
   * @return {@code {start + 1, end}}
   */
  public static long[] toClosedOneBased(AxisRange range) {
    return new long[] {range.start() + 1, range.end()};
  }

  /**
   * Converts row-major ranges into a library pixel box: the axis order is reversed first, then each
   * range is converted to one-based inclusive corners.
   *
   * @param rowMajorRanges one non-empty range per axis, row-major
   * @return pixel box in library order
   */
  public static LibraryRegion toLibrary(List<AxisRange> rowMajorRanges) {
    List<AxisRange> libraryOrder = reverse(rowMajorRanges);
    long[] first = new long[libraryOrder.size()];
    long[] last = new long[libraryOrder.size()];
    for (int i = 0; i < first.length; i++) {
      long[] corners = toClosedOneBased(libraryOrder.get(i));
      first[i] = corners[0];
      last[i] = corners[1];
    }
    return new LibraryRegion(first, last);
  }
}
