package ca.gc.cra.fitsio.application.image;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.fitsio.domain.image.AxisRange;
import java.util.List;
import org.junit.jupiter.api.Test;

class AxisOrderTest {

  @Test
  void libraryAxesAreReversedIntoRowMajorShape() {
    assertEquals(List.of(20L, 100L), AxisOrder.toRowMajor(new long[] {100, 20}));
    assertEquals(List.of(4L, 3L, 2L), AxisOrder.toRowMajor(new long[] {2, 3, 4}));
    assertEquals(List.of(), AxisOrder.toRowMajor(new long[0]));
  }

  @Test
  void rowMajorShapeIsReversedIntoLibraryOrder() {
    assertArrayEquals(new long[] {100, 20}, AxisOrder.toLibraryOrder(List.of(20L, 100L)));
  }

  @Test
  void axisRangeBecomesClosedOneBasedCorners() {
    assertArrayEquals(new long[] {3, 5}, AxisOrder.toClosedOneBased(AxisRange.of(2, 5)));
  }

  @Test
  void regionCornersAreInLibraryAxisOrder() {
    LibraryRegion region = AxisOrder.toLibrary(List.of(AxisRange.of(1, 3), AxisRange.of(10, 14)));

    assertArrayEquals(new long[] {11, 2}, region.firstPixel());
    assertArrayEquals(new long[] {14, 3}, region.lastPixel());
    assertArrayEquals(new long[] {1, 1}, region.unitIncrement());
    assertEquals(2, region.rank());
    assertEquals(8, region.pixelCount());
  }

  @Test
  void regionCornersAreCopied() {
    long[] first = {1, 1};
    LibraryRegion region = new LibraryRegion(first, new long[] {2, 2});
    first[0] = 9;
    region.firstPixel()[1] = 9;

    assertArrayEquals(new long[] {1, 1}, region.firstPixel());
  }

  @Test
  void regionRejectsMismatchedCorners() {
    assertThrows(IllegalArgumentException.class,
        () -> new LibraryRegion(new long[] {1}, new long[] {1, 1}));
  }
}
