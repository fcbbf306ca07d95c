package ca.gc.cra.fitsio.domain.table;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.fitsio.domain.ValueType;
import java.util.BitSet;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ColumnDataTest {

  @Test
  void vectorColumnAddressesElementsRowMajor() {
    ColumnData<int[]> data = ColumnData.of(ValueType.INT, new int[] {0, 1, 2, 10, 11, 12}, 3);

    assertEquals(2, data.rowCount());
    assertEquals(3, data.elementsPerRow());
    assertEquals(4, data.elementIndex(1, 1));
    assertEquals(11, data.values()[data.elementIndex(1, 1)]);
  }

  @Test
  void valuesAreSharedWhileMaskIsCopied() {
    int[] values = {1, 2, 3};
    ColumnData<int[]> data = ColumnData.of(ValueType.INT, values);
    ColumnData<int[]> masked = data.withNulls(0);

    assertSame(values, data.values());
    assertSame(values, masked.values());
    values[2] = 30;
    assertEquals(Optional.of(30), masked.valueAt(2));

    BitSet mask = masked.nullMask();
    mask.set(1);
    assertFalse(masked.isNull(1));
  }

  @Test
  void nullMaskIsSeparateFromValues() {
    ColumnData<double[]> data = ColumnData.of(ValueType.DOUBLE, new double[] {1.0, 2.0, 3.0})
        .withNulls(1);

    assertTrue(data.hasNulls());
    assertEquals(1, data.nullCount());
    assertTrue(data.isNull(1));
    assertFalse(data.isNull(0));
    assertEquals(Optional.empty(), data.valueAt(1));
    assertEquals(Optional.of(3.0), data.valueAt(2));
    assertEquals(2.0, data.values()[1]);
  }

  @Test
  void nullMaskIsCopiedInAndOut() {
    BitSet mask = new BitSet();
    mask.set(0);
    ColumnData<long[]> data = new ColumnData<>(ValueType.LONG, new long[] {5, 6}, mask, 1);
    mask.set(1);
    data.nullMask().set(1);

    assertTrue(data.isNull(0));
    assertFalse(data.isNull(1));
  }

  @Test
  void rejectsPartialRows() {
    assertThrows(IllegalArgumentException.class,
        () -> ColumnData.of(ValueType.SHORT, new short[5], 2));
    assertThrows(IllegalArgumentException.class,
        () -> ColumnData.of(ValueType.SHORT, new short[4], 0));
  }

  @Test
  void rejectsMaskPastValues() {
    BitSet mask = new BitSet();
    mask.set(3);

    assertThrows(IllegalArgumentException.class,
        () -> new ColumnData<>(ValueType.INT, new int[2], mask, 1));
    assertThrows(IndexOutOfBoundsException.class,
        () -> ColumnData.of(ValueType.INT, new int[2]).withNulls(2));
  }

  @Test
  void emptyColumnKeepsRowWidth() {
    ColumnData<String[]> empty = ColumnData.empty(ValueType.STRING, 4);

    assertEquals(0, empty.length());
    assertEquals(0, empty.rowCount());
    assertEquals(4, empty.elementsPerRow());
    assertArrayEquals(new String[0], empty.values());
  }

  @Test
  void rowAndElementAreBoundsChecked() {
    ColumnData<int[]> data = ColumnData.of(ValueType.INT, new int[6], 3);

    assertThrows(IndexOutOfBoundsException.class, () -> data.elementIndex(2, 0));
    assertThrows(IndexOutOfBoundsException.class, () -> data.elementIndex(0, 3));
  }
}
