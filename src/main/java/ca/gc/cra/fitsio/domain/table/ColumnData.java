package ca.gc.cra.fitsio.domain.table;

import ca.gc.cra.fitsio.domain.ValueType;
import java.lang.reflect.Array;
import java.util.BitSet;
import java.util.Objects;
import java.util.Optional;

/**
 * Column values plus a parallel validity mask.
 *
 * <p><strong>What:</strong> {@link #values()} holds {@code rowCount() * elementsPerRow()} elements in
 * row order; element {@code j} of row {@code i} sits at {@code i * elementsPerRow() + j}. A set bit in
 * the null mask marks an element cfitsio reported as undefined (NaN in floating-point columns, the
 * {@code TNULLn} value in integer columns); the array slot then holds zero or NaN.</p>
 * <p><strong>Thread-safety:</strong> The mask is copied in and out; the value array is shared with the
 * caller and must not be mutated concurrently.</p>
 *
 * @param <A> Java array type
 * @since 0.1.0
 */
public final class ColumnData<A> {
  private final ValueType<A> type;
  private final A values;
  private final BitSet nulls;
  private final int elementsPerRow;
  private final int length;

  /**
   * Creates column data.
   *
   * @param type value type of {@code values}
   * @param values element array, kept without copying; length must be a multiple of
   *     {@code elementsPerRow}
   * @param nulls indices of null elements; copied
   * @param elementsPerRow repeat count, at least one
   */
  public ColumnData(ValueType<A> type, A values, BitSet nulls, int elementsPerRow) {
    this.type = Objects.requireNonNull(type, "type");
    this.values = Objects.requireNonNull(values, "values");
    if (elementsPerRow < 1) {
      throw new IllegalArgumentException("elementsPerRow must be >= 1");
    }
    this.length = type.length(values);
    if (length % elementsPerRow != 0) {
      throw new IllegalArgumentException(
          "value count " + length + " is not a multiple of " + elementsPerRow);
    }
    BitSet mask = nulls == null ? new BitSet() : (BitSet) nulls.clone();
    if (mask.length() > length) {
      throw new IllegalArgumentException("null mask extends past the values");
    }
    this.nulls = mask;
    this.elementsPerRow = elementsPerRow;
  }

  public static <A> ColumnData<A> of(ValueType<A> type, A values) {
    return new ColumnData<>(type, values, null, 1);
  }

  public static <A> ColumnData<A> of(ValueType<A> type, A values, int elementsPerRow) {
    return new ColumnData<>(type, values, null, elementsPerRow);
  }

  public static <A> ColumnData<A> empty(ValueType<A> type, int elementsPerRow) {
    return new ColumnData<>(type, type.newArray(0), null, elementsPerRow);
  }

  /**
   * Returns a copy with additional elements marked null.
   *
   * @param indices flat element indices
   * @return new column data sharing the value array
   */
  public ColumnData<A> withNulls(int... indices) {
    BitSet mask = (BitSet) nulls.clone();
    for (int index : indices) {
      Objects.checkIndex(index, length);
      mask.set(index);
    }
    return new ColumnData<>(type, values, mask, elementsPerRow);
  }

  public ValueType<A> type() {
    return type;
  }

  /**
   * Returns the backing value array without copying, unlike {@link #nullMask()}. Writes to the
   * returned array show through {@link #valueAt(int)} and every copy made by
   * {@link #withNulls(int...)}.
   *
   * @return values in row order, shared with this instance
   */
  public A values() {
    return values;
  }

  public int length() {
    return length;
  }

  public int elementsPerRow() {
    return elementsPerRow;
  }

  public int rowCount() {
    return length / elementsPerRow;
  }

  /**
   * Flat index of element {@code element} in row {@code row}.
   *
   * @param row zero-based row within this data
   * @param element zero-based element within the row
   * @return {@code row * elementsPerRow() + element}
   */
  public int elementIndex(int row, int element) {
    Objects.checkIndex(row, rowCount());
    Objects.checkIndex(element, elementsPerRow);
    return row * elementsPerRow + element;
  }

  public boolean isNull(int index) {
    Objects.checkIndex(index, length);
    return nulls.get(index);
  }

  public boolean isNull(int row, int element) {
    return nulls.get(elementIndex(row, element));
  }

  public boolean hasNulls() {
    return !nulls.isEmpty();
  }

  public int nullCount() {
    return nulls.cardinality();
  }

  public BitSet nullMask() {
    return (BitSet) nulls.clone();
  }

  /**
   * Boxed element, absent when the element is null.
   *
   * @param index flat element index
   * @return element value
   */
  public Optional<Object> valueAt(int index) {
    if (isNull(index)) {
      return Optional.empty();
    }
    return Optional.ofNullable(Array.get(values, index));
  }

  @Override
  public String toString() {
    return "ColumnData[" + type + " x " + length + ", rows=" + rowCount() + ", nulls=" + nullCount()
        + "]";
  }
}
