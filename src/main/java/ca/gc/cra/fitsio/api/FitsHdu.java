package ca.gc.cra.fitsio.api;

import ca.gc.cra.fitsio.application.hdu.HduCursor;
import ca.gc.cra.fitsio.domain.CaseSensitivity;
import ca.gc.cra.fitsio.domain.HduInfo;
import ca.gc.cra.fitsio.domain.HduType;
import ca.gc.cra.fitsio.domain.ImageInfo;
import ca.gc.cra.fitsio.domain.TableInfo;
import ca.gc.cra.fitsio.domain.ValueType;
import ca.gc.cra.fitsio.domain.header.HeaderValue;
import ca.gc.cra.fitsio.domain.header.KeyType;
import ca.gc.cra.fitsio.domain.image.AxisRange;
import ca.gc.cra.fitsio.domain.image.ImageData;
import ca.gc.cra.fitsio.domain.image.ImageType;
import ca.gc.cra.fitsio.domain.table.ColumnData;
import ca.gc.cra.fitsio.domain.table.ColumnDescription;
import ca.gc.cra.fitsio.domain.table.RowRange;
import ca.gc.cra.fitsio.error.FitsException;
import ca.gc.cra.fitsio.error.TypeMismatchException;
import ca.gc.cra.fitsio.error.UncheckedFitsException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> One HDU of an open {@link FitsFile}, with the structure it had when located.
 * <p><strong>Why:</strong> cfitsio acts on the file's current HDU. Every operation here first makes this
 * HDU current, so holding several {@code FitsHdu} values of one file is safe as long as they are used
 * from one thread.</p>
 * <p><strong>Staleness:</strong> {@link #info()} is a snapshot. Operations that change the structure
 * (columns, rows, dimensions) return a new {@code FitsHdu} with fresh info; the old value keeps the
 * old snapshot.</p>
 * <p><strong>Kinds:</strong> Table operations on an image HDU, and image operations on a table HDU,
 * fail with {@link TypeMismatchException} before any native call.</p>
 *
 * @since 0.1.0
 */
public final class FitsHdu {
  private final FitsFile file;
  private final int number;
  private final HduInfo info;

  FitsHdu(FitsFile file, int number, HduInfo info) {
    this.file = Objects.requireNonNull(file, "file");
    this.number = number;
    this.info = Objects.requireNonNull(info, "info");
  }

  /** Zero-based index of this HDU in the file. */
  public int index() {
    return number - 1;
  }

  public HduInfo info() {
    return info;
  }

  public HduType type() {
    return info.hduType();
  }

  public FitsFile file() {
    return file;
  }

  /**
   * Extension name.
   *
   * @return {@code EXTNAME}, empty when not set
   * @throws FitsException when the header cannot be read
   */
  public Optional<String> name() throws FitsException {
    return makeCurrent().hduName();
  }

  // Header keywords

  public <T> T readKey(String keyword, KeyType<T> type) throws FitsException {
    makeCurrent();
    return file.headers().read(keyword, type);
  }

  public <T> HeaderValue<T> readKeyWithComment(String keyword, KeyType<T> type)
      throws FitsException {
    makeCurrent();
    return file.headers().readWithComment(keyword, type);
  }

  /** Reads a keyword, empty when the header does not contain it. */
  public <T> Optional<T> readKeyOptional(String keyword, KeyType<T> type) throws FitsException {
    makeCurrent();
    return file.headers().readOptional(keyword, type);
  }

  public <T> void writeKey(String keyword, KeyType<T> type, T value) throws FitsException {
    writeKey(keyword, type, value, null);
  }

  /**
   * Updates a keyword, appending it when the header lacks it.
   *
   * @param keyword keyword name
   * @param type value type
   * @param value new value
   * @param comment new comment, or {@code null} to keep the existing one
   * @param <T> value type
   * @throws FitsException {@code FitsStatusException} (status 112) on a read-only file
   */
  public <T> void writeKey(String keyword, KeyType<T> type, T value, String comment)
      throws FitsException {
    makeCurrent();
    file.headers().write(keyword, type, value, comment);
  }

  // Tables

  public long numRows() throws FitsException {
    requireTable();
    return file.columns().numRows();
  }

  public int numColumns() throws FitsException {
    requireTable();
    return file.columns().numColumns();
  }

  /** Zero-based index of a column, using the configured name matching. */
  public int columnNumber(String name) throws FitsException {
    requireTable();
    return file.columns().columnNumber(name);
  }

  public int columnNumber(String name, CaseSensitivity sensitivity) throws FitsException {
    requireTable();
    return file.columns().columnNumber(name, sensitivity);
  }

  public List<ColumnDescription> columnDescriptions() throws FitsException {
    requireTable();
    return file.columns().describeColumns();
  }

  /**
   * Reads a row range with its null mask.
   *
   * @param name column name
   * @param type requested value type
   * @param rows zero-based half-open range
   * @param <A> array type
   * @return values, {@code rows.count() * elementsPerRow} of them, and their null mask
   * @throws FitsException {@code TypeMismatchException}, {@code BoundsException} or
   *     {@code ColumnNotFoundException} before any read; library failures otherwise
   */
  public <A> ColumnData<A> readColumn(String name, ValueType<A> type, RowRange rows)
      throws FitsException {
    requireTable();
    return file.columns().read(name, type, rows);
  }

  /** Reads a row range without null tracking. */
  public <A> A readColumnValues(String name, ValueType<A> type, RowRange rows)
      throws FitsException {
    requireTable();
    return file.columns().readValues(name, type, rows);
  }

  /**
   * Reads every element of one row.
   *
   * @param name column name
   * @param row zero-based row
   * @param type requested value type
   * @param <A> array type
   * @return the cell; vector columns yield {@code elementsPerRow} values
   * @throws FitsException as {@link #readColumn(String, ValueType, RowRange)}
   */
  public <A> ColumnData<A> readCell(String name, long row, ValueType<A> type)
      throws FitsException {
    return readColumn(name, type, RowRange.single(row));
  }

  public <A> void writeColumn(String name, ValueType<A> type, long firstRow, A values)
      throws FitsException {
    requireTable();
    file.columns().write(name, type, firstRow, values);
  }

  public <A> void writeColumn(String name, ValueType<A> type, RowRange rows, A values)
      throws FitsException {
    requireTable();
    file.columns().write(name, type, rows, values);
  }

  /** Writes from the first row; null elements get the column's null value. */
  public <A> void writeColumn(String name, ColumnData<A> data) throws FitsException {
    writeColumn(name, data, 0);
  }

  public <A> void writeColumn(String name, ColumnData<A> data, long firstRow)
      throws FitsException {
    requireTable();
    file.columns().write(name, data, firstRow);
  }

  /**
   * Reads every column with its natural value type, one column per step. The table is read as it
   * is when each step runs.
   *
   * @return lazy iterable over the columns
   */
  public Iterable<ColumnValues> columns() {
    return () -> new Iterator<>() {
      private int next;

      @Override
      public boolean hasNext() {
        try {
          return next < numColumns();
        } catch (FitsException e) {
          throw new UncheckedFitsException(e);
        }
      }

      @Override
      public ColumnValues next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        try {
          ColumnDescription description = file.columns().describeColumn(next++);
          return new ColumnValues(description, readAll(description, description.type().naturalType()));
        } catch (FitsException e) {
          throw new UncheckedFitsException(e);
        }
      }
    };
  }

  private <A> ColumnData<A> readAll(ColumnDescription description, ValueType<A> type)
      throws FitsException {
    return file.columns().read(description.name(), type, RowRange.all(file.columns().numRows()));
  }

  public FitsHdu insertColumn(int index, ColumnDescription description) throws FitsException {
    requireTable();
    file.columns().insertColumn(index, description);
    return refreshed();
  }

  public FitsHdu appendColumn(ColumnDescription description) throws FitsException {
    requireTable();
    file.columns().appendColumn(description);
    return refreshed();
  }

  public FitsHdu deleteColumn(String name) throws FitsException {
    requireTable();
    file.columns().deleteColumn(name);
    return refreshed();
  }

  public FitsHdu deleteColumn(int index) throws FitsException {
    requireTable();
    file.columns().deleteColumn(index);
    return refreshed();
  }

  public FitsHdu insertRows(long position, long count) throws FitsException {
    requireTable();
    file.columns().insertRows(position, count);
    return refreshed();
  }

  public FitsHdu deleteRows(RowRange rows) throws FitsException {
    requireTable();
    file.columns().deleteRows(rows);
    return refreshed();
  }

  // Images

  /** Row-major axis lengths. */
  public List<Long> dimensions() throws FitsException {
    requireImage();
    return file.images().dimensions();
  }

  public ImageType pixelType() throws FitsException {
    requireImage();
    return file.images().pixelType();
  }

  public <A> A readSection(ValueType<A> type, long start, long end) throws FitsException {
    requireImage();
    return file.images().readSection(type, start, end);
  }

  public <A> A readRows(ValueType<A> type, long startRow, long numRows) throws FitsException {
    requireImage();
    return file.images().readRows(type, startRow, numRows);
  }

  public <A> A readRow(ValueType<A> type, long row) throws FitsException {
    requireImage();
    return file.images().readRow(type, row);
  }

  public <A> A readImage(ValueType<A> type) throws FitsException {
    requireImage();
    return file.images().readImage(type);
  }

  public <A> ImageData<A> readImageArray(ValueType<A> type) throws FitsException {
    requireImage();
    return file.images().readImageArray(type);
  }

  /**
   * Reads a rectangular region.
   *
   * @param type requested value type
   * @param ranges one half-open range per row-major axis
   * @param <A> array type
   * @return flat row-major pixels
   * @throws FitsException {@code BoundsException} naming the axis before any read
   */
  public <A> A readRegion(ValueType<A> type, List<AxisRange> ranges) throws FitsException {
    requireImage();
    return file.images().readRegion(type, ranges);
  }

  public <A> ImageData<A> readRegionArray(ValueType<A> type, List<AxisRange> ranges)
      throws FitsException {
    requireImage();
    return file.images().readRegionArray(type, ranges);
  }

  public <A> void writeSection(ValueType<A> type, long start, A values) throws FitsException {
    requireImage();
    file.images().writeSection(type, start, values);
  }

  public <A> void writeImage(ValueType<A> type, A values) throws FitsException {
    requireImage();
    file.images().writeImage(type, values);
  }

  public <A> void writeRegion(ValueType<A> type, List<AxisRange> ranges, A values)
      throws FitsException {
    requireImage();
    file.images().writeRegion(type, ranges, values);
  }

  public FitsHdu resize(List<Long> dimensions) throws FitsException {
    requireImage();
    file.images().resize(dimensions);
    return refreshed();
  }

  // Structure

  /**
   * Deletes this HDU. The file then sits on the HDU cfitsio moved to; HDU values located earlier
   * may now address different HDUs.
   *
   * @throws FitsException when the file is read-only or cfitsio fails
   */
  public void delete() throws FitsException {
    makeCurrent().delete();
  }

  /**
   * Appends a copy of this HDU to another file.
   *
   * @param target destination, open read-write
   * @return the copy, current in {@code target}
   * @throws FitsException when the destination is read-only or cfitsio fails
   */
  public FitsHdu copyTo(FitsFile target) throws FitsException {
    Objects.requireNonNull(target, "target");
    makeCurrent().copyTo(target.handle());
    return target.currentHdu();
  }

  private HduCursor makeCurrent() throws FitsException {
    HduCursor cursor = file.cursor();
    if (cursor.currentNumber() != number) {
      cursor.moveTo(number);
    }
    return cursor;
  }

  private FitsHdu refreshed() throws FitsException {
    return new FitsHdu(file, number, makeCurrent().describe());
  }

  private void requireTable() throws FitsException {
    if (!(info instanceof TableInfo)) {
      throw new TypeMismatchException(
          "HDU " + index() + " (" + type() + ") is not a table", 0, List.of());
    }
    makeCurrent();
  }

  private void requireImage() throws FitsException {
    if (!(info instanceof ImageInfo)) {
      throw new TypeMismatchException(
          "HDU " + index() + " (" + type() + ") is not an image", 0, List.of());
    }
    makeCurrent();
  }

  @Override
  public String toString() {
    return "FitsHdu[" + index() + ", " + info + "]";
  }
}
