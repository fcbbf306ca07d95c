package ca.gc.cra.fitsio.application.table;

import ca.gc.cra.fitsio.application.dispatch.TypeCodes;
import ca.gc.cra.fitsio.application.file.NativeHandle;
import ca.gc.cra.fitsio.application.header.HeaderEngine;
import ca.gc.cra.fitsio.application.port.FitsioNative;
import ca.gc.cra.fitsio.application.status.FitsOperation;
import ca.gc.cra.fitsio.application.status.StatusTranslator;
import ca.gc.cra.fitsio.domain.CaseSensitivity;
import ca.gc.cra.fitsio.domain.HduType;
import ca.gc.cra.fitsio.domain.ValueKind;
import ca.gc.cra.fitsio.domain.ValueType;
import ca.gc.cra.fitsio.domain.header.KeyType;
import ca.gc.cra.fitsio.domain.table.ColumnData;
import ca.gc.cra.fitsio.domain.table.ColumnDescription;
import ca.gc.cra.fitsio.domain.table.LibraryRowSpan;
import ca.gc.cra.fitsio.domain.table.RowRange;
import ca.gc.cra.fitsio.error.FitsException;
import ca.gc.cra.fitsio.validation.Numbers;
import ca.gc.cra.fitsio.validation.Strings;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Typed column reads and writes on the current table HDU, plus table structure
 * changes.
 * <p><strong>Why:</strong> cfitsio addresses columns and rows one-based with untyped buffers. This
 * engine resolves names, checks the requested {@link ValueType} against the declared column type
 * before any data call, converts {@link RowRange}s with {@link RowRanges} and sizes buffers as
 * {@code rows * elementsPerRow}.</p>
 * <p><strong>Nulls:</strong> Reads use {@code ffgcf}, so every element gets a null flag; the flags
 * become the validity mask of the returned {@link ColumnData}.</p>
 * <p><strong>Writes are not transactional:</strong> when a multi-step write fails part way (values
 * written, null markers not yet), the earlier steps stay in the file.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; bound to one {@link NativeHandle}.</p>
 * <p><strong>Observability:</strong> Histogram {@code fitsio.column.read.elements}.</p>
 *
 * @since 0.1.0
 */
public final class ColumnEngine {
  private static final Logger log = LoggerFactory.getLogger(ColumnEngine.class);
  static final String READ_ELEMENTS = "fitsio.column.read.elements";

  private final NativeHandle handle;
  private final HeaderEngine headers;
  private final CaseSensitivity defaultCase;

  public ColumnEngine(NativeHandle handle, HeaderEngine headers, CaseSensitivity defaultCase) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.headers = Objects.requireNonNull(headers, "headers");
    this.defaultCase = Objects.requireNonNull(defaultCase, "defaultCase");
  }

  public long numRows() throws FitsException {
    long[] rows = new long[1];
    translator().check(lib().numRows(handle.pointer(), rows), FitsOperation.QUERY, "row count");
    return rows[0];
  }

  public int numColumns() throws FitsException {
    int[] columns = new int[1];
    translator().check(
        lib().numColumns(handle.pointer(), columns), FitsOperation.QUERY, "column count");
    return columns[0];
  }

  public int columnNumber(String name) throws FitsException {
    return columnNumber(name, defaultCase);
  }

  /**
   * Resolves a column name.
   *
   * @param name column name ({@code TTYPEn})
   * @param sensitivity name matching policy
   * @return zero-based column index
   * @throws FitsException {@code ColumnNotFoundException} when no column matches
   */
  public int columnNumber(String name, CaseSensitivity sensitivity) throws FitsException {
    String column = Strings.requireNonBlank("column", name);
    int[] number = new int[1];
    int status = lib().columnNumber(
        handle.pointer(), TypeCodes.caseSensitivity(sensitivity), column, number);
    translator().check(status, FitsOperation.COLUMN_LOOKUP, column);
    return number[0] - 1;
  }

  /**
   * Describes one column from {@code ffgtclll} and its {@code TTYPEn}/{@code TUNITn} keywords.
   *
   * @param index zero-based column index
   * @return description
   * @throws FitsException {@code TypeMismatchException} for unsupported column types
   */
  public ColumnDescription describeColumn(int index) throws FitsException {
    int number = index + 1;
    int[] typecode = new int[1];
    long[] repeat = new long[1];
    long[] width = new long[1];
    translator().check(
        lib().columnType(handle.pointer(), number, typecode, repeat, width),
        FitsOperation.QUERY,
        "column " + number);
    String name = headers.readOptional("TTYPE" + number, KeyType.STRING).orElse("COL" + number);
    String unit = headers.readOptional("TUNIT" + number, KeyType.STRING).orElse(null);
    return ColumnDescription.builder(name)
        .type(TypeCodes.columnType(typecode[0], name))
        .repeat(Math.max(1, repeat[0]))
        .width(Math.max(1, width[0]))
        .unit(unit)
        .build();
  }

  public List<ColumnDescription> describeColumns() throws FitsException {
    int count = numColumns();
    List<ColumnDescription> columns = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      columns.add(describeColumn(i));
    }
    return columns;
  }

  /**
   * Reads a row range of a column with its validity mask.
   *
   * @param name column name
   * @param type requested value type
   * @param rows zero-based half-open row range
   * @param <A> array type
   * @return values and null mask; empty without a native read when {@code rows} is empty
   * @throws FitsException {@code TypeMismatchException} before the read when the type is incompatible,
   *     {@code BoundsException} when the range ends past the last row
   */
  public <A> ColumnData<A> read(String name, ValueType<A> type, RowRange rows)
      throws FitsException {
    Objects.requireNonNull(rows, "rows");
    ResolvedColumn column = resolve(name, type);
    LibraryRowSpan span = RowRanges.toLibrary(rows, numRows());
    int perRow = column.elementsPerRow();
    if (span.isEmpty()) {
      return ColumnData.empty(type, perRow);
    }
    int total = Numbers.requireArrayLength("element count", Math.multiplyExact(span.count(), perRow));
    Object buffer = nativeBuffer(type, total);
    byte[] nullFlags = new byte[total];
    int[] anyNull = new int[1];
    int status = lib().readColumn(
        handle.pointer(),
        TypeCodes.datatype(type.kind()),
        column.number(),
        span.firstRow(),
        1,
        total,
        buffer,
        nullFlags,
        anyNull);
    translator().check(status, FitsOperation.COLUMN_READ, describe(column, span));
    handle.metrics().observe(READ_ELEMENTS, total);
    BitSet nulls = new BitSet(total);
    if (anyNull[0] != 0) {
      for (int i = 0; i < total; i++) {
        if (nullFlags[i] != 0) {
          nulls.set(i);
        }
      }
    }
    log.debug("Read {} elements of column {} rows {}..{}", total, column.description().name(),
        span.firstRow(), span.lastRow());
    return new ColumnData<>(type, fromNative(type, buffer), nulls, perRow);
  }

  /**
   * Reads a row range and returns the bare value array; null elements read as zero or NaN.
   *
   * @param name column name
   * @param type requested value type
   * @param rows zero-based half-open row range
   * @param <A> array type
   * @return values in row order
   * @throws FitsException as {@link #read(String, ValueType, RowRange)}
   */
  public <A> A readValues(String name, ValueType<A> type, RowRange rows) throws FitsException {
    return read(name, type, rows).values();
  }

  /**
   * Writes values starting at a row; the table grows when the values run past the last row.
   *
   * @param name column name
   * @param type value type of {@code values}
   * @param firstRow zero-based first row
   * @param values {@code n * elementsPerRow} elements
   * @param <A> array type
   * @throws FitsException when the handle is read-only, the type is incompatible or cfitsio fails
   */
  public <A> void write(String name, ValueType<A> type, long firstRow, A values)
      throws FitsException {
    handle.requireWritable("column " + name);
    ResolvedColumn column = resolve(name, type);
    writeResolved(column, type, firstRow, values);
  }

  /**
   * Writes exactly the rows of {@code rows}.
   *
   * @param name column name
   * @param type value type of {@code values}
   * @param rows zero-based half-open row range
   * @param values {@code rows.count() * elementsPerRow} elements
   * @param <A> array type
   * @throws FitsException as {@link #write(String, ValueType, long, Object)}
   */
  public <A> void write(String name, ValueType<A> type, RowRange rows, A values)
      throws FitsException {
    handle.requireWritable("column " + name);
    ResolvedColumn column = resolve(name, type);
    long expected = Math.multiplyExact(rows.count(), (long) column.elementsPerRow());
    if (type.length(values) != expected) {
      throw new IllegalArgumentException(
          "expected " + expected + " values for rows " + rows + ", got " + type.length(values));
    }
    writeResolved(column, type, rows.start(), values);
  }

  /**
   * Writes column data, then marks its null elements with the column's null value.
   *
   * @param name column name
   * @param data values and null mask
   * @param firstRow zero-based first row
   * @param <A> array type
   * @throws FitsException as {@link #write(String, ValueType, long, Object)}; a failure while marking
   *     nulls leaves the values already written in place
   */
  public <A> void write(String name, ColumnData<A> data, long firstRow) throws FitsException {
    handle.requireWritable("column " + name);
    ResolvedColumn column = resolve(name, data.type());
    if (data.elementsPerRow() != column.elementsPerRow()) {
      throw new IllegalArgumentException("column " + name + " holds " + column.elementsPerRow()
          + " elements per row, data has " + data.elementsPerRow());
    }
    BitSet nulls = data.nullMask();
    A values = blankMaskedStrings(data.type(), data.values(), nulls);
    writeResolved(column, data.type(), firstRow, values);
    int perRow = column.elementsPerRow();
    for (int start = nulls.nextSetBit(0); start >= 0; start = nulls.nextSetBit(start)) {
      int end = nulls.nextClearBit(start);
      long row = firstRow + 1 + start / perRow;
      long element = 1 + start % perRow;
      int status = lib().writeColumnNull(handle.pointer(), column.number(), row, element, end - start);
      translator().check(status, FitsOperation.COLUMN_WRITE, column.description().name());
      start = end;
    }
  }

  /**
   * Inserts a column before the zero-based {@code index}; {@code index == numColumns()} appends.
   *
   * @param index insert position
   * @param description new column
   * @throws FitsException when the handle is read-only or cfitsio rejects the column
   */
  public void insertColumn(int index, ColumnDescription description) throws FitsException {
    Objects.requireNonNull(description, "description");
    handle.requireWritable("column " + description.name());
    Numbers.requireRange("column index", index, 0, numColumns());
    int number = index + 1;
    int status = lib().insertColumn(
        handle.pointer(), number, description.name(), description.tform());
    translator().check(status, FitsOperation.STRUCTURE, "column " + description.name());
    if (description.unit().isPresent()) {
      headers.write("TUNIT" + number, KeyType.STRING, description.unit().get(), "physical unit");
    }
  }

  public void appendColumn(ColumnDescription description) throws FitsException {
    insertColumn(numColumns(), description);
  }

  public void deleteColumn(String name) throws FitsException {
    deleteColumn(columnNumber(name));
  }

  public void deleteColumn(int index) throws FitsException {
    handle.requireWritable("column " + (index + 1));
    Numbers.requireRange("column index", index, 0, numColumns() - 1L);
    translator().check(
        lib().deleteColumn(handle.pointer(), index + 1),
        FitsOperation.STRUCTURE,
        "column " + (index + 1));
  }

  /**
   * Inserts empty rows before the zero-based row {@code position}.
   *
   * @param position insert position, {@code 0..numRows()}
   * @param count rows to insert
   * @throws FitsException when the handle is read-only or cfitsio fails
   */
  public void insertRows(long position, long count) throws FitsException {
    handle.requireWritable("rows");
    Numbers.requireRange("row position", position, 0, numRows());
    Numbers.requireNonNegative("row count", count);
    if (count == 0) {
      return;
    }
    translator().check(
        lib().insertRows(handle.pointer(), position, count), FitsOperation.STRUCTURE, "rows");
  }

  public void deleteRows(RowRange rows) throws FitsException {
    handle.requireWritable("rows");
    LibraryRowSpan span = RowRanges.toLibrary(rows, numRows());
    if (span.isEmpty()) {
      return;
    }
    translator().check(
        lib().deleteRows(handle.pointer(), span.firstRow(), span.count()),
        FitsOperation.STRUCTURE,
        "rows " + span.firstRow() + ".." + span.lastRow());
  }

  /**
   * Appends a binary table HDU to the end of the file and makes it current. ASCII tables can be read
   * but not created; their TFORM grammar differs from the binary forms built here.
   *
   * @param extname extension name, or {@code null}
   * @param columns at least one column
   * @throws FitsException when the handle is read-only or cfitsio rejects the definition
   */
  public void createTable(String extname, List<ColumnDescription> columns) throws FitsException {
    if (columns == null || columns.isEmpty()) {
      throw new IllegalArgumentException("a table needs at least one column");
    }
    handle.requireWritable("new table");
    String[] names = new String[columns.size()];
    String[] forms = new String[columns.size()];
    String[] units = new String[columns.size()];
    for (int i = 0; i < columns.size(); i++) {
      ColumnDescription column = columns.get(i);
      names[i] = column.name();
      forms[i] = column.tform();
      units[i] = column.unit().orElse(null);
    }
    int status = lib().createTable(
        handle.pointer(), TypeCodes.hduTypeCode(HduType.BINARY_TABLE), 0, names, forms, units,
        extname);
    translator().check(status, FitsOperation.STRUCTURE, "table " + (extname == null ? "" : extname));
  }

  private <A> void writeResolved(ResolvedColumn column, ValueType<A> type, long firstRow, A values)
      throws FitsException {
    Objects.requireNonNull(values, "values");
    Numbers.requireNonNegative("first row", firstRow);
    int length = type.length(values);
    int perRow = column.elementsPerRow();
    if (length % perRow != 0) {
      throw new IllegalArgumentException("column " + column.description().name() + " holds "
          + perRow + " elements per row; " + length + " values do not fill whole rows");
    }
    if (length == 0) {
      return;
    }
    if (type.kind() == ValueKind.STRING) {
      String[] strings = (String[]) values;
      for (int i = 0; i < strings.length; i++) {
        if (strings[i] == null) {
          throw new IllegalArgumentException("column " + column.description().name()
              + " value " + i + " is null; mark it in a null mask instead");
        }
      }
    }
    LibraryRowSpan span = RowRanges.toLibrary(RowRange.of(firstRow, firstRow + length / perRow));
    int status = lib().writeColumn(
        handle.pointer(),
        TypeCodes.datatype(type.kind()),
        column.number(),
        span.firstRow(),
        1,
        length,
        toNative(type, values));
    translator().check(status, FitsOperation.COLUMN_WRITE, describe(column, span));
  }

  private ResolvedColumn resolve(String name, ValueType<?> type) throws FitsException {
    Objects.requireNonNull(type, "type");
    int index = columnNumber(name);
    ColumnDescription description = describeColumn(index);
    TypeCodes.requireColumnCompatible(description, type);
    int perRow = Numbers.requireArrayLength("elements per row", description.elementsPerRow());
    return new ResolvedColumn(index + 1, description, perRow);
  }

  /** Masked string slots may hold {@code null}; they are written blank, then marked null. */
  private static <A> A blankMaskedStrings(ValueType<A> type, A values, BitSet nulls) {
    if (type.kind() != ValueKind.STRING || nulls.isEmpty()) {
      return values;
    }
    String[] strings = ((String[]) values).clone();
    for (int i = nulls.nextSetBit(0); i >= 0; i = nulls.nextSetBit(i + 1)) {
      if (strings[i] == null) {
        strings[i] = "";
      }
    }
    return type.cast(strings);
  }

  private static Object nativeBuffer(ValueType<?> type, int total) {
    return type.kind() == ValueKind.LOGICAL ? new byte[total] : type.newArray(total);
  }

  private static <A> A fromNative(ValueType<A> type, Object buffer) {
    if (type.kind() == ValueKind.LOGICAL) {
      return type.cast(LogicalValues.fromNative((byte[]) buffer));
    }
    return type.cast(buffer);
  }

  private static Object toNative(ValueType<?> type, Object values) {
    if (type.kind() == ValueKind.LOGICAL) {
      return LogicalValues.toNative((boolean[]) values);
    }
    return values;
  }

  private static String describe(ResolvedColumn column, LibraryRowSpan span) {
    return "column " + column.description().name() + " rows " + span.firstRow() + ".."
        + span.lastRow();
  }

  private FitsioNative lib() {
    return handle.nativeLib();
  }

  private StatusTranslator translator() {
    return handle.translator();
  }

  private record ResolvedColumn(int number, ColumnDescription description, int elementsPerRow) {}
}
