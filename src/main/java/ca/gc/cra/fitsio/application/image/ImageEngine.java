package ca.gc.cra.fitsio.application.image;

import ca.gc.cra.fitsio.application.dispatch.TypeCodes;
import ca.gc.cra.fitsio.application.file.NativeHandle;
import ca.gc.cra.fitsio.application.header.HeaderEngine;
import ca.gc.cra.fitsio.application.port.FitsioNative;
import ca.gc.cra.fitsio.application.status.FitsOperation;
import ca.gc.cra.fitsio.application.status.StatusTranslator;
import ca.gc.cra.fitsio.domain.ValueType;
import ca.gc.cra.fitsio.domain.header.KeyType;
import ca.gc.cra.fitsio.domain.image.AxisRange;
import ca.gc.cra.fitsio.domain.image.ImageData;
import ca.gc.cra.fitsio.domain.image.ImageDescription;
import ca.gc.cra.fitsio.domain.image.ImageType;
import ca.gc.cra.fitsio.error.BoundsException;
import ca.gc.cra.fitsio.error.FitsException;
import ca.gc.cra.fitsio.validation.Numbers;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Pixel reads and writes on the current image HDU, image creation and resize.
 * <p><strong>Why:</strong> Java callers address images row-major and zero-based; cfitsio addresses them
 * column-major and one-based. Shapes go through {@link AxisOrder}; every range is checked against the
 * image before a native call and rejected with a {@link BoundsException} naming the row-major axis.</p>
 * <p><strong>Rows:</strong> A row is a run along the last (fastest) row-major axis; row {@code i}
 * covers flat pixels {@code [i * rowLength, (i + 1) * rowLength)}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; bound to one {@link NativeHandle}.</p>
 * <p><strong>Observability:</strong> Histogram {@code fitsio.image.read.pixels}.</p>
 *
 * @since 0.1.0
 */
public final class ImageEngine {
  static final String READ_PIXELS = "fitsio.image.read.pixels";

  private final NativeHandle handle;
  private final HeaderEngine headers;

  public ImageEngine(NativeHandle handle, HeaderEngine headers) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.headers = Objects.requireNonNull(headers, "headers");
  }

  /**
   * Axis lengths of the current image, row-major (the reverse of {@code NAXIS1..NAXISn}).
   *
   * @return shape; empty for an image without axes
   * @throws FitsException when the current HDU is not an image
   */
  public List<Long> dimensions() throws FitsException {
    int[] naxis = new int[1];
    translator().check(
        lib().imageDimensionCount(handle.pointer(), naxis), FitsOperation.QUERY, "image axes");
    long[] naxes = new long[naxis[0]];
    if (naxis[0] > 0) {
      translator().check(
          lib().imageSize(handle.pointer(), naxis[0], naxes), FitsOperation.QUERY, "image size");
    }
    return AxisOrder.toRowMajor(naxes);
  }

  public ImageType pixelType() throws FitsException {
    int[] bitpix = new int[1];
    translator().check(
        lib().imageEquivalentType(handle.pointer(), bitpix), FitsOperation.QUERY, "pixel type");
    return TypeCodes.imageType(bitpix[0]);
  }

  /**
   * Reads flat pixels {@code [start, end)} in storage order.
   *
   * @param type requested value type; numeric only
   * @param start first flat pixel, zero-based
   * @param end pixel after the last one
   * @param <A> array type
   * @return {@code end - start} pixels
   * @throws FitsException {@code BoundsException} when {@code end} exceeds the pixel count
   */
  public <A> A readSection(ValueType<A> type, long start, long end) throws FitsException {
    requireOrdered(start, end);
    long pixels = pixelCount(requireNumeric(type));
    if (end > pixels) {
      throw new BoundsException(
          "pixel range", BoundsException.NO_AXIS, BoundsException.Bound.END, end, pixels);
    }
    return readFlat(type, start, end - start);
  }

  /**
   * Reads whole rows.
   *
   * @param type requested value type
   * @param startRow first row, zero-based
   * @param numRows rows to read
   * @param <A> array type
   * @return {@code numRows * rowLength} pixels
   * @throws FitsException {@code BoundsException} when the rows run past the image
   */
  public <A> A readRows(ValueType<A> type, long startRow, long numRows) throws FitsException {
    Numbers.requireNonNegative("start row", startRow);
    Numbers.requireNonNegative("row count", numRows);
    List<Long> shape = requireNumeric(type);
    if (shape.isEmpty()) {
      throw new BoundsException(
          "image rows", BoundsException.NO_AXIS, BoundsException.Bound.END, startRow + numRows, 0);
    }
    long rowLength = shape.get(shape.size() - 1);
    long rows = rowLength == 0 ? 0 : pixelCount(shape) / rowLength;
    long end = startRow + numRows;
    if (end > rows) {
      int axis = shape.size() >= 2 ? shape.size() - 2 : 0;
      throw new BoundsException("image rows", axis, BoundsException.Bound.END, end, rows);
    }
    return readFlat(type, startRow * rowLength, numRows * rowLength);
  }

  public <A> A readRow(ValueType<A> type, long row) throws FitsException {
    return readRows(type, row, 1);
  }

  public <A> A readImage(ValueType<A> type) throws FitsException {
    return readFlat(type, 0, pixelCount(requireNumeric(type)));
  }

  /**
   * Reads the whole image as a dense row-major array.
   *
   * @param type requested value type
   * @param <A> array type
   * @return pixels with the image's shape
   * @throws FitsException when the read fails
   */
  public <A> ImageData<A> readImageArray(ValueType<A> type) throws FitsException {
    List<Long> shape = requireNumeric(type);
    A pixels = readFlat(type, 0, pixelCount(shape));
    return new ImageData<>(type, toIntShape(shape), pixels);
  }

  /**
   * Reads a box given as one range per row-major axis.
   *
   * @param type requested value type
   * @param ranges one range per axis, row-major
   * @param <A> array type
   * @return pixels in row-major order
   * @throws FitsException {@code BoundsException} naming the first axis whose range exceeds the image,
   *     raised before any pixel read
   */
  public <A> A readRegion(ValueType<A> type, List<AxisRange> ranges) throws FitsException {
    long count = checkRegion(requireNumeric(type), ranges);
    int length = Numbers.requireArrayLength("region size", count);
    if (length == 0) {
      return type.newArray(0);
    }
    LibraryRegion region = AxisOrder.toLibrary(ranges);
    A buffer = type.newArray(length);
    int[] anyNull = new int[1];
    int status = lib().readSubset(
        handle.pointer(),
        TypeCodes.datatype(type.kind()),
        region.firstPixel(),
        region.lastPixel(),
        region.unitIncrement(),
        buffer,
        anyNull);
    translator().check(status, FitsOperation.IMAGE_READ, "region " + ranges);
    handle.metrics().observe(READ_PIXELS, length);
    return buffer;
  }

  public <A> ImageData<A> readRegionArray(ValueType<A> type, List<AxisRange> ranges)
      throws FitsException {
    A pixels = readRegion(type, ranges);
    int[] shape = new int[ranges.size()];
    for (int i = 0; i < shape.length; i++) {
      shape[i] = Math.toIntExact(ranges.get(i).length());
    }
    return new ImageData<>(type, shape, pixels);
  }

  /**
   * Writes flat pixels starting at {@code start}.
   *
   * @param type value type of {@code values}
   * @param start first flat pixel, zero-based
   * @param values pixels
   * @param <A> array type
   * @throws FitsException {@code BoundsException} when the values run past the image
   */
  public <A> void writeSection(ValueType<A> type, long start, A values) throws FitsException {
    Objects.requireNonNull(values, "values");
    Numbers.requireNonNegative("start", start);
    handle.requireWritable("image");
    long pixels = pixelCount(requireNumeric(type));
    int length = type.length(values);
    if (start + length > pixels) {
      throw new BoundsException(
          "pixel range", BoundsException.NO_AXIS, BoundsException.Bound.END, start + length, pixels);
    }
    if (length == 0) {
      return;
    }
    int status = lib().writePixels(
        handle.pointer(), TypeCodes.datatype(type.kind()), start + 1, length, values);
    translator().check(status, FitsOperation.IMAGE_WRITE, "pixels " + start + ".." + (start + length));
  }

  public <A> void writeImage(ValueType<A> type, A values) throws FitsException {
    writeSection(type, 0, values);
  }

  /**
   * Writes a box given as one range per row-major axis.
   *
   * @param type value type of {@code values}
   * @param ranges one range per axis, row-major
   * @param values exactly as many pixels as the box holds, row-major
   * @param <A> array type
   * @throws FitsException {@code BoundsException} before any write when a range exceeds the image
   */
  public <A> void writeRegion(ValueType<A> type, List<AxisRange> ranges, A values)
      throws FitsException {
    Objects.requireNonNull(values, "values");
    handle.requireWritable("image");
    long count = checkRegion(requireNumeric(type), ranges);
    if (type.length(values) != count) {
      throw new IllegalArgumentException(
          "region holds " + count + " pixels, got " + type.length(values));
    }
    if (count == 0) {
      return;
    }
    LibraryRegion region = AxisOrder.toLibrary(ranges);
    int status = lib().writeSubset(
        handle.pointer(),
        TypeCodes.datatype(type.kind()),
        region.firstPixel(),
        region.lastPixel(),
        values);
    translator().check(status, FitsOperation.IMAGE_WRITE, "region " + ranges);
  }

  /**
   * Appends an image HDU to the end of the file and makes it current.
   *
   * @param extname extension name, or {@code null}
   * @param description pixel type and row-major dimensions
   * @throws FitsException when the handle is read-only or cfitsio rejects the image
   */
  public void createImage(String extname, ImageDescription description) throws FitsException {
    Objects.requireNonNull(description, "description");
    handle.requireWritable("new image");
    long[] axes = AxisOrder.toLibraryOrder(description.dimensions());
    int status = lib().createImage(
        handle.pointer(), description.type().bitpix(), axes.length, axes);
    translator().check(status, FitsOperation.STRUCTURE, "image " + (extname == null ? "" : extname));
    if (extname != null && !extname.isBlank()) {
      headers.write("EXTNAME", KeyType.STRING, extname, "extension name");
    }
  }

  /**
   * Writes the empty primary array ({@code BITPIX = 8}, {@code NAXIS = 0}) of a new file.
   *
   * @throws FitsException when cfitsio fails
   */
  public void createEmptyPrimary() throws FitsException {
    int status = lib().createImage(
        handle.pointer(), ImageType.UNSIGNED_BYTE.bitpix(), 0, new long[0]);
    translator().check(status, FitsOperation.STRUCTURE, "primary HDU");
  }

  /**
   * Changes the dimensions of the current image, keeping its BITPIX.
   *
   * @param dimensions new row-major dimensions
   * @throws FitsException when the handle is read-only or cfitsio fails
   */
  public void resize(List<Long> dimensions) throws FitsException {
    handle.requireWritable("image");
    int bitpix = Math.toIntExact(headers.read("BITPIX", KeyType.LONG));
    ImageType type = TypeCodes.imageType(bitpix);
    long[] axes = AxisOrder.toLibraryOrder(new ImageDescription(type, dimensions).dimensions());
    translator().check(
        lib().resizeImage(handle.pointer(), bitpix, axes.length, axes),
        FitsOperation.STRUCTURE,
        "image resize to " + dimensions);
  }

  private <A> A readFlat(ValueType<A> type, long start, long count) throws FitsException {
    int length = Numbers.requireArrayLength("pixel count", count);
    A buffer = type.newArray(length);
    if (length == 0) {
      return buffer;
    }
    int[] anyNull = new int[1];
    int status = lib().readPixels(
        handle.pointer(), TypeCodes.datatype(type.kind()), start + 1, length, buffer, anyNull);
    translator().check(status, FitsOperation.IMAGE_READ, "pixels " + start + ".." + (start + count));
    handle.metrics().observe(READ_PIXELS, length);
    return buffer;
  }

  private List<Long> requireNumeric(ValueType<?> type) throws FitsException {
    Objects.requireNonNull(type, "type");
    TypeCodes.requireImageCompatible("image", pixelType(), type);
    return dimensions();
  }

  private static long checkRegion(List<Long> shape, List<AxisRange> ranges)
      throws BoundsException {
    Objects.requireNonNull(ranges, "ranges");
    if (ranges.size() != shape.size()) {
      throw new IllegalArgumentException(
          "image has " + shape.size() + " axes, got " + ranges.size() + " ranges");
    }
    long count = 1;
    for (int axis = 0; axis < ranges.size(); axis++) {
      AxisRange range = ranges.get(axis);
      long limit = shape.get(axis);
      if (range.end() > limit) {
        throw new BoundsException("axis " + axis, axis, BoundsException.Bound.END, range.end(), limit);
      }
      count = Math.multiplyExact(count, range.length());
    }
    return ranges.isEmpty() ? 0 : count;
  }

  private static void requireOrdered(long start, long end) {
    Numbers.requireNonNegative("start", start);
    if (end < start) {
      throw new IllegalArgumentException("end " + end + " is before start " + start);
    }
  }

  private static long pixelCount(List<Long> shape) {
    if (shape.isEmpty()) {
      return 0;
    }
    long total = 1;
    for (long axis : shape) {
      total = Math.multiplyExact(total, axis);
    }
    return total;
  }

  private static int[] toIntShape(List<Long> shape) {
    int[] dims = new int[shape.size()];
    for (int i = 0; i < dims.length; i++) {
      dims[i] = Math.toIntExact(shape.get(i));
    }
    return dims;
  }

  private FitsioNative lib() {
    return handle.nativeLib();
  }

  private StatusTranslator translator() {
    return handle.translator();
  }
}
