package ca.gc.cra.fitsio.application.port;

import java.util.List;

/**
 * <strong>What:</strong> Java mirror of the cfitsio functions consumed by the access layer.
 * <p><strong>Why:</strong> Keeps pointer marshalling in one adapter and lets the engines run against an
 * in-memory implementation in tests.</p>
 * <p><strong>Contract:</strong> Every fallible method returns the cfitsio status ({@code 0} on success)
 * and reports results through single-element out-parameter arrays. File handles are opaque
 * {@code fitsfile*} values carried as {@code long}. Data buffers are Java primitive arrays whose
 * element type follows the datatype code: {@code TBYTE} and {@code TLOGICAL} use {@code byte[]},
 * {@code TSHORT} {@code short[]}, {@code TINT} {@code int[]}, {@code TLONGLONG} {@code long[]},
 * {@code TFLOAT} {@code float[]}, {@code TDOUBLE} {@code double[]} and {@code TSTRING}
 * {@code String[]}. Axis arrays are in cfitsio's order (fastest axis first) and one-based.</p>
 * <p><strong>Thread-safety:</strong> Implementations are only as thread-safe as the underlying library;
 * callers serialize access per file.</p>
 *
 * @since 0.1.0
 */
public interface FitsioNative {

  /** {@code ffopen}. */
  int openFile(long[] fptr, String path, int ioMode);

  /** {@code ffinit}; a leading {@code !} in {@code path} overwrites an existing file. */
  int createFile(long[] fptr, String path);

  /** {@code ffclos}. */
  int closeFile(long fptr);

  /** {@code ffflmd}. */
  int fileMode(long fptr, int[] ioMode);

  /** {@code ffflnm}. */
  int fileName(long fptr, String[] name);

  /** {@code ffthdu}. */
  int numHdus(long fptr, int[] count);

  /** {@code ffghdn}; never fails. */
  int currentHdu(long fptr, int[] number);

  /** {@code ffmahd}. */
  int moveAbsolute(long fptr, int hduNumber, int[] hduType);

  /** {@code ffmrhd}. */
  int moveRelative(long fptr, int offset, int[] hduType);

  /** {@code ffmnhd}; version {@code 0} matches any {@code EXTVER}. */
  int moveNamed(long fptr, int hduType, String name, int version);

  /** {@code ffghdt}. */
  int hduType(long fptr, int[] hduType);

  /** {@code ffdhdu}. */
  int deleteHdu(long fptr, int[] newHduType);

  /** {@code ffcopy}: appends the current HDU of {@code source} to {@code target}. */
  int copyHdu(long source, long target, int moreKeys);

  /** {@code ffgiet}. */
  int imageEquivalentType(long fptr, int[] bitpix);

  /** {@code ffgidm}. */
  int imageDimensionCount(long fptr, int[] naxis);

  /** {@code ffgiszll}. */
  int imageSize(long fptr, int maxDimensions, long[] naxes);

  /** {@code ffcrimll}. */
  int createImage(long fptr, int bitpix, int naxis, long[] naxes);

  /** {@code ffrsimll}. */
  int resizeImage(long fptr, int bitpix, int naxis, long[] naxes);

  /**
   * {@code ffgpv} without a null substitute: reads {@code count} raw pixels starting at one-based
   * element {@code firstElement}.
   */
  int readPixels(long fptr, int datatype, long firstElement, long count, Object array, int[] anyNull);

  /** {@code ffgsv}: reads the inclusive box {@code firstPixel..lastPixel}. */
  int readSubset(
      long fptr, int datatype, long[] firstPixel, long[] lastPixel, long[] increment, Object array,
      int[] anyNull);

  /** {@code ffppr}. */
  int writePixels(long fptr, int datatype, long firstElement, long count, Object array);

  /** {@code ffpss}. */
  int writeSubset(long fptr, int datatype, long[] firstPixel, long[] lastPixel, Object array);

  /** {@code ffcrtb}; {@code units} entries may be {@code null}. */
  int createTable(
      long fptr, int tableType, long rows, String[] names, String[] forms, String[] units,
      String extname);

  /** {@code ffgnrwll}. */
  int numRows(long fptr, long[] rows);

  /** {@code ffgncl}. */
  int numColumns(long fptr, int[] columns);

  /** {@code ffgcno}. */
  int columnNumber(long fptr, int caseSensitivity, String template, int[] column);

  /** {@code ffgtclll}. */
  int columnType(long fptr, int column, int[] typecode, long[] repeat, long[] width);

  /**
   * {@code ffgcf}: reads {@code count} elements of a column with null flags. For {@code TSTRING}
   * {@code count} is the number of strings.
   */
  int readColumn(
      long fptr, int datatype, int column, long firstRow, long firstElement, long count,
      Object array, byte[] nullFlags, int[] anyNull);

  /** {@code ffpcl}. */
  int writeColumn(
      long fptr, int datatype, int column, long firstRow, long firstElement, long count,
      Object array);

  /** {@code ffpclu}: sets elements to the column's null value. */
  int writeColumnNull(long fptr, int column, long firstRow, long firstElement, long count);

  /** {@code fficol}. */
  int insertColumn(long fptr, int column, String name, String form);

  /** {@code ffdcol}. */
  int deleteColumn(long fptr, int column);

  /** {@code ffirow}: inserts {@code count} rows after row {@code afterRow} (0 = before the first). */
  int insertRows(long fptr, long afterRow, long count);

  /** {@code ffdrow}. */
  int deleteRows(long fptr, long firstRow, long count);

  /** {@code ffgkys}; {@code comment} may be {@code null}. */
  int readKeyString(long fptr, String keyword, String[] value, String[] comment);

  /** {@code ffgkyjj}. */
  int readKeyLong(long fptr, String keyword, long[] value, String[] comment);

  /** {@code ffgkyd}. */
  int readKeyDouble(long fptr, String keyword, double[] value, String[] comment);

  /** {@code ffgkyl}. */
  int readKeyLogical(long fptr, String keyword, int[] value, String[] comment);

  /** {@code ffukys}. */
  int updateKeyString(long fptr, String keyword, String value, String comment);

  /** {@code ffukyjj}. */
  int updateKeyLong(long fptr, String keyword, long value, String comment);

  /** {@code ffukyd}; negative {@code decimals} selects exponential notation. */
  int updateKeyDouble(long fptr, String keyword, double value, int decimals, String comment);

  /** {@code ffukyl}. */
  int updateKeyLogical(long fptr, String keyword, boolean value, String comment);

  /** {@code ffgerr}: short description of a status code. */
  String errorText(int status);

  /** {@code ffgmsg} until empty: drains the library's message stack, oldest first. */
  List<String> drainMessages();

  /** {@code ffcmsg}. */
  void clearMessages();

  /** {@code ffvers}. */
  float libraryVersion();

  /** {@code fits_is_reentrant}. */
  boolean isReentrant();
}
