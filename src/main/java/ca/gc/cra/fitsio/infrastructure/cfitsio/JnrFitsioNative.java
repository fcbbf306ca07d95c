package ca.gc.cra.fitsio.infrastructure.cfitsio;

import static ca.gc.cra.fitsio.application.port.FitsioConstants.FLEN_COMMENT;
import static ca.gc.cra.fitsio.application.port.FitsioConstants.FLEN_ERRMSG;
import static ca.gc.cra.fitsio.application.port.FitsioConstants.FLEN_FILENAME;
import static ca.gc.cra.fitsio.application.port.FitsioConstants.FLEN_STATUS;
import static ca.gc.cra.fitsio.application.port.FitsioConstants.FLEN_VALUE;

import ca.gc.cra.fitsio.application.port.FitsioConstants;
import ca.gc.cra.fitsio.application.port.FitsioNative;
import ca.gc.cra.fitsio.config.FitsioConfig;
import java.lang.ref.Reference;
import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import jnr.ffi.Memory;
import jnr.ffi.Pointer;
import jnr.ffi.Runtime;
import jnr.ffi.byref.IntByReference;
import jnr.ffi.byref.LongLongByReference;
import jnr.ffi.byref.PointerByReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link FitsioNative} implementation backed by the real cfitsio through JNR-FFI.
 * <p><strong>Why:</strong> Keeps every {@link Pointer}, {@link Memory} buffer and by-reference value in
 * this package; the application layer only sees Java arrays and {@code long} handles.</p>
 * <p><strong>Marshalling:</strong> Numeric buffers are copied into direct memory sized by the datatype
 * code and copied back after reads. {@code TSTRING} data travels as a {@link NativeStrings} table whose
 * entries point into one block, sized from the column display width on reads. Strings use the platform
 * charset's ASCII subset, as FITS headers and string columns do.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the bound library; concurrent use of one file
 * must be serialized by the caller.</p>
 *
 * @since 0.1.0
 */
public final class JnrFitsioNative implements FitsioNative {
  private static final Logger log = LoggerFactory.getLogger(JnrFitsioNative.class);

  private final LibCfitsio lib;
  private final Runtime rt;

  public JnrFitsioNative(LibCfitsio lib) {
    this.lib = Objects.requireNonNull(lib, "lib");
    this.rt = Runtime.getRuntime(lib);
  }

  /**
   * Loads cfitsio as configured.
   *
   * @param config library name and optional search path
   * @return adapter over the loaded library
   * @throws UnsatisfiedLinkError when the library cannot be loaded
   */
  public static JnrFitsioNative load(FitsioConfig config) {
    LibCfitsio lib = LibCfitsio.load(config.libraryName(), config.libraryPath());
    JnrFitsioNative adapter = new JnrFitsioNative(lib);
    log.info("Loaded {} version {} (reentrant: {})", config.libraryName(),
        adapter.libraryVersion(), adapter.isReentrant());
    return adapter;
  }

  @Override
  public int openFile(long[] fptr, String path, int ioMode) {
    PointerByReference ref = new PointerByReference();
    IntByReference status = status();
    lib.ffopen(ref, path, ioMode, status);
    fptr[0] = address(ref.getValue());
    return status.intValue();
  }

  @Override
  public int createFile(long[] fptr, String path) {
    PointerByReference ref = new PointerByReference();
    IntByReference status = status();
    lib.ffinit(ref, path, status);
    fptr[0] = address(ref.getValue());
    return status.intValue();
  }

  @Override
  public int closeFile(long fptr) {
    IntByReference status = status();
    lib.ffclos(file(fptr), status);
    return status.intValue();
  }

  @Override
  public int fileMode(long fptr, int[] ioMode) {
    IntByReference mode = new IntByReference();
    IntByReference status = status();
    lib.ffflmd(file(fptr), mode, status);
    ioMode[0] = mode.intValue();
    return status.intValue();
  }

  @Override
  public int fileName(long fptr, String[] name) {
    Pointer buffer = Memory.allocateDirect(rt, FLEN_FILENAME);
    IntByReference status = status();
    lib.ffflnm(file(fptr), buffer, status);
    name[0] = buffer.getString(0);
    return status.intValue();
  }

  @Override
  public int numHdus(long fptr, int[] count) {
    IntByReference out = new IntByReference();
    IntByReference status = status();
    lib.ffthdu(file(fptr), out, status);
    count[0] = out.intValue();
    return status.intValue();
  }

  @Override
  public int currentHdu(long fptr, int[] number) {
    IntByReference out = new IntByReference();
    lib.ffghdn(file(fptr), out);
    number[0] = out.intValue();
    return FitsioConstants.OK;
  }

  @Override
  public int moveAbsolute(long fptr, int hduNumber, int[] hduType) {
    IntByReference type = new IntByReference();
    IntByReference status = status();
    lib.ffmahd(file(fptr), hduNumber, type, status);
    hduType[0] = type.intValue();
    return status.intValue();
  }

  @Override
  public int moveRelative(long fptr, int offset, int[] hduType) {
    IntByReference type = new IntByReference();
    IntByReference status = status();
    lib.ffmrhd(file(fptr), offset, type, status);
    hduType[0] = type.intValue();
    return status.intValue();
  }

  @Override
  public int moveNamed(long fptr, int hduType, String name, int version) {
    IntByReference status = status();
    lib.ffmnhd(file(fptr), hduType, name, version, status);
    return status.intValue();
  }

  @Override
  public int hduType(long fptr, int[] hduType) {
    IntByReference type = new IntByReference();
    IntByReference status = status();
    lib.ffghdt(file(fptr), type, status);
    hduType[0] = type.intValue();
    return status.intValue();
  }

  @Override
  public int deleteHdu(long fptr, int[] newHduType) {
    IntByReference type = new IntByReference();
    IntByReference status = status();
    lib.ffdhdu(file(fptr), type, status);
    newHduType[0] = type.intValue();
    return status.intValue();
  }

  @Override
  public int copyHdu(long source, long target, int moreKeys) {
    IntByReference status = status();
    lib.ffcopy(file(source), file(target), moreKeys, status);
    return status.intValue();
  }

  @Override
  public int imageEquivalentType(long fptr, int[] bitpix) {
    IntByReference type = new IntByReference();
    IntByReference status = status();
    lib.ffgiet(file(fptr), type, status);
    bitpix[0] = type.intValue();
    return status.intValue();
  }

  @Override
  public int imageDimensionCount(long fptr, int[] naxis) {
    IntByReference out = new IntByReference();
    IntByReference status = status();
    lib.ffgidm(file(fptr), out, status);
    naxis[0] = out.intValue();
    return status.intValue();
  }

  @Override
  public int imageSize(long fptr, int maxDimensions, long[] naxes) {
    Pointer buffer = allocate((long) maxDimensions * Long.BYTES);
    IntByReference status = status();
    lib.ffgiszll(file(fptr), maxDimensions, buffer, status);
    buffer.get(0, naxes, 0, maxDimensions);
    return status.intValue();
  }

  @Override
  public int createImage(long fptr, int bitpix, int naxis, long[] naxes) {
    IntByReference status = status();
    lib.ffcrimll(file(fptr), bitpix, naxis, longLongs(naxes), status);
    return status.intValue();
  }

  @Override
  public int resizeImage(long fptr, int bitpix, int naxis, long[] naxes) {
    IntByReference status = status();
    lib.ffrsimll(file(fptr), bitpix, naxis, longLongs(naxes), status);
    return status.intValue();
  }

  @Override
  public int readPixels(
      long fptr, int datatype, long firstElement, long count, Object array, int[] anyNull) {
    int length = Math.toIntExact(count);
    Pointer buffer = allocate((long) length * elementSize(datatype));
    IntByReference any = new IntByReference();
    IntByReference status = status();
    lib.ffgpv(file(fptr), datatype, firstElement, count, null, buffer, any, status);
    copyOut(datatype, buffer, array, length);
    anyNull[0] = any.intValue();
    return status.intValue();
  }

  @Override
  public int readSubset(
      long fptr, int datatype, long[] firstPixel, long[] lastPixel, long[] increment,
      Object array, int[] anyNull) {
    int length = Array.getLength(array);
    Pointer buffer = allocate((long) length * elementSize(datatype));
    IntByReference any = new IntByReference();
    IntByReference status = status();
    lib.ffgsv(file(fptr), datatype, nativeLongs(firstPixel), nativeLongs(lastPixel),
        nativeLongs(increment), null, buffer, any, status);
    copyOut(datatype, buffer, array, length);
    anyNull[0] = any.intValue();
    return status.intValue();
  }

  @Override
  public int writePixels(long fptr, int datatype, long firstElement, long count, Object array) {
    IntByReference status = status();
    lib.ffppr(file(fptr), datatype, firstElement, count,
        copyIn(datatype, array, Math.toIntExact(count)), status);
    return status.intValue();
  }

  @Override
  public int writeSubset(
      long fptr, int datatype, long[] firstPixel, long[] lastPixel, Object array) {
    int length = Array.getLength(array);
    IntByReference status = status();
    lib.ffpss(file(fptr), datatype, nativeLongs(firstPixel), nativeLongs(lastPixel),
        copyIn(datatype, array, length), status);
    return status.intValue();
  }

  @Override
  public int createTable(
      long fptr, int tableType, long rows, String[] names, String[] forms, String[] units,
      String extname) {
    IntByReference status = status();
    NativeStrings types = NativeStrings.of(rt, names);
    NativeStrings formats = NativeStrings.of(rt, forms);
    NativeStrings physicalUnits = NativeStrings.of(rt, blankNulls(units));
    lib.ffcrtb(file(fptr), tableType, rows, names.length, types.pointer(), formats.pointer(),
        physicalUnits.pointer(), extname, status);
    Reference.reachabilityFence(types);
    Reference.reachabilityFence(formats);
    Reference.reachabilityFence(physicalUnits);
    return status.intValue();
  }

  @Override
  public int numRows(long fptr, long[] rows) {
    LongLongByReference out = new LongLongByReference();
    IntByReference status = status();
    lib.ffgnrwll(file(fptr), out, status);
    rows[0] = out.longValue();
    return status.intValue();
  }

  @Override
  public int numColumns(long fptr, int[] columns) {
    IntByReference out = new IntByReference();
    IntByReference status = status();
    lib.ffgncl(file(fptr), out, status);
    columns[0] = out.intValue();
    return status.intValue();
  }

  @Override
  public int columnNumber(long fptr, int caseSensitivity, String template, int[] column) {
    IntByReference out = new IntByReference();
    IntByReference status = status();
    lib.ffgcno(file(fptr), caseSensitivity, template, out, status);
    column[0] = out.intValue();
    return status.intValue();
  }

  @Override
  public int columnType(long fptr, int column, int[] typecode, long[] repeat, long[] width) {
    IntByReference type = new IntByReference();
    LongLongByReference rep = new LongLongByReference();
    LongLongByReference wid = new LongLongByReference();
    IntByReference status = status();
    lib.ffgtclll(file(fptr), column, type, rep, wid, status);
    typecode[0] = type.intValue();
    repeat[0] = rep.longValue();
    width[0] = wid.longValue();
    return status.intValue();
  }

  @Override
  public int readColumn(
      long fptr, int datatype, int column, long firstRow, long firstElement, long count,
      Object array, byte[] nullFlags, int[] anyNull) {
    int length = Math.toIntExact(count);
    IntByReference status = status();
    Pointer nulls = allocate(length);
    IntByReference any = new IntByReference();
    if (datatype == FitsioConstants.TSTRING) {
      IntByReference width = new IntByReference();
      lib.ffgcdw(file(fptr), column, width, status);
      if (status.intValue() != FitsioConstants.OK) {
        return status.intValue();
      }
      NativeStrings slots = NativeStrings.slots(rt, length, width.intValue() + 1);
      lib.ffgcf(file(fptr), datatype, column, firstRow, firstElement, count, slots.pointer(),
          nulls, any, status);
      slots.copyTo((String[]) array, length);
    } else {
      Pointer buffer = allocate((long) length * elementSize(datatype));
      lib.ffgcf(file(fptr), datatype, column, firstRow, firstElement, count, buffer, nulls, any,
          status);
      copyOut(datatype, buffer, array, length);
    }
    nulls.get(0, nullFlags, 0, length);
    anyNull[0] = any.intValue();
    return status.intValue();
  }

  @Override
  public int writeColumn(
      long fptr, int datatype, int column, long firstRow, long firstElement, long count,
      Object array) {
    IntByReference status = status();
    if (datatype == FitsioConstants.TSTRING) {
      NativeStrings strings = NativeStrings.of(rt, (String[]) array);
      lib.ffpcl(file(fptr), datatype, column, firstRow, firstElement, count, strings.pointer(),
          status);
      Reference.reachabilityFence(strings);
    } else {
      lib.ffpcl(file(fptr), datatype, column, firstRow, firstElement, count,
          copyIn(datatype, array, Math.toIntExact(count)), status);
    }
    return status.intValue();
  }

  @Override
  public int writeColumnNull(long fptr, int column, long firstRow, long firstElement, long count) {
    IntByReference status = status();
    lib.ffpclu(file(fptr), column, firstRow, firstElement, count, status);
    return status.intValue();
  }

  @Override
  public int insertColumn(long fptr, int column, String name, String form) {
    IntByReference status = status();
    lib.fficol(file(fptr), column, name, form, status);
    return status.intValue();
  }

  @Override
  public int deleteColumn(long fptr, int column) {
    IntByReference status = status();
    lib.ffdcol(file(fptr), column, status);
    return status.intValue();
  }

  @Override
  public int insertRows(long fptr, long afterRow, long count) {
    IntByReference status = status();
    lib.ffirow(file(fptr), afterRow, count, status);
    return status.intValue();
  }

  @Override
  public int deleteRows(long fptr, long firstRow, long count) {
    IntByReference status = status();
    lib.ffdrow(file(fptr), firstRow, count, status);
    return status.intValue();
  }

  @Override
  public int readKeyString(long fptr, String keyword, String[] value, String[] comment) {
    Pointer valueBuffer = allocate(FLEN_VALUE);
    Pointer commentBuffer = allocate(FLEN_COMMENT);
    IntByReference status = status();
    lib.ffgkys(file(fptr), keyword, valueBuffer, commentBuffer, status);
    value[0] = valueBuffer.getString(0);
    setComment(comment, commentBuffer);
    return status.intValue();
  }

  @Override
  public int readKeyLong(long fptr, String keyword, long[] value, String[] comment) {
    LongLongByReference out = new LongLongByReference();
    Pointer commentBuffer = allocate(FLEN_COMMENT);
    IntByReference status = status();
    lib.ffgkyjj(file(fptr), keyword, out, commentBuffer, status);
    value[0] = out.longValue();
    setComment(comment, commentBuffer);
    return status.intValue();
  }

  @Override
  public int readKeyDouble(long fptr, String keyword, double[] value, String[] comment) {
    Pointer out = allocate(Double.BYTES);
    Pointer commentBuffer = allocate(FLEN_COMMENT);
    IntByReference status = status();
    lib.ffgkyd(file(fptr), keyword, out, commentBuffer, status);
    value[0] = out.getDouble(0);
    setComment(comment, commentBuffer);
    return status.intValue();
  }

  @Override
  public int readKeyLogical(long fptr, String keyword, int[] value, String[] comment) {
    IntByReference out = new IntByReference();
    Pointer commentBuffer = allocate(FLEN_COMMENT);
    IntByReference status = status();
    lib.ffgkyl(file(fptr), keyword, out, commentBuffer, status);
    value[0] = out.intValue();
    setComment(comment, commentBuffer);
    return status.intValue();
  }

  @Override
  public int updateKeyString(long fptr, String keyword, String value, String comment) {
    IntByReference status = status();
    lib.ffukys(file(fptr), keyword, value, comment, status);
    return status.intValue();
  }

  @Override
  public int updateKeyLong(long fptr, String keyword, long value, String comment) {
    IntByReference status = status();
    lib.ffukyjj(file(fptr), keyword, value, comment, status);
    return status.intValue();
  }

  @Override
  public int updateKeyDouble(
      long fptr, String keyword, double value, int decimals, String comment) {
    IntByReference status = status();
    lib.ffukyd(file(fptr), keyword, value, decimals, comment, status);
    return status.intValue();
  }

  @Override
  public int updateKeyLogical(long fptr, String keyword, boolean value, String comment) {
    IntByReference status = status();
    lib.ffukyl(file(fptr), keyword, value ? 1 : 0, comment, status);
    return status.intValue();
  }

  @Override
  public String errorText(int status) {
    Pointer buffer = allocate(FLEN_STATUS);
    lib.ffgerr(status, buffer);
    return buffer.getString(0);
  }

  @Override
  public List<String> drainMessages() {
    List<String> messages = new ArrayList<>();
    Pointer buffer = allocate(FLEN_ERRMSG);
    while (lib.ffgmsg(buffer) != 0) {
      messages.add(buffer.getString(0).trim());
    }
    return messages;
  }

  @Override
  public void clearMessages() {
    lib.ffcmsg();
  }

  @Override
  public float libraryVersion() {
    return lib.ffvers(allocate(Float.BYTES));
  }

  @Override
  public boolean isReentrant() {
    return lib.fits_is_reentrant() != 0;
  }

  private IntByReference status() {
    return new IntByReference(FitsioConstants.OK);
  }

  private Pointer file(long fptr) {
    return Pointer.wrap(rt, fptr);
  }

  private static long address(Pointer pointer) {
    return pointer == null ? 0L : pointer.address();
  }

  private Pointer allocate(long bytes) {
    return Memory.allocateDirect(rt, Math.toIntExact(Math.max(1, bytes)));
  }

  private Pointer longLongs(long[] values) {
    Pointer buffer = allocate((long) values.length * Long.BYTES);
    buffer.put(0, values, 0, values.length);
    return buffer;
  }

  /** C {@code long} arrays use the platform's native long size. */
  private Pointer nativeLongs(long[] values) {
    int size = rt.longSize();
    Pointer buffer = allocate((long) values.length * size);
    for (int i = 0; i < values.length; i++) {
      buffer.putNativeLong((long) i * size, values[i]);
    }
    return buffer;
  }

  private static String[] blankNulls(String[] values) {
    String[] copy = values.clone();
    for (int i = 0; i < copy.length; i++) {
      if (copy[i] == null) {
        copy[i] = "";
      }
    }
    return copy;
  }

  private static int elementSize(int datatype) {
    return switch (datatype) {
      case FitsioConstants.TBYTE, FitsioConstants.TSBYTE, FitsioConstants.TLOGICAL -> 1;
      case FitsioConstants.TSHORT, FitsioConstants.TUSHORT -> 2;
      case FitsioConstants.TINT, FitsioConstants.TUINT, FitsioConstants.TFLOAT -> 4;
      case FitsioConstants.TLONGLONG, FitsioConstants.TDOUBLE -> 8;
      default -> throw new IllegalArgumentException("unsupported buffer datatype " + datatype);
    };
  }

  private Pointer copyIn(int datatype, Object array, int length) {
    Pointer buffer = allocate((long) length * elementSize(datatype));
    switch (datatype) {
      case FitsioConstants.TBYTE, FitsioConstants.TLOGICAL ->
          buffer.put(0, (byte[]) array, 0, length);
      case FitsioConstants.TSHORT -> buffer.put(0, (short[]) array, 0, length);
      case FitsioConstants.TINT -> buffer.put(0, (int[]) array, 0, length);
      case FitsioConstants.TLONGLONG -> buffer.put(0, (long[]) array, 0, length);
      case FitsioConstants.TFLOAT -> buffer.put(0, (float[]) array, 0, length);
      case FitsioConstants.TDOUBLE -> buffer.put(0, (double[]) array, 0, length);
      default -> throw new IllegalArgumentException("unsupported buffer datatype " + datatype);
    }
    return buffer;
  }

  private void copyOut(int datatype, Pointer buffer, Object array, int length) {
    switch (datatype) {
      case FitsioConstants.TBYTE, FitsioConstants.TLOGICAL ->
          buffer.get(0, (byte[]) array, 0, length);
      case FitsioConstants.TSHORT -> buffer.get(0, (short[]) array, 0, length);
      case FitsioConstants.TINT -> buffer.get(0, (int[]) array, 0, length);
      case FitsioConstants.TLONGLONG -> buffer.get(0, (long[]) array, 0, length);
      case FitsioConstants.TFLOAT -> buffer.get(0, (float[]) array, 0, length);
      case FitsioConstants.TDOUBLE -> buffer.get(0, (double[]) array, 0, length);
      default -> throw new IllegalArgumentException("unsupported buffer datatype " + datatype);
    }
  }

  private static void setComment(String[] comment, Pointer buffer) {
    if (comment != null) {
      comment[0] = buffer.getString(0);
    }
  }
}
