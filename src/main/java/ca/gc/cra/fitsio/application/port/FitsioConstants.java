package ca.gc.cra.fitsio.application.port;

/**
 * Numeric constants of the cfitsio C API (values from {@code fitsio.h}).
 *
 * <p>Only the translation code in the application layer and the native adapters use these; the public
 * API exposes enums instead.</p>
 *
 * @since 0.1.0
 */
public final class FitsioConstants {
  private FitsioConstants() {
    // Constants
  }

  // I/O modes
  public static final int READONLY = 0;
  public static final int READWRITE = 1;

  // HDU types
  public static final int IMAGE_HDU = 0;
  public static final int ASCII_TBL = 1;
  public static final int BINARY_TBL = 2;
  public static final int ANY_HDU = -1;

  // Name matching
  public static final int CASEINSEN = 0;
  public static final int CASESEN = 1;

  // Datatype codes
  public static final int TBIT = 1;
  public static final int TBYTE = 11;
  public static final int TSBYTE = 12;
  public static final int TLOGICAL = 14;
  public static final int TSTRING = 16;
  public static final int TUSHORT = 20;
  public static final int TSHORT = 21;
  public static final int TUINT = 30;
  public static final int TINT = 31;
  public static final int TULONG = 40;
  public static final int TLONG = 41;
  public static final int TFLOAT = 42;
  public static final int TULONGLONG = 80;
  public static final int TLONGLONG = 81;
  public static final int TDOUBLE = 82;
  public static final int TCOMPLEX = 83;
  public static final int TDBLCOMPLEX = 163;

  // Buffer sizes, including the terminating NUL
  public static final int FLEN_FILENAME = 1025;
  public static final int FLEN_KEYWORD = 75;
  public static final int FLEN_VALUE = 71;
  public static final int FLEN_COMMENT = 73;
  public static final int FLEN_ERRMSG = 81;
  public static final int FLEN_STATUS = 31;

  // Status codes
  public static final int OK = 0;
  public static final int FILE_NOT_OPENED = 104;
  public static final int FILE_NOT_CREATED = 105;
  public static final int END_OF_FILE = 107;
  public static final int READONLY_FILE = 112;
  public static final int BAD_FILEPTR = 114;
  public static final int KEY_NO_EXIST = 202;
  public static final int VALUE_UNDEFINED = 204;
  public static final int BAD_BITPIX = 211;
  public static final int BAD_NAXIS = 212;
  public static final int BAD_NAXES = 213;
  public static final int COL_NOT_FOUND = 219;
  public static final int NOT_IMAGE = 233;
  public static final int NOT_TABLE = 235;
  public static final int COL_NOT_UNIQUE = 237;
  public static final int BAD_TFORM = 261;
  public static final int BAD_TFORM_DTYPE = 262;
  public static final int BAD_HDU_NUM = 301;
  public static final int BAD_COL_NUM = 302;
  public static final int BAD_ROW_NUM = 307;
  public static final int BAD_ELEM_NUM = 308;
  public static final int NOT_ASCII_COL = 309;
  public static final int NOT_LOGICAL_COL = 310;
  public static final int BAD_ATABLE_FORMAT = 311;
  public static final int BAD_BTABLE_FORMAT = 312;
  public static final int NO_NULL = 314;
  public static final int BAD_DIMEN = 320;
  public static final int BAD_PIX_NUM = 321;
  public static final int BAD_C2I = 401;
  public static final int BAD_LOGICALKEY = 404;
  public static final int BAD_DATATYPE = 410;
  public static final int NUM_OVERFLOW = 412;
}
