package ca.gc.cra.fitsio.application.dispatch;

import static ca.gc.cra.fitsio.application.port.FitsioConstants.ANY_HDU;
import static ca.gc.cra.fitsio.application.port.FitsioConstants.ASCII_TBL;
import static ca.gc.cra.fitsio.application.port.FitsioConstants.BINARY_TBL;
import static ca.gc.cra.fitsio.application.port.FitsioConstants.CASEINSEN;
import static ca.gc.cra.fitsio.application.port.FitsioConstants.CASESEN;
import static ca.gc.cra.fitsio.application.port.FitsioConstants.IMAGE_HDU;
import static ca.gc.cra.fitsio.application.port.FitsioConstants.READONLY;
import static ca.gc.cra.fitsio.application.port.FitsioConstants.READWRITE;

import ca.gc.cra.fitsio.application.port.FitsioConstants;
import ca.gc.cra.fitsio.domain.CaseSensitivity;
import ca.gc.cra.fitsio.domain.FileOpenMode;
import ca.gc.cra.fitsio.domain.HduType;
import ca.gc.cra.fitsio.domain.ValueKind;
import ca.gc.cra.fitsio.domain.ValueType;
import ca.gc.cra.fitsio.domain.image.ImageType;
import ca.gc.cra.fitsio.domain.table.ColumnDataType;
import ca.gc.cra.fitsio.domain.table.ColumnDescription;
import ca.gc.cra.fitsio.error.TypeMismatchException;
import java.util.List;
import java.util.Locale;

/**
 * <strong>What:</strong> Fixed mapping between Java-side enums and cfitsio's integer codes, plus the
 * compatibility rules checked before data crosses the native boundary.
 * <p><strong>Why:</strong> cfitsio accepts any datatype code for any column and converts silently where
 * it can; the access layer instead rejects incompatible requests up front with a
 * {@link TypeMismatchException} naming both types.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class TypeCodes {
  private TypeCodes() {
    // Utility
  }

  /**
   * cfitsio datatype code for a Java value kind.
   *
   * @param kind value kind
   * @return {@code TBYTE}, {@code TSHORT}, ...
   */
  public static int datatype(ValueKind kind) {
    return switch (kind) {
      case BYTE -> FitsioConstants.TBYTE;
      case SHORT -> FitsioConstants.TSHORT;
      case INT -> FitsioConstants.TINT;
      case LONG -> FitsioConstants.TLONGLONG;
      case FLOAT -> FitsioConstants.TFLOAT;
      case DOUBLE -> FitsioConstants.TDOUBLE;
      case LOGICAL -> FitsioConstants.TLOGICAL;
      case STRING -> FitsioConstants.TSTRING;
    };
  }

  /**
   * Resolves the column type code reported by {@code ffgtclll}.
   *
   * @param typecode cfitsio type code
   * @param column column name for diagnostics
   * @return declared column type
   * @throws TypeMismatchException for complex, variable-length or unknown codes
   */
  public static ColumnDataType columnType(int typecode, String column)
      throws TypeMismatchException {
    return switch (typecode) {
      case FitsioConstants.TBIT -> ColumnDataType.BIT;
      case FitsioConstants.TBYTE, FitsioConstants.TSBYTE -> ColumnDataType.BYTE;
      case FitsioConstants.TLOGICAL -> ColumnDataType.LOGICAL;
      case FitsioConstants.TSTRING -> ColumnDataType.STRING;
      case FitsioConstants.TSHORT, FitsioConstants.TUSHORT -> ColumnDataType.SHORT;
      case FitsioConstants.TINT, FitsioConstants.TLONG, FitsioConstants.TUINT -> ColumnDataType.INT;
      case FitsioConstants.TLONGLONG, FitsioConstants.TULONG -> ColumnDataType.LONG;
      case FitsioConstants.TFLOAT -> ColumnDataType.FLOAT;
      case FitsioConstants.TDOUBLE -> ColumnDataType.DOUBLE;
      default -> throw new TypeMismatchException(
          "column " + column + " has unsupported type code " + typecode, 0, List.of());
    };
  }

  /**
   * Resolves an equivalent BITPIX code.
   *
   * @param bitpix code from {@code ffgiet}
   * @return image type
   * @throws TypeMismatchException for unknown codes
   */
  public static ImageType imageType(int bitpix) throws TypeMismatchException {
    return ImageType.fromBitpix(bitpix)
        .orElseThrow(() -> new TypeMismatchException(
            "unsupported image BITPIX " + bitpix, 0, List.of()));
  }

  public static HduType hduType(int code) {
    return switch (code) {
      case IMAGE_HDU -> HduType.IMAGE;
      case ASCII_TBL -> HduType.ASCII_TABLE;
      case BINARY_TBL -> HduType.BINARY_TABLE;
      default -> throw new IllegalStateException("unknown HDU type code " + code);
    };
  }

  public static int hduTypeCode(HduType type) {
    return switch (type) {
      case IMAGE -> IMAGE_HDU;
      case ASCII_TABLE -> ASCII_TBL;
      case BINARY_TABLE -> BINARY_TBL;
      case ANY -> ANY_HDU;
    };
  }

  public static int ioMode(FileOpenMode mode) {
    return mode == FileOpenMode.READ_WRITE ? READWRITE : READONLY;
  }

  public static FileOpenMode fileOpenMode(int ioMode) {
    return ioMode == READWRITE ? FileOpenMode.READ_WRITE : FileOpenMode.READ_ONLY;
  }

  public static int caseSensitivity(CaseSensitivity sensitivity) {
    return sensitivity == CaseSensitivity.CASE_SENSITIVE ? CASESEN : CASEINSEN;
  }

  /**
   * Rejects a value type that cannot be exchanged with a column.
   *
   * <p>Strings only with string columns; logical values with logical or bit columns; numeric types
   * with numeric or bit columns.</p>
   *
   * @param column declared column
   * @param requested requested value type
   * @throws TypeMismatchException when incompatible
   */
  public static void requireColumnCompatible(ColumnDescription column, ValueType<?> requested)
      throws TypeMismatchException {
    ColumnDataType declared = column.type();
    boolean compatible = switch (requested.kind()) {
      case STRING -> declared == ColumnDataType.STRING;
      case LOGICAL -> declared == ColumnDataType.LOGICAL || declared == ColumnDataType.BIT;
      case BYTE, SHORT, INT, LONG, FLOAT, DOUBLE ->
          declared.isNumeric() || declared == ColumnDataType.BIT;
    };
    if (!compatible) {
      throw new TypeMismatchException(
          "column " + column.name(), declared.name().toLowerCase(Locale.ROOT),
          requested.toString());
    }
  }

  /**
   * Rejects non-numeric value types for image data.
   *
   * @param target HDU description for diagnostics
   * @param pixelType declared pixel type
   * @param requested requested value type
   * @throws TypeMismatchException for logical and string requests
   */
  public static void requireImageCompatible(
      String target, ImageType pixelType, ValueType<?> requested) throws TypeMismatchException {
    if (!requested.kind().isNumeric()) {
      throw new TypeMismatchException(
          target, pixelType.name().toLowerCase(Locale.ROOT), requested.toString());
    }
  }
}
