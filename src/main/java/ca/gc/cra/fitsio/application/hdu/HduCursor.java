package ca.gc.cra.fitsio.application.hdu;

import ca.gc.cra.fitsio.application.dispatch.TypeCodes;
import ca.gc.cra.fitsio.application.file.NativeHandle;
import ca.gc.cra.fitsio.application.header.HeaderEngine;
import ca.gc.cra.fitsio.application.image.ImageEngine;
import ca.gc.cra.fitsio.application.port.FitsioConstants;
import ca.gc.cra.fitsio.application.port.FitsioNative;
import ca.gc.cra.fitsio.application.status.FitsOperation;
import ca.gc.cra.fitsio.application.status.StatusTranslator;
import ca.gc.cra.fitsio.application.table.ColumnEngine;
import ca.gc.cra.fitsio.domain.CaseSensitivity;
import ca.gc.cra.fitsio.domain.HduInfo;
import ca.gc.cra.fitsio.domain.HduType;
import ca.gc.cra.fitsio.domain.ImageInfo;
import ca.gc.cra.fitsio.domain.TableInfo;
import ca.gc.cra.fitsio.domain.header.KeyType;
import ca.gc.cra.fitsio.domain.table.TableKind;
import ca.gc.cra.fitsio.error.FitsException;
import ca.gc.cra.fitsio.validation.Numbers;
import ca.gc.cra.fitsio.validation.Strings;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> The current-HDU state of one open file.
 * <p><strong>Why:</strong> cfitsio keeps a single "current HDU" per {@code fitsfile*} and every data
 * call acts on it. The cursor is the only component that moves it, and a failed move puts the cursor
 * back where it was so a later call never acts on an unexpected HDU.</p>
 * <p><strong>Numbering:</strong> HDU numbers here are cfitsio's, {@code 1..numHdus()}; the public API
 * converts from zero-based indices.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe.</p>
 * <p><strong>Observability:</strong> DEBUG logs for moves and restores.</p>
 *
 * @since 0.1.0
 */
public final class HduCursor {
  private static final Logger log = LoggerFactory.getLogger(HduCursor.class);

  private final NativeHandle handle;
  private final HeaderEngine headers;
  private final ColumnEngine columns;
  private final ImageEngine images;

  public HduCursor(
      NativeHandle handle, HeaderEngine headers, ColumnEngine columns, ImageEngine images) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.headers = Objects.requireNonNull(headers, "headers");
    this.columns = Objects.requireNonNull(columns, "columns");
    this.images = Objects.requireNonNull(images, "images");
  }

  public int numHdus() throws FitsException {
    int[] count = new int[1];
    translator().check(lib().numHdus(handle.pointer(), count), FitsOperation.QUERY, "HDU count");
    return count[0];
  }

  public int currentNumber() throws FitsException {
    int[] number = new int[1];
    translator().check(
        lib().currentHdu(handle.pointer(), number), FitsOperation.QUERY, "current HDU");
    return number[0];
  }

  /**
   * Moves to an absolute HDU number.
   *
   * @param number one-based HDU number
   * @return type of the new current HDU
   * @throws FitsException when cfitsio cannot move; the previous position is restored
   */
  public HduType moveTo(int number) throws FitsException {
    Numbers.requireRange("HDU number", number, 1, Integer.MAX_VALUE);
    int prior = currentNumber();
    int[] type = new int[1];
    int status = lib().moveAbsolute(handle.pointer(), number, type);
    Optional<FitsException> failure =
        translator().failure(status, FitsOperation.MOVE, "HDU " + number);
    if (failure.isPresent()) {
      restore(prior, failure.get());
      throw failure.get();
    }
    log.debug("Moved from HDU {} to HDU {} in {}", prior, number, handle.describe());
    return TypeCodes.hduType(type[0]);
  }

  /**
   * Moves to the next HDU.
   *
   * @return type of the new current HDU, empty when the cursor is on the last HDU
   * @throws FitsException when cfitsio cannot move; the previous position is restored
   */
  public Optional<HduType> next() throws FitsException {
    int prior = currentNumber();
    if (prior >= numHdus()) {
      return Optional.empty();
    }
    int[] type = new int[1];
    int status = lib().moveRelative(handle.pointer(), 1, type);
    Optional<FitsException> failure =
        translator().failure(status, FitsOperation.MOVE, "HDU after " + prior);
    if (failure.isPresent()) {
      restore(prior, failure.get());
      throw failure.get();
    }
    return Optional.of(TypeCodes.hduType(type[0]));
  }

  /**
   * Moves to the HDU whose {@code EXTNAME} (or {@code HDUNAME}) matches.
   *
   * <p>Case-insensitive searches use cfitsio's own lookup. Case-sensitive searches scan the HDUs and
   * compare the names exactly, because cfitsio only matches case-insensitively.</p>
   *
   * @param type HDU type to match, or {@link HduType#ANY}
   * @param name extension name
   * @param sensitivity name matching policy
   * @param version {@code EXTVER} to match, {@code 0} for any
   * @return one-based number of the new current HDU
   * @throws FitsException when no HDU matches; the previous position is restored
   */
  public int moveToName(HduType type, String name, CaseSensitivity sensitivity, int version)
      throws FitsException {
    Objects.requireNonNull(type, "type");
    String extname = Strings.requireNonBlank("HDU name", name);
    Numbers.requireNonNegative("version", version);
    int prior = currentNumber();
    if (sensitivity == CaseSensitivity.CASE_SENSITIVE) {
      return scanExact(prior, type, extname, version);
    }
    int status = lib().moveNamed(handle.pointer(), TypeCodes.hduTypeCode(type), extname, version);
    Optional<FitsException> failure =
        translator().failure(status, FitsOperation.MOVE, "HDU " + extname);
    if (failure.isPresent()) {
      restore(prior, failure.get());
      throw failure.get();
    }
    int number = currentNumber();
    log.debug("Moved to HDU {} ({}) in {}", number, extname, handle.describe());
    return number;
  }

  public HduType hduType() throws FitsException {
    int[] type = new int[1];
    translator().check(lib().hduType(handle.pointer(), type), FitsOperation.QUERY, "HDU type");
    return TypeCodes.hduType(type[0]);
  }

  /**
   * Extension name of the current HDU.
   *
   * @return {@code EXTNAME}, empty when the keyword is not set
   * @throws FitsException when the header cannot be read
   */
  public Optional<String> hduName() throws FitsException {
    return headers.readOptional("EXTNAME", KeyType.STRING);
  }

  /**
   * Derives the structural description of the current HDU.
   *
   * @return image or table description
   * @throws FitsException when a query fails or the HDU holds an unsupported type
   */
  public HduInfo describe() throws FitsException {
    HduType type = hduType();
    if (type == HduType.IMAGE) {
      return new ImageInfo(images.pixelType(), images.dimensions());
    }
    TableKind kind = type == HduType.ASCII_TABLE ? TableKind.ASCII : TableKind.BINARY;
    return new TableInfo(kind, columns.describeColumns(), columns.numRows());
  }

  /**
   * Deletes the current HDU; cfitsio then makes the following HDU current, or the preceding one when
   * the last HDU was deleted. Deleting the primary HDU replaces it with an empty primary array.
   *
   * @throws FitsException when the handle is read-only or cfitsio fails
   */
  public void delete() throws FitsException {
    handle.requireWritable("HDU");
    int number = currentNumber();
    int[] newType = new int[1];
    translator().check(
        lib().deleteHdu(handle.pointer(), newType), FitsOperation.STRUCTURE, "HDU " + number);
    log.debug("Deleted HDU {} of {}", number, handle.describe());
  }

  /**
   * Appends a copy of the current HDU to another open file.
   *
   * @param target destination file, open read-write
   * @throws FitsException when the destination is read-only or cfitsio fails
   */
  public void copyTo(NativeHandle target) throws FitsException {
    Objects.requireNonNull(target, "target");
    target.requireWritable(target.describe());
    translator().check(
        lib().copyHdu(handle.pointer(), target.pointer(), 0),
        FitsOperation.STRUCTURE,
        "copy of HDU " + currentNumber() + " to " + target.describe());
  }

  private int scanExact(int prior, HduType type, String extname, int version)
      throws FitsException {
    int count = numHdus();
    try {
      for (int number = 1; number <= count; number++) {
        HduType candidate = moveTo(number);
        if (type != HduType.ANY && candidate != type) {
          continue;
        }
        boolean named = extname.equals(hduName().orElse(null))
            || extname.equals(headers.readOptional("HDUNAME", KeyType.STRING).orElse(null));
        long extver = headers.readOptional("EXTVER", KeyType.LONG).orElse(1L);
        if (named && (version == 0 || extver == version)) {
          log.debug("Moved to HDU {} ({}, case-sensitive) in {}", number, extname,
              handle.describe());
          return number;
        }
      }
    } catch (FitsException e) {
      restore(prior, e);
      throw e;
    }
    FitsException missing = translator().translate(
        FitsioConstants.BAD_HDU_NUM, FitsOperation.MOVE, "HDU " + extname + " (case-sensitive)");
    restore(prior, missing);
    throw missing;
  }

  private void restore(int prior, FitsException failure) {
    if (prior < 1) {
      return;
    }
    int[] type = new int[1];
    int status = lib().moveAbsolute(handle.pointer(), prior, type);
    translator().failure(status, FitsOperation.MOVE, "HDU " + prior).ifPresentOrElse(
        restoreFailure -> {
          log.warn("Could not restore HDU {} of {}", prior, handle.describe());
          failure.addSuppressed(restoreFailure);
        },
        () -> log.debug("Restored HDU {} of {} after failed move", prior, handle.describe()));
  }

  private FitsioNative lib() {
    return handle.nativeLib();
  }

  private StatusTranslator translator() {
    return handle.translator();
  }
}
