package ca.gc.cra.fitsio.api;

import ca.gc.cra.fitsio.application.dispatch.TypeCodes;
import ca.gc.cra.fitsio.application.file.NativeHandle;
import ca.gc.cra.fitsio.application.hdu.HduCursor;
import ca.gc.cra.fitsio.application.header.HeaderEngine;
import ca.gc.cra.fitsio.application.image.ImageEngine;
import ca.gc.cra.fitsio.application.status.FitsOperation;
import ca.gc.cra.fitsio.application.table.ColumnEngine;
import ca.gc.cra.fitsio.domain.CaseSensitivity;
import ca.gc.cra.fitsio.domain.FileOpenMode;
import ca.gc.cra.fitsio.domain.HduInfo;
import ca.gc.cra.fitsio.domain.HduType;
import ca.gc.cra.fitsio.domain.ImageInfo;
import ca.gc.cra.fitsio.domain.TableInfo;
import ca.gc.cra.fitsio.domain.image.ImageDescription;
import ca.gc.cra.fitsio.domain.table.ColumnDescription;
import ca.gc.cra.fitsio.error.BoundsException;
import ca.gc.cra.fitsio.error.FitsCloseException;
import ca.gc.cra.fitsio.error.FitsException;
import ca.gc.cra.fitsio.error.UncheckedFitsException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> An open FITS file.
 * <p><strong>Why:</strong> Owns the single {@code fitsfile*} of a file and the engines bound to it, so the
 * pointer is closed exactly once and never used afterwards.</p>
 * <p><strong>Indexing:</strong> HDUs are addressed by zero-based index; {@code hdu(0)} is the primary
 * HDU.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe: the current HDU is mutable state shared by every
 * {@link FitsHdu} of the file. Use {@link #threadsafe()} to share a file between threads.</p>
 * <p><strong>Observability:</strong> Lifecycle logs and counters come from the underlying handle.</p>
 *
 * <pre>{@code
 * try (FitsFile file = FitsFile.open(Path.of("obs.fits"))) {
 *   double[] flux = file.hdu("EVENTS").readColumnValues("FLUX", ValueType.DOUBLE, RowRange.of(0, 10));
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public final class FitsFile implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(FitsFile.class);

  private final Fitsio fitsio;
  private final NativeHandle handle;
  private final HeaderEngine headers;
  private final ColumnEngine columns;
  private final ImageEngine images;
  private final HduCursor cursor;
  private ThreadsafeFitsFile shared;

  FitsFile(Fitsio fitsio, NativeHandle handle) {
    this.fitsio = fitsio;
    this.handle = handle;
    this.headers = new HeaderEngine(handle);
    this.columns = new ColumnEngine(handle, headers, fitsio.config().columnCaseSensitivity());
    this.images = new ImageEngine(handle, headers);
    this.cursor = new HduCursor(handle, headers, columns, images);
  }

  /** Opens a file read-only through the shared context. */
  public static FitsFile open(Path path) throws FitsException {
    return Fitsio.shared().open(path);
  }

  /** Opens a file read-write through the shared context. */
  public static FitsFile edit(Path path) throws FitsException {
    return Fitsio.shared().edit(path);
  }

  /** Starts a new file through the shared context. */
  public static NewFitsFile create(Path path) {
    return Fitsio.shared().create(path);
  }

  /**
   * Adopts a pointer opened outside this layer. The file owns the pointer from now on.
   *
   * @param fitsio context of the library that opened the pointer
   * @param pointer non-zero {@code fitsfile*}
   * @param mode mode the pointer was opened with
   * @return file without a source path
   */
  public static FitsFile fromRaw(Fitsio fitsio, long pointer, FileOpenMode mode) {
    NativeHandle handle = NativeHandle.adopt(
        fitsio.nativeLib(), fitsio.translator(), fitsio.metrics(), pointer, mode);
    return new FitsFile(fitsio, handle);
  }

  static NativeHandle openHandle(Fitsio fitsio, Path path, FileOpenMode mode) throws FitsException {
    return NativeHandle.open(fitsio.nativeLib(), fitsio.translator(), fitsio.metrics(), path, mode);
  }

  /**
   * Name of the file as cfitsio reports it.
   *
   * @return file name
   * @throws FitsException when the query fails
   */
  public String filename() throws FitsException {
    String[] name = new String[1];
    handle.translator().check(
        handle.nativeLib().fileName(handle.pointer(), name), FitsOperation.QUERY, "file name");
    return name[0];
  }

  /**
   * Access mode as cfitsio reports it.
   *
   * @return read-only or read-write
   * @throws FitsException when the query fails
   */
  public FileOpenMode openMode() throws FitsException {
    int[] mode = new int[1];
    handle.translator().check(
        handle.nativeLib().fileMode(handle.pointer(), mode), FitsOperation.QUERY, "file mode");
    return TypeCodes.fileOpenMode(mode[0]);
  }

  public Optional<Path> path() {
    return handle.path();
  }

  public float libraryVersion() {
    return fitsio.libraryVersion();
  }

  public boolean isClosed() {
    return handle.isClosed();
  }

  public int numHdus() throws FitsException {
    return cursor.numHdus();
  }

  /**
   * Moves to an HDU by zero-based index.
   *
   * @param index {@code 0..numHdus()-1}
   * @return the HDU, now current
   * @throws FitsException {@code BoundsException} when the index is out of range
   */
  public FitsHdu hdu(int index) throws FitsException {
    if (index < 0) {
      throw new BoundsException("HDU index", BoundsException.NO_AXIS,
          BoundsException.Bound.START, index, 0);
    }
    int count = cursor.numHdus();
    if (index >= count) {
      throw new BoundsException("HDU index", BoundsException.NO_AXIS,
          BoundsException.Bound.END, index, count);
    }
    cursor.moveTo(index + 1);
    return currentHdu();
  }

  /**
   * Moves to the HDU with the given extension name, matched case-insensitively.
   *
   * @param name {@code EXTNAME} or {@code HDUNAME}
   * @return the HDU, now current
   * @throws FitsException when no HDU has that name
   */
  public FitsHdu hdu(String name) throws FitsException {
    return hdu(HduType.ANY, name, CaseSensitivity.CASE_INSENSITIVE, 0);
  }

  /**
   * Moves to the HDU matching type, name and version.
   *
   * @param type HDU type or {@link HduType#ANY}
   * @param name extension name
   * @param sensitivity name matching
   * @param version {@code EXTVER}, {@code 0} for any
   * @return the HDU, now current
   * @throws FitsException when nothing matches; the previous HDU stays current
   */
  public FitsHdu hdu(HduType type, String name, CaseSensitivity sensitivity, int version)
      throws FitsException {
    cursor.moveToName(type, name, sensitivity, version);
    return currentHdu();
  }

  public FitsHdu primaryHdu() throws FitsException {
    return hdu(0);
  }

  /**
   * Describes the HDU the file is positioned on.
   *
   * @return current HDU
   * @throws FitsException when the HDU cannot be described
   */
  public FitsHdu currentHdu() throws FitsException {
    int number = cursor.currentNumber();
    return new FitsHdu(this, number, cursor.describe());
  }

  /**
   * Iterates the HDUs in file order. Each call starts a new pass from the primary HDU; each step
   * moves the file to the HDU it returns.
   *
   * @return lazy, finite iterable
   */
  public Iterable<FitsHdu> hdus() {
    return () -> new Iterator<>() {
      private int next;

      @Override
      public boolean hasNext() {
        try {
          return next < cursor.numHdus();
        } catch (FitsException e) {
          throw new UncheckedFitsException(e);
        }
      }

      @Override
      public FitsHdu next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        try {
          return hdu(next++);
        } catch (FitsException e) {
          throw new UncheckedFitsException(e);
        }
      }
    };
  }

  /**
   * Appends an image extension.
   *
   * @param extname extension name, or {@code null}
   * @param description pixel type and row-major dimensions
   * @return the new HDU, now current
   * @throws FitsException when the file is read-only or cfitsio rejects the image
   */
  public FitsHdu createImage(String extname, ImageDescription description) throws FitsException {
    images.createImage(extname, description);
    return currentHdu();
  }

  /**
   * Appends a binary table with no rows.
   *
   * @param extname extension name, or {@code null}
   * @param columnDescriptions at least one column
   * @return the new HDU, now current
   * @throws FitsException when the file is read-only or cfitsio rejects the definition
   */
  public FitsHdu createTable(String extname, List<ColumnDescription> columnDescriptions)
      throws FitsException {
    columns.createTable(extname, columnDescriptions);
    return currentHdu();
  }

  /**
   * Writes a one-line-per-HDU summary of the file.
   *
   * @param out destination
   * @throws IOException when {@code out} fails
   * @throws FitsException when an HDU cannot be described
   */
  public void prettyPrint(Appendable out) throws IOException, FitsException {
    int count = numHdus();
    out.append("file: ").append(path().map(Path::toString).orElse(handle.describe()))
        .append(" (").append(String.valueOf(count)).append(" HDUs)\n");
    for (int index = 0; index < count; index++) {
      FitsHdu hdu = hdu(index);
      out.append("  ").append(String.valueOf(index)).append(' ')
          .append(hdu.type().name()).append(' ')
          .append(hdu.name().orElse("-")).append(' ')
          .append(summary(hdu.info())).append('\n');
    }
  }

  private static String summary(HduInfo info) {
    if (info instanceof ImageInfo image) {
      return image.pixelType() + " " + image.shape();
    }
    TableInfo table = (TableInfo) info;
    return table.rows() + " rows " + table.columns().stream()
        .map(column -> column.name() + ":" + column.tform())
        .collect(Collectors.joining(", ", "[", "]"));
  }

  /**
   * Wraps this file for use from several threads. Every call returns the same wrapper, so all callers
   * share one lock; once shared, reach the file only through the wrapper.
   *
   * @return wrapper that serializes every call
   * @throws IllegalStateException when cfitsio is not reentrant and the configuration requires it
   */
  public synchronized ThreadsafeFitsFile threadsafe() {
    if (shared != null) {
      return shared;
    }
    if (!fitsio.isReentrant()) {
      if (fitsio.config().requireReentrant()) {
        throw new IllegalStateException(
            "cfitsio " + fitsio.libraryVersion() + " was not built reentrant; "
                + "threadsafe() needs a reentrant build");
      }
      log.warn("cfitsio {} is not reentrant; threadsafe access to {} serializes this file only",
          fitsio.libraryVersion(), handle.describe());
    }
    shared = new ThreadsafeFitsFile(this);
    return shared;
  }

  /**
   * Returns the raw {@code fitsfile*}. Calls made through it bypass every check of this layer and
   * must not close it.
   *
   * @return pointer value
   */
  public long rawPointerUnsafe() {
    return handle.pointer();
  }

  @Override
  public void close() throws FitsCloseException {
    handle.close();
  }

  NativeHandle handle() {
    return handle;
  }

  HduCursor cursor() {
    return cursor;
  }

  HeaderEngine headers() {
    return headers;
  }

  ColumnEngine columns() {
    return columns;
  }

  ImageEngine images() {
    return images;
  }

  @Override
  public String toString() {
    return "FitsFile[" + handle.describe() + ", " + handle.mode() + "]";
  }
}
