package ca.gc.cra.fitsio.application.file;

import ca.gc.cra.fitsio.application.dispatch.TypeCodes;
import ca.gc.cra.fitsio.application.port.FitsioNative;
import ca.gc.cra.fitsio.application.port.MetricsPort;
import ca.gc.cra.fitsio.application.status.FitsOperation;
import ca.gc.cra.fitsio.application.status.StatusTranslator;
import ca.gc.cra.fitsio.domain.FileOpenMode;
import ca.gc.cra.fitsio.error.FitsCloseException;
import ca.gc.cra.fitsio.error.FitsException;
import ca.gc.cra.fitsio.error.FitsOpenException;
import ca.gc.cra.fitsio.error.FitsStatusException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Owner of one cfitsio {@code fitsfile*}.
 * <p><strong>Why:</strong> Every native call needs the pointer; routing access through
 * {@link #pointer()} guarantees no call is issued after {@link #close()}.</p>
 * <p><strong>Lifecycle:</strong> Created by {@link #open}, {@link #create} or {@link #adopt}; the
 * native close runs exactly once, on the first {@link #close()}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe apart from the close flag; callers serialize
 * access (see {@code ThreadsafeFitsFile}).</p>
 * <p><strong>Observability:</strong> Counters {@code fitsio.file.opened}, {@code fitsio.file.created}
 * and {@code fitsio.file.closed}; INFO logs for each transition.</p>
 *
 * @since 0.1.0
 */
public final class NativeHandle {
  private static final Logger log = LoggerFactory.getLogger(NativeHandle.class);
  /** cfitsio's clobber prefix: create over an existing file. */
  static final String OVERWRITE_MARKER = "!";

  private final FitsioNative nativeLib;
  private final StatusTranslator translator;
  private final MetricsPort metrics;
  private final Path path;
  private final FileOpenMode mode;
  private final long pointer;
  private final AtomicBoolean closed = new AtomicBoolean();

  private NativeHandle(
      FitsioNative nativeLib,
      StatusTranslator translator,
      MetricsPort metrics,
      Path path,
      FileOpenMode mode,
      long pointer) {
    this.nativeLib = nativeLib;
    this.translator = translator;
    this.metrics = metrics;
    this.path = path;
    this.mode = mode;
    this.pointer = pointer;
  }

  /**
   * Opens an existing file.
   *
   * @param nativeLib native port
   * @param translator status translator
   * @param metrics metrics sink
   * @param path file to open; must exist
   * @param mode access mode
   * @return open handle
   * @throws FitsOpenException when the path does not exist or cfitsio cannot open it
   */
  public static NativeHandle open(
      FitsioNative nativeLib,
      StatusTranslator translator,
      MetricsPort metrics,
      Path path,
      FileOpenMode mode)
      throws FitsException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mode, "mode");
    if (!Files.exists(path)) {
      throw new FitsOpenException("open file failed for " + path + ": no such file");
    }
    long[] fptr = new long[1];
    translator.check(
        nativeLib.openFile(fptr, path.toString(), TypeCodes.ioMode(mode)),
        FitsOperation.OPEN,
        path.toString());
    metrics.increment("fitsio.file.opened");
    log.info("Opened FITS file {} ({})", path, mode);
    return new NativeHandle(nativeLib, translator, metrics, path, mode, fptr[0]);
  }

  /**
   * Creates a new, empty file; the caller writes the primary HDU.
   *
   * @param nativeLib native port
   * @param translator status translator
   * @param metrics metrics sink
   * @param path file to create
   * @param overwrite replace an existing file through cfitsio's {@code !} prefix
   * @return read-write handle positioned before any HDU
   * @throws FitsException {@code FitsCreateException} when the file exists and overwrite is off, or
   *     cfitsio cannot create it
   */
  public static NativeHandle create(
      FitsioNative nativeLib,
      StatusTranslator translator,
      MetricsPort metrics,
      Path path,
      boolean overwrite)
      throws FitsException {
    Objects.requireNonNull(path, "path");
    String target = overwrite ? OVERWRITE_MARKER + path : path.toString();
    long[] fptr = new long[1];
    translator.check(nativeLib.createFile(fptr, target), FitsOperation.CREATE, path.toString());
    metrics.increment("fitsio.file.created");
    log.info("Created FITS file {}{}", path, overwrite ? " (overwrite)" : "");
    return new NativeHandle(nativeLib, translator, metrics, path, FileOpenMode.READ_WRITE, fptr[0]);
  }

  /**
   * Takes ownership of a pointer opened outside this layer. The pointer is closed with the handle.
   *
   * @param nativeLib native port
   * @param translator status translator
   * @param metrics metrics sink
   * @param pointer non-zero {@code fitsfile*}
   * @param mode mode the pointer was opened with
   * @return handle without a source path
   */
  public static NativeHandle adopt(
      FitsioNative nativeLib,
      StatusTranslator translator,
      MetricsPort metrics,
      long pointer,
      FileOpenMode mode) {
    if (pointer == 0) {
      throw new IllegalArgumentException("pointer must not be null");
    }
    log.debug("Adopted raw FITS pointer 0x{}", Long.toHexString(pointer));
    return new NativeHandle(
        nativeLib, translator, metrics, null, Objects.requireNonNull(mode, "mode"), pointer);
  }

  /**
   * Returns the live pointer.
   *
   * @return {@code fitsfile*}
   * @throws IllegalStateException after {@link #close()}
   */
  public long pointer() {
    if (closed.get()) {
      throw new IllegalStateException("FITS file " + describe() + " is closed");
    }
    return pointer;
  }

  public Optional<Path> path() {
    return Optional.ofNullable(path);
  }

  public FileOpenMode mode() {
    return mode;
  }

  public boolean isClosed() {
    return closed.get();
  }

  public FitsioNative nativeLib() {
    return nativeLib;
  }

  public StatusTranslator translator() {
    return translator;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Fails before any native call when the handle was opened read-only.
   *
   * @param target what the caller is about to modify
   * @throws FitsStatusException with status {@code READONLY_FILE}
   */
  public void requireWritable(String target) throws FitsStatusException {
    if (!mode.isWritable()) {
      throw translator.readOnly(target);
    }
  }

  /**
   * Closes the pointer on the first call; later calls do nothing.
   *
   * @throws FitsCloseException when cfitsio reports a failure; the handle is closed regardless
   */
  public void close() throws FitsCloseException {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    int status = nativeLib.closeFile(pointer);
    metrics.increment("fitsio.file.closed");
    translator.checkClose(status, describe());
    log.info("Closed FITS file {}", describe());
  }

  /**
   * Closes while another failure is propagating; a close failure is attached as suppressed.
   *
   * @param failure the failure being propagated
   */
  public void closeAfterFailure(Exception failure) {
    try {
      close();
    } catch (FitsCloseException e) {
      log.warn("Close of {} failed while handling an earlier error", describe(), e);
      failure.addSuppressed(e);
    }
  }

  /**
   * Human-readable identity for messages.
   *
   * @return the path, or the pointer value for adopted handles
   */
  public String describe() {
    return path != null ? path.toString() : "raw:0x" + Long.toHexString(pointer);
  }
}
