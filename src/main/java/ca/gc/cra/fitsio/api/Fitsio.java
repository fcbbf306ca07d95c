package ca.gc.cra.fitsio.api;

import ca.gc.cra.fitsio.application.port.FitsioNative;
import ca.gc.cra.fitsio.application.port.MetricsPort;
import ca.gc.cra.fitsio.application.status.StatusTranslator;
import ca.gc.cra.fitsio.config.FitsioConfig;
import ca.gc.cra.fitsio.config.FitsioPropertiesLoader;
import ca.gc.cra.fitsio.domain.FileOpenMode;
import ca.gc.cra.fitsio.error.FitsException;
import ca.gc.cra.fitsio.infrastructure.cfitsio.JnrFitsioNative;
import ca.gc.cra.fitsio.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import java.nio.file.Path;
import java.util.Objects;

/**
 * <strong>What:</strong> Entry context binding configuration, the native port and the metrics port.
 * <p><strong>Why:</strong> One place wires the cfitsio binding to the engines, so tests can substitute the
 * native port while applications use the shared, lazily loaded default.</p>
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Load {@code fitsio.properties} and the native library on first use of {@link #shared()}.</li>
 *   <li>Open, edit and create files as {@link FitsFile} handles.</li>
 *   <li>Report the library version and reentrancy.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; handles created from it are not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class Fitsio {
  private static volatile Fitsio shared;

  private final FitsioNative nativeLib;
  private final FitsioConfig config;
  private final MetricsPort metrics;
  private final StatusTranslator translator;

  private Fitsio(FitsioNative nativeLib, FitsioConfig config, MetricsPort metrics) {
    this.nativeLib = Objects.requireNonNull(nativeLib, "nativeLib");
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.translator = new StatusTranslator(nativeLib, metrics);
  }

  /**
   * Returns the process-wide context, loading configuration and cfitsio on the first call.
   *
   * @return shared context
   * @throws UnsatisfiedLinkError when cfitsio cannot be loaded
   */
  public static Fitsio shared() {
    Fitsio current = shared;
    if (current == null) {
      synchronized (Fitsio.class) {
        current = shared;
        if (current == null) {
          current = create(FitsioPropertiesLoader.loadDefault());
          shared = current;
        }
      }
    }
    return current;
  }

  /**
   * Loads cfitsio as configured.
   *
   * @param config settings
   * @return context over the real library
   */
  public static Fitsio create(FitsioConfig config) {
    MetricsPort metrics =
        config.metricsEnabled() ? OpenTelemetryMetricsAdapter.global() : MetricsPort.NO_OP;
    return new Fitsio(JnrFitsioNative.load(config), config, metrics);
  }

  public static Fitsio using(FitsioNative nativeLib) {
    return new Fitsio(nativeLib, FitsioConfig.defaults(), MetricsPort.NO_OP);
  }

  public static Fitsio using(FitsioNative nativeLib, FitsioConfig config, MetricsPort metrics) {
    return new Fitsio(nativeLib, config, metrics);
  }

  /** Opens an existing file read-only. */
  public FitsFile open(Path path) throws FitsException {
    return open(path, FileOpenMode.READ_ONLY);
  }

  /** Opens an existing file read-write. */
  public FitsFile edit(Path path) throws FitsException {
    return open(path, FileOpenMode.READ_WRITE);
  }

  /**
   * Opens an existing file.
   *
   * @param path file to open
   * @param mode access mode
   * @return open file positioned on the primary HDU
   * @throws FitsException {@code FitsOpenException} when the path is missing or cfitsio cannot open it
   */
  public FitsFile open(Path path, FileOpenMode mode) throws FitsException {
    return new FitsFile(this, FitsFile.openHandle(this, path, mode));
  }

  /**
   * Starts building a new file; nothing touches the disk until {@link NewFitsFile#open()}.
   *
   * @param path file to create
   * @return builder
   */
  public NewFitsFile create(Path path) {
    return new NewFitsFile(this, path);
  }

  /**
   * Creates a file with an empty primary HDU.
   *
   * @param path file to create
   * @param overwrite replace an existing file
   * @return read-write file
   * @throws FitsException {@code FitsCreateException} when the file exists and {@code overwrite} is off
   */
  public FitsFile create(Path path, boolean overwrite) throws FitsException {
    NewFitsFile builder = create(path);
    if (overwrite) {
      builder.overwrite();
    }
    return builder.open();
  }

  /**
   * Adopts a pointer opened outside this layer; it is closed with the returned file.
   *
   * @param pointer non-zero {@code fitsfile*}
   * @param mode mode the pointer was opened with
   * @return file owning the pointer
   */
  public FitsFile fromRaw(long pointer, FileOpenMode mode) {
    return FitsFile.fromRaw(this, pointer, mode);
  }

  public float libraryVersion() {
    return nativeLib.libraryVersion();
  }

  public boolean isReentrant() {
    return nativeLib.isReentrant();
  }

  public FitsioConfig config() {
    return config;
  }

  FitsioNative nativeLib() {
    return nativeLib;
  }

  MetricsPort metrics() {
    return metrics;
  }

  StatusTranslator translator() {
    return translator;
  }
}
