package ca.gc.cra.fitsio.api;

import ca.gc.cra.fitsio.application.file.NativeHandle;
import ca.gc.cra.fitsio.domain.image.ImageDescription;
import ca.gc.cra.fitsio.error.FitsException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Builder for a new FITS file.
 *
 * <p>The file gets an empty primary array ({@code BITPIX = 8}, {@code NAXIS = 0}) unless
 * {@link #withPrimaryImage(ImageDescription)} supplies one. When writing the primary HDU fails the
 * half-built file is closed before the error propagates.</p>
 *
 * @since 0.1.0
 */
public final class NewFitsFile {
  private final Fitsio fitsio;
  private final Path path;
  private boolean overwrite;
  private ImageDescription primary;

  NewFitsFile(Fitsio fitsio, Path path) {
    this.fitsio = Objects.requireNonNull(fitsio, "fitsio");
    this.path = Objects.requireNonNull(path, "path");
  }

  /** Replaces an existing file at the path. */
  public NewFitsFile overwrite() {
    this.overwrite = true;
    return this;
  }

  public NewFitsFile withPrimaryImage(ImageDescription description) {
    this.primary = Objects.requireNonNull(description, "description");
    return this;
  }

  /**
   * Creates the file and writes its primary HDU.
   *
   * @return read-write file positioned on the primary HDU
   * @throws FitsException {@code FitsCreateException} when the file exists without overwrite or cfitsio
   *     cannot create it; the library failure when the primary HDU cannot be written
   */
  public FitsFile open() throws FitsException {
    NativeHandle handle = NativeHandle.create(
        fitsio.nativeLib(), fitsio.translator(), fitsio.metrics(), path, overwrite);
    FitsFile file = new FitsFile(fitsio, handle);
    try {
      if (primary == null) {
        file.images().createEmptyPrimary();
      } else {
        file.images().createImage(null, primary);
      }
    } catch (FitsException | RuntimeException e) {
      handle.closeAfterFailure(e);
      throw e;
    }
    return file;
  }
}
