package ca.gc.cra.fitsio.domain;

import ca.gc.cra.fitsio.domain.image.ImageType;
import java.util.List;
import java.util.Objects;

/**
 * Image HDU description.
 *
 * @param pixelType equivalent pixel type (BITPIX after BSCALE/BZERO)
 * @param shape axis lengths in row-major order (slowest-varying axis first)
 */
public record ImageInfo(ImageType pixelType, List<Long> shape) implements HduInfo {

  public ImageInfo {
    Objects.requireNonNull(pixelType, "pixelType");
    shape = List.copyOf(Objects.requireNonNull(shape, "shape"));
  }

  @Override
  public HduType hduType() {
    return HduType.IMAGE;
  }

  /**
   * Total number of pixels; zero for an image without axes.
   *
   * @return product of the axis lengths
   */
  public long pixelCount() {
    if (shape.isEmpty()) {
      return 0;
    }
    long total = 1;
    for (long axis : shape) {
      total = Math.multiplyExact(total, axis);
    }
    return total;
  }
}
