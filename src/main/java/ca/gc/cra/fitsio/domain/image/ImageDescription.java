package ca.gc.cra.fitsio.domain.image;

import java.util.List;
import java.util.Objects;

/**
 * Pixel type and row-major dimensions of an image to create.
 *
 * @param type pixel type
 * @param dimensions axis lengths, slowest-varying first; every length at least one
 */
public record ImageDescription(ImageType type, List<Long> dimensions) {
  /** Largest axis count cfitsio accepts. */
  public static final int MAX_AXES = 999;

  public ImageDescription {
    Objects.requireNonNull(type, "type");
    dimensions = List.copyOf(Objects.requireNonNull(dimensions, "dimensions"));
    if (dimensions.isEmpty()) {
      throw new IllegalArgumentException("image needs at least one axis");
    }
    if (dimensions.size() > MAX_AXES) {
      throw new IllegalArgumentException("too many axes: " + dimensions.size());
    }
    for (int i = 0; i < dimensions.size(); i++) {
      if (dimensions.get(i) < 1) {
        throw new IllegalArgumentException("axis " + i + " has non-positive length " + dimensions.get(i));
      }
    }
  }

  public static ImageDescription of(ImageType type, long... dimensions) {
    Long[] boxed = new Long[dimensions.length];
    for (int i = 0; i < dimensions.length; i++) {
      boxed[i] = dimensions[i];
    }
    return new ImageDescription(type, List.of(boxed));
  }

  public long pixelCount() {
    long total = 1;
    for (long axis : dimensions) {
      total = Math.multiplyExact(total, axis);
    }
    return total;
  }
}
