package ca.gc.cra.fitsio.application.image;

import java.util.Arrays;

/**
 * Inclusive one-based pixel box in cfitsio axis order (fastest axis first), as {@code ffgsv} and
 * {@code ffpss} expect it.
 *
 * @param firstPixel lower corner
 * @param lastPixel upper corner
 */
public record LibraryRegion(long[] firstPixel, long[] lastPixel) {

  public LibraryRegion {
    if (firstPixel.length != lastPixel.length) {
      throw new IllegalArgumentException("corner ranks differ");
    }
    firstPixel = firstPixel.clone();
    lastPixel = lastPixel.clone();
  }

  @Override
  public long[] firstPixel() {
    return firstPixel.clone();
  }

  @Override
  public long[] lastPixel() {
    return lastPixel.clone();
  }

  public int rank() {
    return firstPixel.length;
  }

  /** Unit step along every axis. */
  public long[] unitIncrement() {
    long[] increment = new long[firstPixel.length];
    Arrays.fill(increment, 1L);
    return increment;
  }

  public long pixelCount() {
    long total = 1;
    for (int i = 0; i < firstPixel.length; i++) {
      total = Math.multiplyExact(total, lastPixel[i] - firstPixel[i] + 1);
    }
    return total;
  }
}
