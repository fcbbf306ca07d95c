package ca.gc.cra.fitsio.domain.image;

import java.util.Optional;

/**
 * Pixel type of an image HDU, keyed by its BITPIX code.
 *
 * <p>Codes 10, 20 and 40 are cfitsio's equivalent types for signed bytes and unsigned 16/32-bit
 * integers stored with a BZERO offset.</p>
 */
public enum ImageType {
  UNSIGNED_BYTE(8),
  BYTE(10),
  SHORT(16),
  UNSIGNED_SHORT(20),
  INT(32),
  UNSIGNED_INT(40),
  LONG(64),
  FLOAT(-32),
  DOUBLE(-64);

  private final int bitpix;

  ImageType(int bitpix) {
    this.bitpix = bitpix;
  }

  public int bitpix() {
    return bitpix;
  }

  public boolean isFloatingPoint() {
    return bitpix < 0;
  }

  /**
   * Resolves a BITPIX code.
   *
   * @param bitpix BITPIX or equivalent type code
   * @return matching type, empty for unknown codes
   */
  public static Optional<ImageType> fromBitpix(int bitpix) {
    for (ImageType type : values()) {
      if (type.bitpix == bitpix) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
