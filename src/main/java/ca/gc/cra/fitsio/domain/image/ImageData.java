package ca.gc.cra.fitsio.domain.image;

import ca.gc.cra.fitsio.domain.ValueType;
import java.lang.reflect.Array;
import java.util.Arrays;
import java.util.Objects;

/**
 * Dense row-major N-dimensional array of pixels.
 *
 * <p>The last axis varies fastest, so the flat index of {@code (i0, i1, ..., in)} is
 * {@code ((i0 * s1 + i1) * s2 + ...) + in}.</p>
 *
 * @param <A> Java array type of the flat storage
 * @since 0.1.0
 */
public final class ImageData<A> {
  private final ValueType<A> type;
  private final int[] shape;
  private final A data;

  /**
   * Wraps flat storage.
   *
   * @param type value type of {@code data}
   * @param shape row-major axis lengths
   * @param data flat pixels; length must equal the product of {@code shape}
   */
  public ImageData(ValueType<A> type, int[] shape, A data) {
    this.type = Objects.requireNonNull(type, "type");
    this.shape = shape.clone();
    this.data = Objects.requireNonNull(data, "data");
    long expected = 1;
    for (int axis : this.shape) {
      if (axis < 0) {
        throw new IllegalArgumentException("negative axis length in " + Arrays.toString(shape));
      }
      expected *= axis;
    }
    if (this.shape.length == 0) {
      expected = 0;
    }
    if (type.length(data) != expected) {
      throw new IllegalArgumentException(
          "data length " + type.length(data) + " does not match shape " + Arrays.toString(shape));
    }
  }

  public ValueType<A> type() {
    return type;
  }

  public int[] shape() {
    return shape.clone();
  }

  public int rank() {
    return shape.length;
  }

  /** Flat storage, not copied. */
  public A data() {
    return data;
  }

  public int size() {
    return type.length(data);
  }

  /**
   * Flat index of a coordinate.
   *
   * @param coordinates one index per axis, row-major
   * @return flat index into {@link #data()}
   */
  public int index(int... coordinates) {
    if (coordinates.length != shape.length) {
      throw new IllegalArgumentException(
          "expected " + shape.length + " coordinates, got " + coordinates.length);
    }
    int flat = 0;
    for (int axis = 0; axis < shape.length; axis++) {
      flat = flat * shape[axis] + Objects.checkIndex(coordinates[axis], shape[axis]);
    }
    return flat;
  }

  public Object get(int... coordinates) {
    return Array.get(data, index(coordinates));
  }

  /**
   * Numeric pixel value widened to {@code double}; BYTE pixels are read unsigned.
   *
   * @param coordinates one index per axis
   * @return pixel value
   */
  public double getDouble(int... coordinates) {
    int flat = index(coordinates);
    return switch (type.kind()) {
      case BYTE -> Byte.toUnsignedInt(((byte[]) data)[flat]);
      case SHORT -> ((short[]) data)[flat];
      case INT -> ((int[]) data)[flat];
      case LONG -> ((long[]) data)[flat];
      case FLOAT -> ((float[]) data)[flat];
      case DOUBLE -> ((double[]) data)[flat];
      case LOGICAL, STRING -> throw new IllegalStateException("not a numeric image: " + type);
    };
  }
}
