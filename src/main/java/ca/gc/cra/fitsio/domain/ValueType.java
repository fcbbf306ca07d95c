package ca.gc.cra.fitsio.domain;

import java.lang.reflect.Array;
import java.util.Locale;
import java.util.Objects;

/**
 * Typed token naming the Java array type used to exchange column, image or pixel data.
 *
 * <p><strong>What:</strong> A closed set of constants; each pairs a {@link ValueKind} with its array
 * class, so reads return {@code A} without casts at the call site.</p>
 * <p><strong>Why:</strong> cfitsio buffers are untyped; binding the element type here lets the engines
 * check compatibility before any native call.</p>
 *
 * <p>{@link #BYTE} values are FITS unsigned bytes stored in Java's signed {@code byte}; use
 * {@link Byte#toUnsignedInt(byte)} to read them.</p>
 *
 * @param <A> Java array type, for example {@code double[]}
 * @since 0.1.0
 */
public final class ValueType<A> {
  public static final ValueType<byte[]> BYTE = new ValueType<>(ValueKind.BYTE, byte[].class);
  public static final ValueType<short[]> SHORT = new ValueType<>(ValueKind.SHORT, short[].class);
  public static final ValueType<int[]> INT = new ValueType<>(ValueKind.INT, int[].class);
  public static final ValueType<long[]> LONG = new ValueType<>(ValueKind.LONG, long[].class);
  public static final ValueType<float[]> FLOAT = new ValueType<>(ValueKind.FLOAT, float[].class);
  public static final ValueType<double[]> DOUBLE = new ValueType<>(ValueKind.DOUBLE, double[].class);
  public static final ValueType<boolean[]> LOGICAL =
      new ValueType<>(ValueKind.LOGICAL, boolean[].class);
  public static final ValueType<String[]> STRING = new ValueType<>(ValueKind.STRING, String[].class);

  private final ValueKind kind;
  private final Class<A> arrayType;

  private ValueType(ValueKind kind, Class<A> arrayType) {
    this.kind = kind;
    this.arrayType = arrayType;
  }

  /**
   * Returns the constant for a kind.
   *
   * @param kind element kind
   * @return matching value type
   */
  public static ValueType<?> of(ValueKind kind) {
    return switch (Objects.requireNonNull(kind, "kind")) {
      case BYTE -> BYTE;
      case SHORT -> SHORT;
      case INT -> INT;
      case LONG -> LONG;
      case FLOAT -> FLOAT;
      case DOUBLE -> DOUBLE;
      case LOGICAL -> LOGICAL;
      case STRING -> STRING;
    };
  }

  public ValueKind kind() {
    return kind;
  }

  public Class<A> arrayType() {
    return arrayType;
  }

  /**
   * Allocates a zero-filled array.
   *
   * @param length element count
   * @return new array
   */
  public A newArray(int length) {
    return arrayType.cast(Array.newInstance(arrayType.getComponentType(), length));
  }

  /**
   * Returns the length of an array of this type.
   *
   * @param array array of type {@code A}
   * @return element count
   */
  public int length(A array) {
    return Array.getLength(Objects.requireNonNull(array, "array"));
  }

  /**
   * Casts an untyped array, failing when it is not of this type.
   *
   * @param array candidate array
   * @return the same array typed as {@code A}
   */
  public A cast(Object array) {
    return arrayType.cast(array);
  }

  @Override
  public String toString() {
    return kind.name().toLowerCase(Locale.ROOT);
  }
}
