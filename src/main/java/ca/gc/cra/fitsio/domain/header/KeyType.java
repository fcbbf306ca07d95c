package ca.gc.cra.fitsio.domain.header;

import java.util.Objects;

/**
 * Typed token for header keyword values.
 *
 * @param <T> Java type of the keyword value
 */
public final class KeyType<T> {
  /** Kinds of keyword value exchanged with cfitsio. */
  public enum Kind {
    STRING,
    LONG,
    DOUBLE,
    LOGICAL
  }

  public static final KeyType<String> STRING = new KeyType<>(Kind.STRING, String.class);
  public static final KeyType<Long> LONG = new KeyType<>(Kind.LONG, Long.class);
  public static final KeyType<Double> DOUBLE = new KeyType<>(Kind.DOUBLE, Double.class);
  public static final KeyType<Boolean> LOGICAL = new KeyType<>(Kind.LOGICAL, Boolean.class);

  private final Kind kind;
  private final Class<T> javaType;

  private KeyType(Kind kind, Class<T> javaType) {
    this.kind = kind;
    this.javaType = javaType;
  }

  public Kind kind() {
    return kind;
  }

  public T cast(Object value) {
    return javaType.cast(Objects.requireNonNull(value, "value"));
  }

  @Override
  public String toString() {
    return kind.name();
  }
}
