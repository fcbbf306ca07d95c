package ca.gc.cra.fitsio.domain.table;

import ca.gc.cra.fitsio.validation.Strings;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Name, declared type, repeat count, width and optional unit of a table column.
 *
 * <p><strong>What:</strong> Used both to describe existing columns (built from the library's column
 * type query) and to declare columns for new tables, where {@link #tform()} produces the TFORM
 * value.</p>
 * <p><strong>Invariants:</strong> repeat and width are at least one; string columns hold
 * {@code repeat / width} strings per row when the width divides the repeat count, otherwise one.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class ColumnDescription {
  private static final Pattern TFORM = Pattern.compile("^\\s*(\\d*)([A-Za-z])(\\d*)\\s*$");

  private final String name;
  private final ColumnDataType type;
  private final long repeat;
  private final long width;
  private final String unit;

  private ColumnDescription(Builder builder) {
    this.name = builder.name;
    this.type = builder.type;
    this.repeat = builder.repeat;
    this.width = builder.width > 0 ? builder.width : defaultWidth(builder.type, builder.repeat);
    this.unit = builder.unit;
  }

  /**
   * Starts a description for a column.
   *
   * @param name column name ({@code TTYPEn})
   * @return builder; {@link Builder#type(ColumnDataType)} is mandatory
   */
  public static Builder builder(String name) {
    return new Builder(name);
  }

  /**
   * Builds a description from a TFORM value such as {@code "3D"}, {@code "20A"} or {@code "40A8"}.
   *
   * @param name column name
   * @param tform binary-table TFORM value
   * @return description
   * @throws IllegalArgumentException when the TFORM letter is not a supported column type
   */
  public static ColumnDescription fromTform(String name, String tform) {
    Matcher m = TFORM.matcher(Objects.requireNonNull(tform, "tform"));
    if (!m.matches()) {
      throw new IllegalArgumentException("unparseable TFORM: " + tform);
    }
    ColumnDataType type = ColumnDataType.fromTformCode(m.group(2).charAt(0))
        .orElseThrow(() -> new IllegalArgumentException("unsupported TFORM type: " + tform));
    Builder builder = builder(name).type(type);
    if (!m.group(1).isEmpty()) {
      builder.repeat(Long.parseLong(m.group(1)));
    }
    if (!m.group(3).isEmpty()) {
      builder.width(Long.parseLong(m.group(3)));
    }
    return builder.build();
  }

  public String name() {
    return name;
  }

  public ColumnDataType type() {
    return type;
  }

  public long repeat() {
    return repeat;
  }

  public long width() {
    return width;
  }

  public Optional<String> unit() {
    return Optional.ofNullable(unit);
  }

  /**
   * Number of values stored per row: the repeat count, or the number of strings for string
   * columns.
   *
   * @return elements per row, at least one
   */
  public long elementsPerRow() {
    if (type == ColumnDataType.STRING) {
      return width > 0 && width < repeat && repeat % width == 0 ? repeat / width : 1;
    }
    return repeat;
  }

  /**
   * Returns the binary-table TFORM value for this column.
   *
   * @return TFORM such as {@code "1E"} or {@code "40A8"}
   */
  public String tform() {
    if (type == ColumnDataType.STRING && width < repeat) {
      return repeat + "A" + width;
    }
    return repeat + String.valueOf(type.tformCode());
  }

  /**
   * Returns a copy with a different name.
   *
   * @param newName new column name
   * @return renamed description
   */
  public ColumnDescription withName(String newName) {
    return builder(newName).type(type).repeat(repeat).width(width).unit(unit).build();
  }

  private static long defaultWidth(ColumnDataType type, long repeat) {
    return switch (type) {
      case STRING -> repeat;
      case BIT, BYTE, LOGICAL -> 1;
      case SHORT -> 2;
      case INT, FLOAT -> 4;
      case LONG, DOUBLE -> 8;
    };
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ColumnDescription other)) {
      return false;
    }
    return repeat == other.repeat
        && width == other.width
        && name.equals(other.name)
        && type == other.type
        && Objects.equals(unit, other.unit);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type, repeat, width, unit);
  }

  @Override
  public String toString() {
    return name + "(" + tform() + (unit == null ? "" : ", " + unit) + ")";
  }

  /** Fluent builder; {@link #build()} rejects a missing type. */
  public static final class Builder {
    private final String name;
    private ColumnDataType type;
    private long repeat = 1;
    private long width;
    private String unit;

    private Builder(String name) {
      this.name = Strings.requireNonBlank("name", name);
    }

    public Builder type(ColumnDataType type) {
      this.type = Objects.requireNonNull(type, "type");
      return this;
    }

    /**
     * Sets the repeat count (vector length, or total characters for strings).
     *
     * @param repeat count, at least one
     * @return this builder
     */
    public Builder repeat(long repeat) {
      if (repeat < 1) {
        throw new IllegalArgumentException("repeat must be >= 1");
      }
      this.repeat = repeat;
      return this;
    }

    public Builder width(long width) {
      if (width < 1) {
        throw new IllegalArgumentException("width must be >= 1");
      }
      this.width = width;
      return this;
    }

    public Builder unit(String unit) {
      this.unit = unit == null || unit.isBlank() ? null : unit;
      return this;
    }

    public ColumnDescription build() {
      if (type == null) {
        throw new IllegalStateException("column " + name + " has no data type");
      }
      return new ColumnDescription(this);
    }
  }
}
