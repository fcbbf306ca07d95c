package ca.gc.cra.fitsio.domain.table;

import ca.gc.cra.fitsio.domain.ValueType;
import java.util.Optional;

/**
 * Declared element type of a table column, named after its TFORM letter family.
 *
 * <p>Complex and variable-length columns are not represented; describing a table that contains
 * them fails.</p>
 */
public enum ColumnDataType {
  BIT('X', ValueType.LOGICAL),
  BYTE('B', ValueType.BYTE),
  LOGICAL('L', ValueType.LOGICAL),
  STRING('A', ValueType.STRING),
  SHORT('I', ValueType.SHORT),
  INT('J', ValueType.INT),
  LONG('K', ValueType.LONG),
  FLOAT('E', ValueType.FLOAT),
  DOUBLE('D', ValueType.DOUBLE);

  private final char tformCode;
  private final ValueType<?> naturalType;

  ColumnDataType(char tformCode, ValueType<?> naturalType) {
    this.tformCode = tformCode;
    this.naturalType = naturalType;
  }

  public char tformCode() {
    return tformCode;
  }

  /**
   * Java value type used when a column is read without an explicit request, e.g. by
   * {@code FitsHdu.columns()}.
   *
   * @return value type matching the declared storage
   */
  public ValueType<?> naturalType() {
    return naturalType;
  }

  public boolean isNumeric() {
    return this != LOGICAL && this != STRING && this != BIT;
  }

  /**
   * Resolves a TFORM letter.
   *
   * @param code TFORM letter, case-insensitive
   * @return matching type when recognized
   */
  public static Optional<ColumnDataType> fromTformCode(char code) {
    char upper = Character.toUpperCase(code);
    for (ColumnDataType type : values()) {
      if (type.tformCode == upper) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
