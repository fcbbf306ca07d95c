package ca.gc.cra.fitsio.domain;

import ca.gc.cra.fitsio.domain.table.ColumnDescription;
import ca.gc.cra.fitsio.domain.table.TableKind;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Table HDU description.
 *
 * @param kind ASCII or binary table
 * @param columns column descriptions in column order
 * @param rows number of rows at the time the description was taken
 */
public record TableInfo(TableKind kind, List<ColumnDescription> columns, long rows)
    implements HduInfo {

  public TableInfo {
    Objects.requireNonNull(kind, "kind");
    columns = List.copyOf(Objects.requireNonNull(columns, "columns"));
    if (rows < 0) {
      throw new IllegalArgumentException("rows must be >= 0");
    }
  }

  @Override
  public HduType hduType() {
    return kind == TableKind.ASCII ? HduType.ASCII_TABLE : HduType.BINARY_TABLE;
  }

  /**
   * Looks up a column description by name, ignoring case.
   *
   * @param name column name
   * @return description when present
   */
  public Optional<ColumnDescription> column(String name) {
    return columns.stream().filter(c -> c.name().equalsIgnoreCase(name)).findFirst();
  }
}
