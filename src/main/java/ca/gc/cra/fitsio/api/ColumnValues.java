package ca.gc.cra.fitsio.api;

import ca.gc.cra.fitsio.domain.table.ColumnData;
import ca.gc.cra.fitsio.domain.table.ColumnDescription;
import java.util.Objects;

/**
 * One column of a table read with its natural value type.
 *
 * @param description column definition
 * @param data every row of the column
 * @since 0.1.0
 */
public record ColumnValues(ColumnDescription description, ColumnData<?> data) {
  public ColumnValues {
    Objects.requireNonNull(description, "description");
    Objects.requireNonNull(data, "data");
  }

  public String name() {
    return description.name();
  }
}
