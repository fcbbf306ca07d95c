package ca.gc.cra.fitsio.error;

import java.util.List;

/**
 * Raised when a column name does not resolve in the current table HDU.
 *
 * @since 0.1.0
 */
public final class ColumnNotFoundException extends FitsException {
  private static final long serialVersionUID = 1L;

  private final String column;

  public ColumnNotFoundException(String column, int status, List<String> libraryMessages) {
    super(FitsErrorKind.COLUMN_NOT_FOUND, "column not found: " + column, status, libraryMessages, null);
    this.column = column;
  }

  public String column() {
    return column;
  }
}
