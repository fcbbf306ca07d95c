package ca.gc.cra.fitsio.domain;

/**
 * Kind of header-data unit.
 *
 * <p>{@link #ANY} only appears as a search criterion for named moves; a located HDU always reports
 * one of the concrete kinds.</p>
 */
public enum HduType {
  IMAGE,
  ASCII_TABLE,
  BINARY_TABLE,
  ANY;

  public boolean isTable() {
    return this == ASCII_TABLE || this == BINARY_TABLE;
  }
}
