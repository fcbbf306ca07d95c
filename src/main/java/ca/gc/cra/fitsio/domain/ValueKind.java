package ca.gc.cra.fitsio.domain;

/** Closed set of Java element kinds that can cross the native boundary. */
public enum ValueKind {
  BYTE,
  SHORT,
  INT,
  LONG,
  FLOAT,
  DOUBLE,
  LOGICAL,
  STRING;

  public boolean isNumeric() {
    return this != LOGICAL && this != STRING;
  }
}
