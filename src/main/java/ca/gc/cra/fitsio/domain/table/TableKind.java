package ca.gc.cra.fitsio.domain.table;

/** Table encoding: fixed-width text or binary. */
public enum TableKind {
  ASCII,
  BINARY
}
