package ca.gc.cra.fitsio.domain;

/** Name matching policy for HDU and column lookups. */
public enum CaseSensitivity {
  CASE_INSENSITIVE,
  CASE_SENSITIVE
}
