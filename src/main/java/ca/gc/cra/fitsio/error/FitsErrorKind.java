package ca.gc.cra.fitsio.error;

/**
 * Category of a {@link FitsException}, chosen from the failing operation and the library status.
 *
 * @since 0.1.0
 */
public enum FitsErrorKind {
  /** A file could not be opened. */
  OPEN,
  /** A file could not be created. */
  CREATE,
  /** Any library failure without a more specific category. */
  STATUS,
  /** A named column does not exist in the current table. */
  COLUMN_NOT_FOUND,
  /** The requested Java type cannot be exchanged with the declared column or image type. */
  TYPE_MISMATCH,
  /** A row, pixel or axis range lies outside the HDU. */
  BOUNDS,
  /** Closing the file reported a failure. */
  CLOSE
}
