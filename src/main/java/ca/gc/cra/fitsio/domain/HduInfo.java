package ca.gc.cra.fitsio.domain;

/**
 * Structural description of one HDU, derived by querying the library while the HDU is current.
 *
 * @since 0.1.0
 */
public sealed interface HduInfo permits ImageInfo, TableInfo {

  /**
   * Returns the concrete HDU kind.
   *
   * @return {@link HduType#IMAGE}, {@link HduType#ASCII_TABLE} or {@link HduType#BINARY_TABLE}
   */
  HduType hduType();
}
