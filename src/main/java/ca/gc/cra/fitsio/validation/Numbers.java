package ca.gc.cra.fitsio.validation;

/**
 * Numeric validation helpers for indices, counts and configuration values.
 *
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  public static long requireNonNegative(String name, long value) {
    return requireRange(name, value, 0, Long.MAX_VALUE);
  }

  /**
   * Narrows an element count to an {@code int} array length.
   *
   * @param name logical parameter name
   * @param count element count
   * @return count as {@code int}
   * @throws IllegalArgumentException if the count does not fit a Java array
   */
  public static int requireArrayLength(String name, long count) {
    return (int) requireRange(name, count, 0, Integer.MAX_VALUE - 8);
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
