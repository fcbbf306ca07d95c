package ca.gc.cra.fitsio.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for names handed to cfitsio: file paths, HDU names, column
 * names and header keywords.
 * <p><strong>Why:</strong> cfitsio copies names into fixed-size C buffers and treats control characters
 * as terminators; rejecting them here keeps failures in Java with a clear message.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent access.</p>
 *
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  /** Longest keyword name cfitsio accepts, including {@code HIERARCH} names. */
  public static final int MAX_KEYWORD_LENGTH = 71;

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Ensures a value contains only printable ASCII characters and fits the supplied length.
   *
   * @param name logical name for diagnostics
   * @param value candidate string; must be non-null
   * @param maxLength maximum permitted length in characters
   * @return validated, trimmed value
   * @throws IllegalArgumentException if the value is blank, too long, or not printable ASCII
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  /**
   * Validates a header keyword name.
   *
   * @param keyword keyword such as {@code EXTNAME}
   * @return trimmed keyword
   */
  public static String requireKeyword(String keyword) {
    return requirePrintableAscii("keyword", keyword, MAX_KEYWORD_LENGTH);
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
