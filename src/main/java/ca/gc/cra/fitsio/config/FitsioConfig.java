package ca.gc.cra.fitsio.config;

import ca.gc.cra.fitsio.domain.CaseSensitivity;
import ca.gc.cra.fitsio.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable settings of the FITS access layer.
 * <p><strong>Why:</strong> Keeps native library lookup, the threadsafe-wrapper policy and name matching
 * out of code so deployments can adjust them through {@code fitsio.properties} or system properties.</p>
 * <p><strong>Keys:</strong></p>
 * <ul>
 *   <li>{@value #LIBRARY_NAME} - shared library name passed to the loader, default {@code cfitsio}.</li>
 *   <li>{@value #LIBRARY_PATH} - extra directory searched for the library.</li>
 *   <li>{@value #REQUIRE_REENTRANT} - refuse {@code threadsafe()} on a non-reentrant build, default
 *       {@code true}.</li>
 *   <li>{@value #COLUMN_CASE} - {@code insensitive} (default) or {@code sensitive} column name
 *       matching.</li>
 *   <li>{@value #METRICS_ENABLED} - publish metrics through the global OpenTelemetry meter, default
 *       {@code false}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param libraryName native library name
 * @param libraryPath optional extra search directory; {@code null} when unset
 * @param requireReentrant whether {@code threadsafe()} requires a reentrant cfitsio
 * @param columnCaseSensitivity default column name matching
 * @param metricsEnabled whether metrics go to OpenTelemetry
 * @since 0.1.0
 */
public record FitsioConfig(
    String libraryName,
    Path libraryPath,
    boolean requireReentrant,
    CaseSensitivity columnCaseSensitivity,
    boolean metricsEnabled) {
  public static final String LIBRARY_NAME = "fitsio.library.name";
  public static final String LIBRARY_PATH = "fitsio.library.path";
  public static final String REQUIRE_REENTRANT = "fitsio.threadsafe.require-reentrant";
  public static final String COLUMN_CASE = "fitsio.column.case-sensitivity";
  public static final String METRICS_ENABLED = "fitsio.metrics.enabled";

  private static final String DEFAULT_LIBRARY_NAME = "cfitsio";

  public FitsioConfig {
    libraryName = Strings.requireNonBlank("libraryName", libraryName);
    if (columnCaseSensitivity == null) {
      throw new IllegalArgumentException("columnCaseSensitivity must not be null");
    }
  }

  public static FitsioConfig defaults() {
    return new FitsioConfig(
        DEFAULT_LIBRARY_NAME, null, true, CaseSensitivity.CASE_INSENSITIVE, false);
  }

  public Optional<Path> libraryPathOptional() {
    return Optional.ofNullable(libraryPath);
  }

  /**
   * Builds a configuration from key/value pairs; missing or blank keys take their defaults.
   *
   * @param values settings keyed by the constants of this class; may be {@code null}
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed
   */
  public static FitsioConfig fromMap(Map<String, String> values) {
    Map<String, String> kv = values == null ? Map.of() : new HashMap<>(values);
    FitsioConfig defaults = defaults();
    String name = kv.get(LIBRARY_NAME);
    return new FitsioConfig(
        name == null || name.isBlank() ? defaults.libraryName() : name,
        parseOptionalPath(LIBRARY_PATH, kv.get(LIBRARY_PATH)).orElse(null),
        parseBoolean(REQUIRE_REENTRANT, kv.get(REQUIRE_REENTRANT), defaults.requireReentrant()),
        parseCase(kv.get(COLUMN_CASE), defaults.columnCaseSensitivity()),
        parseBoolean(METRICS_ENABLED, kv.get(METRICS_ENABLED), defaults.metricsEnabled()));
  }

  private static boolean parseBoolean(String key, String value, boolean fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true" -> true;
      case "false" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false (was " + value + ")");
    };
  }

  private static CaseSensitivity parseCase(String value, CaseSensitivity fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "insensitive" -> CaseSensitivity.CASE_INSENSITIVE;
      case "sensitive" -> CaseSensitivity.CASE_SENSITIVE;
      default -> throw new IllegalArgumentException(
          COLUMN_CASE + " must be sensitive or insensitive (was " + value + ")");
    };
  }

  private static Optional<Path> parseOptionalPath(String name, String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Path.of(value.trim()).toAbsolutePath().normalize());
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }
}
