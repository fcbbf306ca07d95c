package ca.gc.cra.fitsio.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Loads {@link FitsioConfig} from Java {@link Properties}.
 * <p><strong>Sources:</strong> {@link #load(InputStream)} reads one stream;
 * {@link #loadDefault()} reads {@value #RESOURCE} from the classpath when present and lets JVM system
 * properties with the same {@code fitsio.*} keys override it.</p>
 * <p><strong>Thread-safety:</strong> Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class FitsioPropertiesLoader {
  private static final Logger log = LoggerFactory.getLogger(FitsioPropertiesLoader.class);
  /** Classpath resource read by {@link #loadDefault()}. */
  public static final String RESOURCE = "fitsio.properties";
  private static final String PREFIX = "fitsio.";

  private FitsioPropertiesLoader() {}

  /**
   * Reads key/value pairs from the supplied stream and builds a {@link FitsioConfig}.
   *
   * @param in properties stream; not closed by this method
   * @return configuration derived from the properties
   * @throws IOException if reading the stream fails
   */
  public static FitsioConfig load(InputStream in) throws IOException {
    return FitsioConfig.fromMap(read(in));
  }

  /**
   * Builds the configuration used by the shared {@code Fitsio} context.
   *
   * @return configuration from the classpath resource and system properties, or the defaults
   * @throws UncheckedIOException if the resource exists but cannot be read
   */
  public static FitsioConfig loadDefault() {
    Map<String, String> kv = new HashMap<>();
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    if (loader == null) {
      loader = FitsioPropertiesLoader.class.getClassLoader();
    }
    try (InputStream in = loader.getResourceAsStream(RESOURCE)) {
      if (in != null) {
        kv.putAll(read(in));
        log.debug("Loaded {} from classpath", RESOURCE);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + RESOURCE, e);
    }
    kv.putAll(systemOverrides(System.getProperties()));
    return FitsioConfig.fromMap(kv);
  }

  static Map<String, String> systemOverrides(Properties system) {
    Map<String, String> kv = new HashMap<>();
    for (String name : system.stringPropertyNames()) {
      if (name.startsWith(PREFIX)) {
        kv.put(name, system.getProperty(name));
      }
    }
    return kv;
  }

  private static Map<String, String> read(InputStream in) throws IOException {
    Properties props = new Properties();
    props.load(in);
    Map<String, String> kv = new HashMap<>();
    for (String name : props.stringPropertyNames()) {
      kv.put(name, props.getProperty(name));
    }
    return kv;
  }
}
