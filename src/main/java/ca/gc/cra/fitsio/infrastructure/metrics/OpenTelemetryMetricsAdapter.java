package ca.gc.cra.fitsio.infrastructure.metrics;

import ca.gc.cra.fitsio.application.port.MetricsPort;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that forwards file, status and read-size metrics to an OpenTelemetry {@link Meter}.
 *
 * <p>Instruments are created lazily per key and cached. The exporter is whatever the application
 * registered with {@link GlobalOpenTelemetry}; this library does not configure one.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  /** Instrumentation scope name. */
  public static final String SCOPE = "ca.gc.cra.fitsio";
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE =
      AttributeKey.stringKey("fitsio.metric.key");
  private static final String FALLBACK_METRIC_NAME = "fitsio.metric";

  private final Meter meter;
  private final ConcurrentMap<String, CounterInstrument> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, HistogramInstrument> histograms = new ConcurrentHashMap<>();
  private final Map<String, String> sanitizedNames = new ConcurrentHashMap<>();

  public OpenTelemetryMetricsAdapter(Meter meter) {
    this.meter = Objects.requireNonNull(meter, "meter");
  }

  /**
   * Creates an adapter over the globally registered OpenTelemetry instance.
   *
   * @return adapter; a no-op meter backs it when no SDK is registered
   */
  public static OpenTelemetryMetricsAdapter global() {
    return new OpenTelemetryMetricsAdapter(GlobalOpenTelemetry.getMeter(SCOPE));
  }

  @Override
  public void increment(String key) {
    String effectiveKey = Objects.requireNonNull(key, "key");
    CounterInstrument instrument = counters.computeIfAbsent(effectiveKey, this::createCounter);
    instrument.counter().add(1, instrument.attributes());
  }

  @Override
  public void observe(String key, long value) {
    String effectiveKey = Objects.requireNonNull(key, "key");
    HistogramInstrument instrument =
        histograms.computeIfAbsent(effectiveKey, this::createHistogram);
    instrument.histogram().record(value, instrument.attributes());
  }

  private CounterInstrument createCounter(String key) {
    String sanitized = sanitizedNames.computeIfAbsent(key, OpenTelemetryMetricsAdapter::sanitizeName);
    LongCounter counter = meter
        .counterBuilder(sanitized)
        .setUnit("1")
        .setDescription("FITS counter for " + key)
        .build();
    if (!sanitized.equals(key)) {
      log.debug("Sanitized counter name '{}' -> '{}'", key, sanitized);
    }
    return new CounterInstrument(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  private HistogramInstrument createHistogram(String key) {
    String sanitized = sanitizedNames.computeIfAbsent(key, OpenTelemetryMetricsAdapter::sanitizeName);
    LongHistogram histogram = meter
        .histogramBuilder(sanitized)
        .ofLongs()
        .setDescription("FITS observation for " + key)
        .build();
    if (!sanitized.equals(key)) {
      log.debug("Sanitized histogram name '{}' -> '{}'", key, sanitized);
    }
    return new HistogramInstrument(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  static String sanitizeName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      if (Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.') {
        result.append(c);
      } else {
        result.append('_');
      }
    }
    return result.toString();
  }

  private record CounterInstrument(LongCounter counter, Attributes attributes) {}

  private record HistogramInstrument(LongHistogram histogram, Attributes attributes) {}
}
