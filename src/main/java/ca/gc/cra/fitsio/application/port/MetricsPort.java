package ca.gc.cra.fitsio.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission for the FITS access layer.
 * <p><strong>Why:</strong> Lets file, column and image operations record counters and size observations
 * without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}; {@link #NO_OP} otherwise.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code fitsio.file.opened},
 * {@code fitsio.column.read.elements}).</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value, e.g. elements read
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
