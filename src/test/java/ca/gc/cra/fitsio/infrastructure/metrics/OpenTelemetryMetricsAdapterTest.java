package ca.gc.cra.fitsio.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private static final AttributeKey<String> KEY_ATTRIBUTE = AttributeKey.stringKey("fitsio.metric.key");

  private InMemoryMetricReader reader;
  private SdkMeterProvider provider;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    provider = SdkMeterProvider.builder().registerMetricReader(reader).build();
    adapter = new OpenTelemetryMetricsAdapter(provider.get(OpenTelemetryMetricsAdapter.SCOPE));
  }

  @AfterEach
  void tearDown() {
    provider.close();
  }

  @Test
  void incrementRecordsCounterWithOriginalKey() {
    adapter.increment("fitsio.file.opened");
    adapter.increment("fitsio.file.opened");

    MetricData counter = metric("fitsio.file.opened").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("fitsio.file.opened", point.getAttributes().get(KEY_ATTRIBUTE));
  }

  @Test
  void observeRecordsHistogramSamples() {
    adapter.observe("fitsio.image.read.pixels", 100L);
    adapter.observe("fitsio.image.read.pixels", 300L);

    MetricData histogram = metric("fitsio.image.read.pixels").orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(400.0, point.getSum());
  }

  @Test
  void unsafeNamesAreSanitizedButKeyIsKept() {
    adapter.increment("Column Read/Errors");

    MetricData counter = metric("column_read_errors").orElseThrow();
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals("Column Read/Errors", point.getAttributes().get(KEY_ATTRIBUTE));
  }

  @Test
  void sanitizeNameHandlesEdgeCases() {
    assertEquals("fitsio.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.sanitizeName("9lives"));
    assertEquals("a-b.c_d", OpenTelemetryMetricsAdapter.sanitizeName("A-B.C_D"));
  }

  private Optional<MetricData> metric(String name) {
    Collection<MetricData> metrics = reader.collectAllMetrics();
    assertTrue(!metrics.isEmpty(), "Expected metrics to be exported");
    return metrics.stream().filter(m -> m.getName().equals(name)).findFirst();
  }
}
