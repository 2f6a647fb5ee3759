package ca.gc.cra.beacon.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
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
  private static final AttributeKey<String> KEY_ATTR = AttributeKey.stringKey("beacon.metric.key");

  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    OpenTelemetryBootstrap.BootstrapResult bootstrap = OpenTelemetryBootstrap.forTesting(reader);
    adapter = new OpenTelemetryMetricsAdapter(bootstrap);
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterWithAttributes() {
    adapter.increment("lifecycle.shutdown.triggered");
    adapter.increment("lifecycle.shutdown.triggered");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "lifecycle.shutdown.triggered");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());

    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("lifecycle.shutdown.triggered", point.getAttributes().get(KEY_ATTR));

    assertEquals("beacon", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
    String instance = counter.getResource().getAttribute(AttributeKey.stringKey("service.instance.id"));
    assertTrue(instance != null && !instance.isBlank(), "Service instance id should be provided");
  }

  @Test
  void observeRecordsHistogramInMilliseconds() {
    adapter.observe("lifecycle.startup.duration.ms", 120L);
    adapter.observe("lifecycle.startup.duration.ms", 80L);
    adapter.forceFlush();

    MetricData histogram = find(reader.collectAllMetrics(), "lifecycle.startup.duration.ms");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    assertEquals("ms", histogram.getUnit());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(200.0, point.getSum());
  }

  @Test
  void sanitizeNameNormalizesUnsupportedCharacters() {
    assertEquals("lifecycle.bind_failure", OpenTelemetryMetricsAdapter.sanitizeName("Lifecycle.Bind Failure"));
    assertEquals("m1st", OpenTelemetryMetricsAdapter.sanitizeName("1st"));
    assertEquals("beacon.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }

  private static MetricData find(Collection<MetricData> metrics, String name) {
    Optional<MetricData> match = metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst();
    assertTrue(match.isPresent(), "Expected metric " + name + " to be exported");
    return match.orElseThrow();
  }
}
