package ca.gc.cra.beacon.api;

import ca.gc.cra.beacon.config.ServiceConfig.TelemetrySettings;
import java.net.URI;
import java.net.URISyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes telemetry settings as the system properties read by the OpenTelemetry bootstrap.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);

  private TelemetryConfigurator() {}

  static void configureMetrics(TelemetrySettings settings) {
    log.debug("Configuring OpenTelemetry metrics exporter: {}", settings.exporter());
    System.setProperty("otel.metrics.exporter", settings.exporter());
    if (!settings.endpoint().isEmpty()) {
      validateEndpoint(settings.endpoint());
      log.debug("Configuring OTLP endpoint: {}", settings.endpoint());
      System.setProperty("otel.exporter.otlp.endpoint", settings.endpoint());
    }
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }
}
