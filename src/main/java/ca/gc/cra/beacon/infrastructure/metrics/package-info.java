/**
 * Metrics adapter bridging {@link ca.gc.cra.beacon.application.port.MetricsPort} to OpenTelemetry.
 * <p><strong>Concurrency:</strong> Instruments are cached in concurrent maps; updates are thread-safe.</p>
 * <p><strong>Metrics:</strong> Publishes the {@code lifecycle.*} namespace.</p>
 */
package ca.gc.cra.beacon.infrastructure.metrics;
