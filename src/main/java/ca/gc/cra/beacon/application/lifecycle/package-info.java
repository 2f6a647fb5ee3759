/**
 * <strong>Purpose:</strong> Lifecycle orchestration: ordered startup, signal and fault interception, and single-flight
 * teardown.
 * <p><strong>Concurrency:</strong> State changes are compare-and-set on one reference; teardown runs on a dedicated
 * non-daemon thread.
 * <p><strong>Telemetry:</strong> Emits {@code lifecycle.*} metrics through {@code MetricsPort}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.beacon.application.lifecycle;
