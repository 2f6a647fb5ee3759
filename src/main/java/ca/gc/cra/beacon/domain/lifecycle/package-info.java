/**
 * <strong>Purpose:</strong> Lifecycle state values shared by the orchestrator and its interceptors.
 * <p><strong>Concurrency:</strong> Immutable enums and records; safe to pass between signal and worker threads.
 *
 * @since 0.1.0
 */
package ca.gc.cra.beacon.domain.lifecycle;
