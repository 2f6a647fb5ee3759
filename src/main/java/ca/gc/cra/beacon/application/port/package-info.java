/**
 * Ports consumed by the lifecycle orchestrator: subsystems, the listener, diagnostics, process control, and metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.beacon.application.port;
