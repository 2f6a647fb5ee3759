/**
 * CLI entry point that resolves configuration and runs the BEACON service lifecycle.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures telemetry, and hands
 * control to the lifecycle orchestrator.</p>
 * <p><strong>Security:</strong> Validates user-supplied network targets and redacts secrets in the dry-run plan.</p>
 */
package ca.gc.cra.beacon.api;
