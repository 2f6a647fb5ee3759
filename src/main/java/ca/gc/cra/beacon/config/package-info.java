/**
 * Configuration records, source merging, and composition root wiring for the BEACON service.
 * <p><strong>Role:</strong> Application bootstrap layer; merges CLI, environment, YAML, and default values and
 * wires the lifecycle orchestrator with its adapters.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Validates network targets and redacts the database password when printing the
 * effective plan.</p>
 */
package ca.gc.cra.beacon.config;
