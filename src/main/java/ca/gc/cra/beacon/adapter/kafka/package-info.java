/**
 * Kafka adapter providing the outbound messaging transport subsystem.
 * <p><strong>Role:</strong> Adapter layer on the outbound side; implements
 * {@link ca.gc.cra.beacon.application.port.Subsystem} over a Kafka producer.</p>
 * <p><strong>Concurrency:</strong> The producer is thread-safe; lifecycle calls come from the orchestrator.</p>
 * <p><strong>Security:</strong> Assumes Kafka credentials provided via configuration; no secrets logged.</p>
 */
package ca.gc.cra.beacon.adapter.kafka;
