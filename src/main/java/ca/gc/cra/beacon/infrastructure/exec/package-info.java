/**
 * Executor factories for lifecycle threads.
 * <p><strong>Role:</strong> Infrastructure utilities naming the teardown thread and the subsystem worker pool.</p>
 * <p><strong>Concurrency:</strong> Provides thread-safe factory methods that return managed executors.</p>
 */
package ca.gc.cra.beacon.infrastructure.exec;
