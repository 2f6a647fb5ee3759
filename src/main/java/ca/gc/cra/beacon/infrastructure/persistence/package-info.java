/**
 * Persistence subsystem backed by a HikariCP connection pool.
 * <p><strong>Concurrency:</strong> Pool creation and shutdown run on the subsystem executor; the data source is
 * thread-safe once published.</p>
 */
package ca.gc.cra.beacon.infrastructure.persistence;
