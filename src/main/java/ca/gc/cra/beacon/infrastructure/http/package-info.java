/**
 * HTTP listener adapter built on Javalin and Jetty.
 * <p><strong>Role:</strong> Implements {@link ca.gc.cra.beacon.application.port.ListenerPort}; serves only the
 * readiness probe.</p>
 * <p><strong>Concurrency:</strong> Requests run on a named Jetty pool; ready and error events are replayed to late
 * subscribers.</p>
 */
package ca.gc.cra.beacon.infrastructure.http;
