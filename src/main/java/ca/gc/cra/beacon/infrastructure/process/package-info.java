/**
 * JVM bindings for signal interception, the default uncaught exception handler, and process exit.
 *
 * @since 0.1.0
 */
package ca.gc.cra.beacon.infrastructure.process;
