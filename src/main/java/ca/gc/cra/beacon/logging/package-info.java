/**
 * <strong>Purpose:</strong> Logging bootstrap, diagnostic channels, and payload hygiene helpers.
 * <p><strong>Role:</strong> Implements the logger bootstrap and diagnostic log ports on top of SLF4J and Logback,
 * plus the stderr channel used before the backend is configured.
 * <p><strong>Concurrency:</strong> Configuration runs once on the startup thread; log channels are thread-safe.
 * <p><strong>Security:</strong> Provides truncation and redaction helpers so fault messages and secrets stay bounded
 * in log lines.
 *
 * @since 0.1.0
 */
package ca.gc.cra.beacon.logging;
