package ca.gc.cra.beacon.application.port;

/**
 * <strong>What:</strong> Minimal diagnostic channel used by the lifecycle orchestrator.
 * <p><strong>Why:</strong> The orchestrator must be able to report failures both before and after the structured
 * sink is initialized.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept calls from signal and worker threads.</p>
 *
 * @since 0.1.0
 */
public interface DiagnosticLog {
  void debug(String message);

  void info(String message);

  void warn(String message);

  /**
   * Logs an error together with its stack trace.
   *
   * @param message human readable summary
   * @param failure cause; may be {@code null}
   */
  void error(String message, Throwable failure);
}
