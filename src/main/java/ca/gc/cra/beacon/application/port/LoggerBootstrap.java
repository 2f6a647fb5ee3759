package ca.gc.cra.beacon.application.port;

/**
 * Port that initializes the process-wide diagnostic sink.
 *
 * @since 0.1.0
 */
public interface LoggerBootstrap {
  /**
   * Initializes the structured sink synchronously.
   *
   * @return log backed by the initialized sink
   * @throws RuntimeException when the sink cannot be configured
   */
  DiagnosticLog initialize();
}
