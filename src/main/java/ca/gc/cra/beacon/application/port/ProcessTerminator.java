package ca.gc.cra.beacon.application.port;

import ca.gc.cra.beacon.domain.lifecycle.ExitCode;

/**
 * Ends the process with a deterministic exit code.
 *
 * @since 0.1.0
 */
public interface ProcessTerminator {
  /**
   * Terminates the process. Implementations backed by the JVM do not return.
   *
   * @param code exit status
   */
  void exit(ExitCode code);
}
