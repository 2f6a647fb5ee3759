package ca.gc.cra.beacon.application.port;

import java.lang.Thread.UncaughtExceptionHandler;

/**
 * Installs the process-wide handler for uncaught exceptions.
 *
 * @since 0.1.0
 */
public interface FaultHookRegistrar {
  void install(UncaughtExceptionHandler handler);
}
