package ca.gc.cra.beacon.application.port;

/**
 * Subscribes handlers to operating system termination signals.
 *
 * @since 0.1.0
 */
public interface SignalRegistrar {
  /**
   * Registers {@code handler} for the named signal.
   *
   * @param signalName signal name without the {@code SIG} prefix, e.g. {@code TERM}
   * @param handler invoked on the signal dispatch thread
   * @return {@code true} when the handler was installed; {@code false} when the platform reserves the signal
   */
  boolean register(String signalName, Runnable handler);
}
