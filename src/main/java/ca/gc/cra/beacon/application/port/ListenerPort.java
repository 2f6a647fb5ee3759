package ca.gc.cra.beacon.application.port;

/**
 * Port that binds the service's network endpoint.
 *
 * @since 0.1.0
 */
public interface ListenerPort {
  /**
   * Starts binding {@code host:port}. Bind failures are reported through {@link ListenerHandle#onError}.
   *
   * @param host interface to bind, e.g. {@code 0.0.0.0}
   * @param port TCP port; {@code 0} selects an ephemeral port
   * @return handle for the listener
   */
  ListenerHandle listen(String host, int port);
}
