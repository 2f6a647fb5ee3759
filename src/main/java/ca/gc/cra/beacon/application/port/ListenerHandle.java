package ca.gc.cra.beacon.application.port;

import java.net.InetSocketAddress;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Handle to a bound (or binding) network listener.
 *
 * <p>Ready and error events are replayed to subscribers registered after the event fired, so callers may
 * subscribe once {@link ListenerPort#listen(String, int)} returns. Each callback fires at most once per
 * subscription.</p>
 *
 * @since 0.1.0
 */
public interface ListenerHandle {
  /**
   * Registers a callback for the moment the listener accepts connections.
   *
   * @param callback invoked once the endpoint is bound
   */
  void onReady(Runnable callback);

  /**
   * Registers a callback for listener errors, including bind failures.
   *
   * @param callback invoked with the listener error
   */
  void onError(Consumer<Throwable> callback);

  /**
   * Address the listener is bound to.
   *
   * @return bound address, or the requested address when binding has not completed
   */
  InetSocketAddress address();

  /**
   * Stops accepting connections, drains in-flight work and releases the port.
   *
   * @return future completing once the port is released
   */
  CompletableFuture<Void> close();
}
