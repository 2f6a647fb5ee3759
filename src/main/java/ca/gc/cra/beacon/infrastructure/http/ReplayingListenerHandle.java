package ca.gc.cra.beacon.infrastructure.http;

import ca.gc.cra.beacon.application.port.ListenerHandle;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Base {@link ListenerHandle} that remembers its ready and error events and replays them to late subscribers.
 *
 * <p>Callbacks run outside the internal lock, on the thread that fired the event or on the subscribing thread when
 * the event already happened.</p>
 *
 * @since 0.1.0
 */
public abstract class ReplayingListenerHandle implements ListenerHandle {
  private final Object lock = new Object();
  private final List<Runnable> readyCallbacks = new ArrayList<>();
  private final List<Consumer<Throwable>> errorCallbacks = new ArrayList<>();
  private boolean ready;
  private Throwable error;

  @Override
  public final void onReady(Runnable callback) {
    Objects.requireNonNull(callback, "callback");
    synchronized (lock) {
      if (!ready) {
        readyCallbacks.add(callback);
        return;
      }
    }
    callback.run();
  }

  @Override
  public final void onError(Consumer<Throwable> callback) {
    Objects.requireNonNull(callback, "callback");
    Throwable fired;
    synchronized (lock) {
      if (error == null) {
        errorCallbacks.add(callback);
        return;
      }
      fired = error;
    }
    callback.accept(fired);
  }

  /**
   * Marks the listener ready and notifies subscribers. Only the first call has an effect.
   */
  protected final void fireReady() {
    List<Runnable> callbacks;
    synchronized (lock) {
      if (ready) {
        return;
      }
      ready = true;
      callbacks = List.copyOf(readyCallbacks);
      readyCallbacks.clear();
    }
    callbacks.forEach(Runnable::run);
  }

  /**
   * Records a listener error and notifies subscribers. Only the first error is retained and replayed.
   *
   * @param failure listener error
   */
  protected final void fireError(Throwable failure) {
    Objects.requireNonNull(failure, "failure");
    List<Consumer<Throwable>> callbacks;
    synchronized (lock) {
      if (error != null) {
        return;
      }
      error = failure;
      callbacks = List.copyOf(errorCallbacks);
      errorCallbacks.clear();
    }
    callbacks.forEach(callback -> callback.accept(failure));
  }
}
