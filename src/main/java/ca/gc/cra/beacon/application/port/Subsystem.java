package ca.gc.cra.beacon.application.port;

import java.util.concurrent.CompletableFuture;

/**
 * <strong>What:</strong> Contract for a dependency the service must bring up before it accepts traffic.
 * <p><strong>Why:</strong> Lets the orchestrator sequence persistence, messaging, and future dependencies without
 * knowing their transport.</p>
 * <p><strong>Role:</strong> Port implemented by infrastructure adapters such as {@code HikariPersistence}.</p>
 * <p><strong>Thread-safety:</strong> {@link #init()} and {@link #release()} are invoked from the orchestrator thread;
 * implementations may complete their futures from any thread.</p>
 *
 * @since 0.1.0
 */
public interface Subsystem {
  /**
   * Short label used in log lines (e.g. {@code persistence}).
   *
   * @return subsystem name
   */
  String name();

  /**
   * Begins initialization. The returned future settles exactly once.
   *
   * @return future completing when the subsystem is usable, or exceptionally with the cause
   */
  CompletableFuture<Void> init();

  /**
   * Releases every resource acquired by {@link #init()}. The returned future settles exactly once; releasing a
   * subsystem that never initialized completes immediately.
   *
   * @return future completing when resources are freed
   */
  CompletableFuture<Void> release();
}
