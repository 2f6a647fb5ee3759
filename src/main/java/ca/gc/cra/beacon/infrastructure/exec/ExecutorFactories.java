package ca.gc.cra.beacon.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for the named threads and pools used by the BEACON lifecycle.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);
  private static final UncaughtExceptionHandler LOGGING_HANDLER =
      (thread, ex) -> log.error("Uncaught exception on {}", thread.getName(), ex);

  private ExecutorFactories() {}

  /**
   * Builds a thread factory producing {@code prefix-N} threads.
   *
   * @param prefix thread-name prefix; blank falls back to {@code beacon-lifecycle}
   * @param daemon whether threads are daemons
   * @param handler uncaught exception handler installed on each thread; {@code null} logs the failure
   * @return thread factory
   */
  public static ThreadFactory newLifecycleThreadFactory(
      String prefix, boolean daemon, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "beacon-lifecycle" : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, LOGGING_HANDLER);
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(daemon);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }

  /**
   * Builds a small daemon pool for subsystem initialization and release work.
   *
   * <p>Idle threads time out so that a released subsystem leaves no threads behind.</p>
   *
   * @param size number of worker threads to allocate
   * @param prefix thread-name prefix used to tag worker threads
   * @return configured executor service
   */
  public static ExecutorService newSubsystemPool(int size, String prefix) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    ThreadPoolExecutor executor = new ThreadPoolExecutor(
        size,
        size,
        30L,
        TimeUnit.SECONDS,
        new LinkedBlockingQueue<>(),
        newLifecycleThreadFactory(prefix, true, null),
        new ThreadPoolExecutor.AbortPolicy());
    executor.allowCoreThreadTimeOut(true);
    return executor;
  }
}
