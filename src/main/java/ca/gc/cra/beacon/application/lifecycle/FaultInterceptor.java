package ca.gc.cra.beacon.application.lifecycle;

import ca.gc.cra.beacon.application.port.DiagnosticLog;
import ca.gc.cra.beacon.application.port.FaultHookRegistrar;
import ca.gc.cra.beacon.domain.lifecycle.ShutdownCause;
import ca.gc.cra.beacon.logging.Logs;
import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;

/**
 * <strong>What:</strong> Turns uncaught exceptions and unobserved asynchronous failures into shutdown requests.
 * <p><strong>Why:</strong> A fault that escapes its thread leaves the process in an unknown state; the only safe
 * reaction is an ordered teardown.</p>
 * <p><strong>Role:</strong> Installed as the JVM default {@link UncaughtExceptionHandler} once the service is
 * running. Fire-and-forget work is routed through {@link #watch(CompletionStage)}.</p>
 * <p><strong>Thread-safety:</strong> Stateless beyond its collaborators; safe to call from any thread.</p>
 *
 * @since 0.1.0
 */
public final class FaultInterceptor implements UncaughtExceptionHandler {
  static final String UNCAUGHT = "uncaughtException";
  static final String UNOBSERVED = "unobservedRejection";
  private static final int MAX_MESSAGE_BYTES = 512;

  private final DiagnosticLog log;
  private final Consumer<ShutdownCause> shutdown;

  public FaultInterceptor(DiagnosticLog log, Consumer<ShutdownCause> shutdown) {
    this.log = Objects.requireNonNull(log, "log");
    this.shutdown = Objects.requireNonNull(shutdown, "shutdown");
  }

  /**
   * Installs this interceptor as the process-wide uncaught exception handler.
   *
   * @param registrar platform hook registrar
   */
  public void install(FaultHookRegistrar registrar) {
    Objects.requireNonNull(registrar, "registrar").install(this);
    log.debug("[fault] Uncaught exception handler installed");
  }

  @Override
  public void uncaughtException(Thread thread, Throwable failure) {
    String threadName = thread == null ? "unknown" : thread.getName();
    log.error("[fault] Uncaught exception on thread " + threadName + ": " + summary(failure), failure);
    shutdown.accept(ShutdownCause.fault(UNCAUGHT, failure));
  }

  /**
   * Reports an asynchronous failure nobody else observed.
   *
   * @param failure rejected result
   */
  public void onUnobservedFailure(Throwable failure) {
    Throwable cause = unwrap(failure);
    log.error("[fault] Unobserved asynchronous failure: " + summary(cause), cause);
    shutdown.accept(ShutdownCause.fault(UNOBSERVED, cause));
  }

  /**
   * Routes an exceptional completion of {@code stage} to {@link #onUnobservedFailure(Throwable)}.
   *
   * @param stage fire-and-forget stage
   * @param <T> result type
   * @return the same stage, for chaining
   */
  public <T> CompletionStage<T> watch(CompletionStage<T> stage) {
    Objects.requireNonNull(stage, "stage").whenComplete((ignored, failure) -> {
      if (failure != null) {
        onUnobservedFailure(failure);
      }
    });
    return stage;
  }

  private static String summary(Throwable failure) {
    if (failure == null) {
      return "<null>";
    }
    String message = failure.getMessage();
    String text = message == null ? failure.getClass().getName() : failure.getClass().getName() + ": " + message;
    return Logs.truncate(text, MAX_MESSAGE_BYTES);
  }

  static Throwable unwrap(Throwable failure) {
    Throwable current = failure;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
