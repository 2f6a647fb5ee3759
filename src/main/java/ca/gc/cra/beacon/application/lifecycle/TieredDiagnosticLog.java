package ca.gc.cra.beacon.application.lifecycle;

import ca.gc.cra.beacon.application.port.DiagnosticLog;
import java.util.Objects;

/**
 * <strong>What:</strong> Diagnostic log that writes to a console fallback until the structured sink is ready.
 * <p><strong>Why:</strong> Failures raised while the logger itself is being configured still need a channel, and
 * callers should not branch on whether the sink exists.</p>
 * <p><strong>Role:</strong> Owned by {@link LifecycleOrchestrator}; shared with its interceptors.</p>
 * <p><strong>Thread-safety:</strong> The active tier is a volatile reference; upgrades are visible to signal and
 * fault threads immediately.</p>
 *
 * @since 0.1.0
 */
public final class TieredDiagnosticLog implements DiagnosticLog {
  private final DiagnosticLog fallback;
  private volatile DiagnosticLog active;

  /**
   * Creates a log that starts on {@code fallback}.
   *
   * @param fallback console channel used before {@link #upgrade(DiagnosticLog)}
   */
  public TieredDiagnosticLog(DiagnosticLog fallback) {
    this.fallback = Objects.requireNonNull(fallback, "fallback");
    this.active = fallback;
  }

  /**
   * Routes all subsequent messages to the structured sink.
   *
   * @param sink initialized structured log
   */
  public void upgrade(DiagnosticLog sink) {
    this.active = Objects.requireNonNull(sink, "sink");
  }

  /**
   * Indicates whether the structured sink has been installed.
   *
   * @return {@code true} once {@link #upgrade(DiagnosticLog)} succeeded
   */
  public boolean isUpgraded() {
    return active != fallback;
  }

  @Override
  public void debug(String message) {
    active.debug(message);
  }

  @Override
  public void info(String message) {
    active.info(message);
  }

  @Override
  public void warn(String message) {
    active.warn(message);
  }

  @Override
  public void error(String message, Throwable failure) {
    active.error(message, failure);
  }
}
