package ca.gc.cra.beacon.application.lifecycle;

/**
 * Captures a failed release step. Teardown continues after one is recorded; any recorded failure makes the
 * process exit with {@code FAILURE}.
 *
 * @since 0.1.0
 */
public final class TeardownFailureException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String step;

  public TeardownFailureException(String step, Throwable cause) {
    super("Failed to release " + step + ": " + StartupFailureException.describe(cause), cause);
    this.step = step;
  }

  /**
   * Release step that failed, e.g. {@code listener} or {@code persistence}.
   *
   * @return step label
   */
  public String step() {
    return step;
  }
}
