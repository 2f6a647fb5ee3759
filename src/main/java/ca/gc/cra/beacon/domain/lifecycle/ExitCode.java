package ca.gc.cra.beacon.domain.lifecycle;

/**
 * <strong>What:</strong> Canonical process exit codes for the BEACON service.
 * <p><strong>Why:</strong> Provides consistent process status semantics so supervisors and automation can react
 * deterministically.</p>
 * <p><strong>Role:</strong> Returned by the CLI entry point and passed to the process terminator by the
 * lifecycle orchestrator.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Clean shutdown. */
  SUCCESS(0),
  /** Startup, bind, or teardown failure. */
  FAILURE(1),
  /** Command-line arguments or configuration values were invalid. */
  INVALID_ARGS(2);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
