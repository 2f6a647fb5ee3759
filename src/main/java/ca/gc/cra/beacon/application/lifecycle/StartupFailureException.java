package ca.gc.cra.beacon.application.lifecycle;

import java.util.Objects;

/**
 * Raised when a subsystem initializer fails before the listener is live.
 *
 * @since 0.1.0
 */
public final class StartupFailureException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String subsystem;

  public StartupFailureException(String subsystem, Throwable cause) {
    super("Failed to initialize " + Objects.requireNonNull(subsystem, "subsystem") + ": " + describe(cause), cause);
    this.subsystem = subsystem;
  }

  /**
   * Name of the subsystem whose initializer failed.
   *
   * @return subsystem name
   */
  public String subsystem() {
    return subsystem;
  }

  static String describe(Throwable cause) {
    if (cause == null) {
      return "unknown error";
    }
    String message = cause.getMessage();
    return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
  }
}
