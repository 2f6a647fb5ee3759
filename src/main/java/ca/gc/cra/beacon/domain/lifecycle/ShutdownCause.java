package ca.gc.cra.beacon.domain.lifecycle;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable reason attached to a shutdown request.
 *
 * <p>A cause is a value, not an error: signals and normal stops carry no throwable, faults and
 * listener errors carry the failure that triggered them.</p>
 *
 * @param kind category of the trigger
 * @param description signal name, fault class, or free-form reason; never blank
 * @param failure throwable behind a fault or listener error; {@code null} otherwise
 * @since 0.1.0
 */
public record ShutdownCause(Kind kind, String description, Throwable failure) {

  /** Category of a shutdown trigger. */
  public enum Kind {
    /** OS termination signal such as {@code INT} or {@code TERM}. */
    SIGNAL,
    /** Uncaught exception or unobserved asynchronous failure. */
    FAULT,
    /** Fatal error reported by the live listener. */
    LISTENER_ERROR,
    /** Programmatic stop. */
    NORMAL
  }

  public ShutdownCause {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(description, "description");
    if (description.isBlank()) {
      throw new IllegalArgumentException("description must not be blank");
    }
  }

  /**
   * Cause for a received termination signal.
   *
   * @param signalName signal name without the {@code SIG} prefix (e.g. {@code INT})
   * @return signal cause
   */
  public static ShutdownCause signal(String signalName) {
    return new ShutdownCause(Kind.SIGNAL, "SIG" + Objects.requireNonNull(signalName, "signalName"), null);
  }

  /**
   * Cause for an intercepted fault.
   *
   * @param faultClass fault class label, e.g. {@code uncaughtException}
   * @param failure intercepted throwable
   * @return fault cause
   */
  public static ShutdownCause fault(String faultClass, Throwable failure) {
    return new ShutdownCause(Kind.FAULT, faultClass, failure);
  }

  /**
   * Cause for a fatal listener error raised after the listener went live.
   *
   * @param failure listener error
   * @return listener cause
   */
  public static ShutdownCause listenerError(Throwable failure) {
    return new ShutdownCause(Kind.LISTENER_ERROR, "listenerError", failure);
  }

  /**
   * Cause for a programmatic stop.
   *
   * @return normal cause
   */
  public static ShutdownCause normal() {
    return new ShutdownCause(Kind.NORMAL, "normal", null);
  }

  /**
   * Returns the throwable behind this cause, if any.
   *
   * @return optional failure
   */
  public Optional<Throwable> failureIfAny() {
    return Optional.ofNullable(failure);
  }

  @Override
  public String toString() {
    return description;
  }
}
