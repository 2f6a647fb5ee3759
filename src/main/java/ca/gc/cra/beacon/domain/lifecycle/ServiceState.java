package ca.gc.cra.beacon.domain.lifecycle;

import java.util.EnumSet;
import java.util.Set;

/**
 * <strong>What:</strong> Lifecycle states of a BEACON service process.
 * <p><strong>Why:</strong> Gives startup, shutdown, and interceptors one shared vocabulary so a trigger can decide
 * whether it is allowed to act.</p>
 * <p><strong>Role:</strong> Domain value owned by a single {@code LifecycleOrchestrator}; never held in static state.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable; transitions are applied with compare-and-set by
 * the owner.</p>
 *
 * @since 0.1.0
 */
public enum ServiceState {
  /** Created, nothing initialized yet. */
  NOT_STARTED,
  /** Startup sequence in progress. */
  STARTING,
  /** Listener bound; traffic accepted. */
  RUNNING,
  /** Teardown in progress. */
  SHUTTING_DOWN,
  /** Teardown completed cleanly. */
  STOPPED,
  /** Startup or teardown failed; the process exits abnormally. */
  FAILED;

  private Set<ServiceState> successors;

  static {
    NOT_STARTED.successors = EnumSet.of(STARTING);
    STARTING.successors = EnumSet.of(RUNNING, FAILED);
    RUNNING.successors = EnumSet.of(SHUTTING_DOWN);
    SHUTTING_DOWN.successors = EnumSet.of(STOPPED, FAILED);
    STOPPED.successors = EnumSet.noneOf(ServiceState.class);
    FAILED.successors = EnumSet.noneOf(ServiceState.class);
  }

  /**
   * Indicates whether the state machine permits moving from this state to {@code next}.
   *
   * @param next candidate successor
   * @return {@code true} when the transition is legal
   */
  public boolean canTransitionTo(ServiceState next) {
    return next != null && successors.contains(next);
  }

  /**
   * Indicates whether the process has reached an exit state.
   *
   * @return {@code true} for {@link #STOPPED} and {@link #FAILED}
   */
  public boolean isTerminal() {
    return this == STOPPED || this == FAILED;
  }
}
