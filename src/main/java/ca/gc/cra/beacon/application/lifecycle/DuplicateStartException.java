package ca.gc.cra.beacon.application.lifecycle;

import ca.gc.cra.beacon.domain.lifecycle.ServiceState;

/**
 * Thrown when {@link LifecycleOrchestrator#start()} is invoked on an orchestrator that already left
 * {@link ServiceState#NOT_STARTED}.
 *
 * @since 0.1.0
 */
public final class DuplicateStartException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  private final transient ServiceState observed;

  public DuplicateStartException(ServiceState observed) {
    super("Service already started (state=" + observed + ")");
    this.observed = observed;
  }

  /**
   * State seen when the duplicate call was rejected.
   *
   * @return observed state
   */
  public ServiceState observed() {
    return observed;
  }
}
