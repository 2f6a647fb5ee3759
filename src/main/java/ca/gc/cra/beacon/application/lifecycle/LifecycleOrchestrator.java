package ca.gc.cra.beacon.application.lifecycle;

import ca.gc.cra.beacon.application.port.DiagnosticLog;
import ca.gc.cra.beacon.application.port.FaultHookRegistrar;
import ca.gc.cra.beacon.application.port.ListenerHandle;
import ca.gc.cra.beacon.application.port.ListenerPort;
import ca.gc.cra.beacon.application.port.LoggerBootstrap;
import ca.gc.cra.beacon.application.port.MetricsPort;
import ca.gc.cra.beacon.application.port.ProcessTerminator;
import ca.gc.cra.beacon.application.port.SignalRegistrar;
import ca.gc.cra.beacon.application.port.Subsystem;
import ca.gc.cra.beacon.domain.lifecycle.ExitCode;
import ca.gc.cra.beacon.domain.lifecycle.ServiceState;
import ca.gc.cra.beacon.domain.lifecycle.ShutdownCause;
import ca.gc.cra.beacon.infrastructure.exec.ExecutorFactories;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * <strong>What:</strong> Drives the BEACON service through startup, live traffic, and teardown.
 * <p><strong>Why:</strong> Dependent subsystems must come up in order, traffic must only be accepted once all of
 * them are ready, and every exit path must release what was acquired and end the process with a deterministic
 * status.</p>
 * <p><strong>Role:</strong> Application service owning the {@link ServiceState} machine. Startup runs on the
 * caller's thread; teardown runs on a dedicated lifecycle thread so that signal dispatch, fault handlers, and
 * listener threads return immediately.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Initialize the logger, then each {@link Subsystem} in order, then bind the listener.</li>
 *   <li>Release already acquired subsystems in reverse order when startup or binding fails.</li>
 *   <li>Install signal and fault interceptors once {@link ServiceState#RUNNING} is reached.</li>
 *   <li>Collapse concurrent shutdown triggers into a single ordered teardown.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Every state change is a compare-and-set on one {@link AtomicReference}; no
 * locks are taken.</p>
 * <p><strong>Observability:</strong> Logs with {@code [startup]}, {@code [listener]}, and {@code [shutdown]} tags
 * and records {@code lifecycle.*} metrics.</p>
 *
 * @since 0.1.0
 */
public final class LifecycleOrchestrator {
  static final String METRIC_STARTUP_DURATION = "lifecycle.startup.duration.ms";
  static final String METRIC_STARTUP_FAILURE = "lifecycle.startup.failure";
  static final String METRIC_BIND_FAILURE = "lifecycle.bind.failure";
  static final String METRIC_SHUTDOWN_TRIGGERED = "lifecycle.shutdown.triggered";
  static final String METRIC_TEARDOWN_FAILURE = "lifecycle.teardown.failure";
  static final String METRIC_SHUTDOWN_DURATION = "lifecycle.shutdown.duration.ms";
  static final String READINESS_PATH = "/health";

  private final String host;
  private final int port;
  private final LoggerBootstrap loggerBootstrap;
  private final List<Subsystem> subsystems;
  private final ListenerPort listenerPort;
  private final SignalRegistrar signalRegistrar;
  private final FaultHookRegistrar faultHookRegistrar;
  private final ProcessTerminator terminator;
  private final MetricsPort metrics;
  private final TieredDiagnosticLog log;
  private final SignalInterceptor signalInterceptor;
  private final FaultInterceptor faultInterceptor;
  private final ThreadFactory shutdownThreads;

  private final AtomicReference<ServiceState> state = new AtomicReference<>(ServiceState.NOT_STARTED);
  private final List<Subsystem> acquired = new CopyOnWriteArrayList<>();
  private final CountDownLatch terminated = new CountDownLatch(1);
  private final AtomicBoolean finished = new AtomicBoolean();
  private volatile ListenerHandle listener;
  private volatile ExitCode exitCode;
  private volatile long startedNanos;

  private LifecycleOrchestrator(Builder builder) {
    this.host = Objects.requireNonNull(builder.host, "host");
    this.port = builder.port;
    this.loggerBootstrap = Objects.requireNonNull(builder.loggerBootstrap, "loggerBootstrap");
    this.subsystems = List.copyOf(builder.subsystems);
    this.listenerPort = Objects.requireNonNull(builder.listenerPort, "listenerPort");
    this.signalRegistrar = Objects.requireNonNull(builder.signalRegistrar, "signalRegistrar");
    this.faultHookRegistrar = Objects.requireNonNull(builder.faultHookRegistrar, "faultHookRegistrar");
    this.terminator = Objects.requireNonNull(builder.terminator, "terminator");
    this.metrics = builder.metrics == null ? MetricsPort.NO_OP : builder.metrics;
    this.log = new TieredDiagnosticLog(Objects.requireNonNull(builder.fallbackLog, "fallbackLog"));
    this.signalInterceptor = new SignalInterceptor(log, this::shutdown);
    this.faultInterceptor = new FaultInterceptor(log, this::shutdown);
    this.shutdownThreads = ExecutorFactories.newLifecycleThreadFactory("beacon-shutdown", false,
        (thread, ex) -> log.error("[shutdown] Lifecycle thread " + thread.getName() + " failed", ex));
  }

  /**
   * Creates a builder for an orchestrator.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Runs the startup sequence on the calling thread.
   *
   * <p>Failures never escape: they are logged, acquired subsystems are released, and the process terminator is
   * called with {@link ExitCode#FAILURE}. This holds for errors as well as exceptions.</p>
   *
   * @throws DuplicateStartException when the orchestrator already left {@link ServiceState#NOT_STARTED}
   */
  public void start() {
    if (!transition(ServiceState.NOT_STARTED, ServiceState.STARTING)) {
      throw new DuplicateStartException(state.get());
    }
    startedNanos = System.nanoTime();
    try {
      runStartup();
    } catch (Throwable ex) {
      onStartupAborted(ex);
    }
  }

  /**
   * Requests an ordered teardown.
   *
   * <p>Only the first request made while {@link ServiceState#RUNNING} starts a teardown; every other call returns
   * without side effects.</p>
   *
   * @param cause reason for the request
   * @return {@code true} when this call started the teardown
   */
  public boolean shutdown(ShutdownCause cause) {
    Objects.requireNonNull(cause, "cause");
    if (!transition(ServiceState.RUNNING, ServiceState.SHUTTING_DOWN)) {
      log.debug("[shutdown] Ignoring " + cause + " in state " + state.get());
      return false;
    }
    metrics.increment(METRIC_SHUTDOWN_TRIGGERED);
    log.info("[shutdown] Shutting down (" + cause + ")");
    Thread worker = shutdownThreads.newThread(() -> teardown(cause));
    worker.start();
    return true;
  }

  /**
   * Requests a normal programmatic stop.
   *
   * @return {@code true} when this call started the teardown
   */
  public boolean requestShutdown() {
    return shutdown(ShutdownCause.normal());
  }

  /**
   * Blocks until the orchestrator reaches {@link ServiceState#STOPPED} or {@link ServiceState#FAILED}.
   *
   * @return exit code handed to the process terminator
   * @throws InterruptedException if the waiting thread is interrupted
   */
  public ExitCode awaitTermination() throws InterruptedException {
    terminated.await();
    return exitCode;
  }

  /**
   * Bounded variant of {@link #awaitTermination()}.
   *
   * @param timeout maximum wait
   * @param unit unit of {@code timeout}
   * @return {@code true} when a terminal state was reached in time
   * @throws InterruptedException if the waiting thread is interrupted
   */
  public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
    return terminated.await(timeout, unit) && state.get().isTerminal();
  }

  /**
   * Current lifecycle state.
   *
   * @return state snapshot
   */
  public ServiceState state() {
    return state.get();
  }

  /**
   * Fault interceptor owned by this orchestrator, for routing fire-and-forget work.
   *
   * @return fault interceptor
   */
  public FaultInterceptor faultInterceptor() {
    return faultInterceptor;
  }

  private void runStartup() {
    try {
      log.upgrade(loggerBootstrap.initialize());
    } catch (RuntimeException | Error ex) {
      log.error("[startup] Logger initialization failed", ex);
      failStartup(new StartupFailureException("logger", ex));
      return;
    }
    log.info("[startup] Starting service (" + subsystems.size() + " subsystems)");

    for (Subsystem subsystem : subsystems) {
      log.info("[startup] Initializing " + subsystem.name());
      try {
        subsystem.init().join();
      } catch (RuntimeException | Error ex) {
        failStartup(new StartupFailureException(subsystem.name(), FaultInterceptor.unwrap(ex)));
        return;
      }
      acquired.add(subsystem);
      log.info("[startup] " + subsystem.name() + " ready");
    }

    bindListener();
  }

  // Last resort for anything thrown outside the per-step handlers, including the ready callback.
  private void onStartupAborted(Throwable failure) {
    if (state.get() == ServiceState.RUNNING) {
      log.error("[startup] Post-bind setup failed", failure);
      shutdown(ShutdownCause.fault(failure.getClass().getSimpleName(), failure));
      return;
    }
    failStartup(new StartupFailureException("startup sequence", failure));
  }

  private void bindListener() {
    log.info("[startup] Binding listener on " + host + ":" + port);
    ListenerHandle handle;
    try {
      handle = listenerPort.listen(host, port);
    } catch (RuntimeException | Error ex) {
      onBindFailure(ex);
      return;
    }
    listener = handle;
    handle.onError(this::onListenerError);
    handle.onReady(() -> onListenerReady(handle));
  }

  private void onListenerReady(ListenerHandle handle) {
    if (!transition(ServiceState.STARTING, ServiceState.RUNNING)) {
      log.debug("[listener] Ready event ignored in state " + state.get());
      return;
    }
    InetSocketAddress address = handle.address();
    int boundPort = address == null ? port : address.getPort();
    log.info("[listener] Server is running on http://localhost:" + boundPort);
    log.info("[listener] Readiness endpoint http://localhost:" + boundPort + READINESS_PATH);
    signalInterceptor.install(signalRegistrar);
    faultInterceptor.install(faultHookRegistrar);
    metrics.observe(METRIC_STARTUP_DURATION, elapsedMillis(startedNanos));
  }

  private void onListenerError(Throwable failure) {
    ServiceState current = state.get();
    if (current.isTerminal()) {
      log.debug("[listener] Listener error after termination (" + current + "): " + failure);
    } else if (current == ServiceState.STARTING) {
      onBindFailure(failure);
    } else if (current == ServiceState.RUNNING) {
      log.error("[listener] Listener error", failure);
      shutdown(ShutdownCause.listenerError(failure));
    } else {
      log.debug("[listener] Listener error ignored in state " + current + ": " + failure);
    }
  }

  private void onBindFailure(Throwable failure) {
    if (!transition(ServiceState.STARTING, ServiceState.FAILED)) {
      log.debug("[startup] Bind failure ignored in state " + state.get());
      return;
    }
    try {
      BindFailureException bindFailure = new BindFailureException(host, port, FaultInterceptor.unwrap(failure));
      metrics.increment(METRIC_BIND_FAILURE);
      log.error("[startup] " + bindFailure.getMessage(), bindFailure.getCause());
      if (bindFailure.addressInUse()) {
        log.error("[startup] Port " + port + " is already in use", null);
      }
      releaseAcquired();
    } finally {
      finish(ExitCode.FAILURE);
    }
  }

  private void failStartup(StartupFailureException failure) {
    if (!transition(ServiceState.STARTING, ServiceState.FAILED)) {
      log.debug("[startup] Startup failure recorded in state " + state.get());
    }
    try {
      metrics.increment(METRIC_STARTUP_FAILURE);
      log.error("[startup] " + failure.getMessage(), failure.getCause());
      releaseAcquired();
    } finally {
      finish(ExitCode.FAILURE);
    }
  }

  private void teardown(ShutdownCause cause) {
    long teardownStarted = System.nanoTime();
    List<TeardownFailureException> failures = new ArrayList<>();
    ExitCode outcome = ExitCode.FAILURE;
    try {
      ListenerHandle handle = listener;
      if (handle != null) {
        try {
          handle.close().join();
          log.info("[shutdown] Listener closed");
        } catch (Throwable ex) {
          failures.add(new TeardownFailureException("listener", FaultInterceptor.unwrap(ex)));
        }
      }
      failures.addAll(releaseAcquired());
      metrics.observe(METRIC_SHUTDOWN_DURATION, elapsedMillis(teardownStarted));

      if (failures.isEmpty()) {
        log.info("[shutdown] Graceful shutdown completed (" + cause + ")");
        transition(ServiceState.SHUTTING_DOWN, ServiceState.STOPPED);
        outcome = ExitCode.SUCCESS;
        return;
      }
      for (TeardownFailureException failure : failures) {
        metrics.increment(METRIC_TEARDOWN_FAILURE);
        log.error("[shutdown] " + failure.getMessage(), failure.getCause());
      }
      transition(ServiceState.SHUTTING_DOWN, ServiceState.FAILED);
      log.error("[shutdown] Shutdown completed with " + failures.size() + " error(s) (" + cause + ")", null);
    } catch (Throwable ex) {
      outcome = ExitCode.FAILURE;
      transition(ServiceState.SHUTTING_DOWN, ServiceState.FAILED);
      log.error("[shutdown] Shutdown sequence aborted (" + cause + ")", ex);
    } finally {
      finish(outcome);
    }
  }

  private List<TeardownFailureException> releaseAcquired() {
    List<TeardownFailureException> failures = new ArrayList<>();
    for (int i = acquired.size() - 1; i >= 0; i--) {
      Subsystem subsystem = acquired.get(i);
      try {
        subsystem.release().join();
        log.info("[shutdown] " + subsystem.name() + " released");
      } catch (Throwable ex) {
        TeardownFailureException failure =
            new TeardownFailureException(subsystem.name(), FaultInterceptor.unwrap(ex));
        log.warn("[shutdown] " + failure.getMessage());
        failures.add(failure);
      }
    }
    acquired.clear();
    return failures;
  }

  /**
   * Moves the state machine from {@code from} to {@code to}.
   *
   * @return {@code false} when another thread moved the state first
   * @throws IllegalStateException when the state machine forbids the move
   */
  private boolean transition(ServiceState from, ServiceState to) {
    if (!from.canTransitionTo(to)) {
      throw new IllegalStateException("Illegal lifecycle transition " + from + " -> " + to);
    }
    return state.compareAndSet(from, to);
  }

  private void finish(ExitCode code) {
    if (!finished.compareAndSet(false, true)) {
      return;
    }
    ServiceState current = state.get();
    if (!current.isTerminal() && current.canTransitionTo(ServiceState.FAILED)) {
      state.compareAndSet(current, ServiceState.FAILED);
    }
    exitCode = code;
    try {
      terminator.exit(code);
    } finally {
      terminated.countDown();
    }
  }

  private static long elapsedMillis(long sinceNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - sinceNanos);
  }

  /** Collects the collaborators of a {@link LifecycleOrchestrator}. */
  public static final class Builder {
    private String host = "0.0.0.0";
    private int port = 3000;
    private LoggerBootstrap loggerBootstrap;
    private final List<Subsystem> subsystems = new ArrayList<>();
    private ListenerPort listenerPort;
    private SignalRegistrar signalRegistrar;
    private FaultHookRegistrar faultHookRegistrar;
    private ProcessTerminator terminator;
    private MetricsPort metrics;
    private DiagnosticLog fallbackLog;

    private Builder() {}

    public Builder host(String host) {
      this.host = host;
      return this;
    }

    public Builder port(int port) {
      this.port = port;
      return this;
    }

    public Builder loggerBootstrap(LoggerBootstrap loggerBootstrap) {
      this.loggerBootstrap = loggerBootstrap;
      return this;
    }

    /**
     * Appends a subsystem; subsystems initialize in the order they are added and release in reverse.
     *
     * @param subsystem subsystem to manage
     * @return this builder
     */
    public Builder subsystem(Subsystem subsystem) {
      subsystems.add(Objects.requireNonNull(subsystem, "subsystem"));
      return this;
    }

    public Builder listener(ListenerPort listenerPort) {
      this.listenerPort = listenerPort;
      return this;
    }

    public Builder signals(SignalRegistrar signalRegistrar) {
      this.signalRegistrar = signalRegistrar;
      return this;
    }

    public Builder faultHooks(FaultHookRegistrar faultHookRegistrar) {
      this.faultHookRegistrar = faultHookRegistrar;
      return this;
    }

    public Builder terminator(ProcessTerminator terminator) {
      this.terminator = terminator;
      return this;
    }

    public Builder metrics(MetricsPort metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Console channel used until the logger bootstrap completes.
     *
     * @param fallbackLog fallback log
     * @return this builder
     */
    public Builder fallbackLog(DiagnosticLog fallbackLog) {
      this.fallbackLog = fallbackLog;
      return this;
    }

    public LifecycleOrchestrator build() {
      return new LifecycleOrchestrator(this);
    }
  }
}
