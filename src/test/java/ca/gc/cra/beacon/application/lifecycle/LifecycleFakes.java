package ca.gc.cra.beacon.application.lifecycle;

import ca.gc.cra.beacon.application.port.DiagnosticLog;
import ca.gc.cra.beacon.application.port.FaultHookRegistrar;
import ca.gc.cra.beacon.application.port.ListenerHandle;
import ca.gc.cra.beacon.application.port.ListenerPort;
import ca.gc.cra.beacon.application.port.MetricsPort;
import ca.gc.cra.beacon.application.port.ProcessTerminator;
import ca.gc.cra.beacon.application.port.SignalRegistrar;
import ca.gc.cra.beacon.application.port.Subsystem;
import ca.gc.cra.beacon.domain.lifecycle.ExitCode;
import ca.gc.cra.beacon.infrastructure.http.ReplayingListenerHandle;
import java.lang.Thread.UncaughtExceptionHandler;
import java.net.InetSocketAddress;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * In-memory port implementations shared by the lifecycle tests.
 */
final class LifecycleFakes {
  private LifecycleFakes() {}

  /** Records every exit request instead of ending the JVM. */
  static final class RecordingTerminator implements ProcessTerminator {
    final List<ExitCode> exits = new CopyOnWriteArrayList<>();

    @Override
    public void exit(ExitCode code) {
      exits.add(code);
    }
  }

  /** Collects log lines prefixed with their level. */
  static final class RecordingLog implements DiagnosticLog {
    final List<String> lines = new CopyOnWriteArrayList<>();
    final List<Throwable> failures = new CopyOnWriteArrayList<>();

    @Override
    public void debug(String message) {
      lines.add("DEBUG " + message);
    }

    @Override
    public void info(String message) {
      lines.add("INFO " + message);
    }

    @Override
    public void warn(String message) {
      lines.add("WARN " + message);
    }

    @Override
    public void error(String message, Throwable failure) {
      lines.add("ERROR " + message);
      if (failure != null) {
        failures.add(failure);
      }
    }

    boolean contains(String fragment) {
      return lines.stream().anyMatch(line -> line.contains(fragment));
    }

    long count(String fragment) {
      return lines.stream().filter(line -> line.contains(fragment)).count();
    }
  }

  /** Subsystem whose init and release outcomes are scripted by the test. */
  static final class FakeSubsystem implements Subsystem {
    private final String name;
    private final List<String> events;
    private final Supplier<CompletableFuture<Void>> initBehavior;
    private final Supplier<CompletableFuture<Void>> releaseBehavior;
    final AtomicInteger inits = new AtomicInteger();
    final AtomicInteger releases = new AtomicInteger();

    FakeSubsystem(String name, List<String> events) {
      this(name, events, () -> CompletableFuture.completedFuture(null),
          () -> CompletableFuture.completedFuture(null));
    }

    FakeSubsystem(
        String name,
        List<String> events,
        Supplier<CompletableFuture<Void>> initBehavior,
        Supplier<CompletableFuture<Void>> releaseBehavior) {
      this.name = name;
      this.events = events;
      this.initBehavior = initBehavior;
      this.releaseBehavior = releaseBehavior;
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public CompletableFuture<Void> init() {
      inits.incrementAndGet();
      events.add(name + ":init");
      return initBehavior.get();
    }

    @Override
    public CompletableFuture<Void> release() {
      releases.incrementAndGet();
      events.add(name + ":release");
      return releaseBehavior.get();
    }
  }

  /** Handle whose ready and error events are fired by the test. */
  static final class FakeListenerHandle extends ReplayingListenerHandle {
    private final List<String> events;
    private final int port;
    volatile CompletableFuture<Void> closeResult = CompletableFuture.completedFuture(null);
    final AtomicInteger closes = new AtomicInteger();

    FakeListenerHandle(List<String> events, int port) {
      this.events = events;
      this.port = port;
    }

    void ready() {
      fireReady();
    }

    void error(Throwable failure) {
      fireError(failure);
    }

    @Override
    public InetSocketAddress address() {
      return InetSocketAddress.createUnresolved("0.0.0.0", port);
    }

    @Override
    public CompletableFuture<Void> close() {
      closes.incrementAndGet();
      events.add("listener:close");
      return closeResult;
    }
  }

  /** Listener port that hands out a {@link FakeListenerHandle}, firing ready or error immediately when scripted. */
  static final class FakeListenerPort implements ListenerPort {
    enum Mode { READY, ERROR, THROW, MANUAL }

    private final List<String> events;
    private final Mode mode;
    private final RuntimeException failure;
    final AtomicInteger listens = new AtomicInteger();
    volatile FakeListenerHandle handle;

    FakeListenerPort(List<String> events, Mode mode, RuntimeException failure) {
      this.events = events;
      this.mode = mode;
      this.failure = failure;
    }

    static FakeListenerPort ready(List<String> events) {
      return new FakeListenerPort(events, Mode.READY, null);
    }

    @Override
    public ListenerHandle listen(String host, int port) {
      listens.incrementAndGet();
      events.add("listen:" + host + ":" + port);
      if (mode == Mode.THROW) {
        throw failure;
      }
      FakeListenerHandle created = new FakeListenerHandle(events, port);
      handle = created;
      if (mode == Mode.READY) {
        created.ready();
      } else if (mode == Mode.ERROR) {
        created.error(failure);
      }
      return created;
    }
  }

  /** Stores signal handlers so tests can raise signals synthetically. */
  static final class FakeSignalRegistrar implements SignalRegistrar {
    final Map<String, Runnable> handlers = new ConcurrentHashMap<>();
    private final Set<String> reserved;

    FakeSignalRegistrar() {
      this(Set.of());
    }

    FakeSignalRegistrar(Set<String> reserved) {
      this.reserved = reserved;
    }

    @Override
    public boolean register(String signalName, Runnable handler) {
      if (reserved.contains(signalName)) {
        return false;
      }
      handlers.put(signalName, handler);
      return true;
    }

    void raise(String signalName) {
      Runnable handler = handlers.get(signalName);
      if (handler == null) {
        throw new IllegalStateException("no handler for SIG" + signalName);
      }
      handler.run();
    }
  }

  /** Keeps the installed handler instead of replacing the JVM default. */
  static final class FakeFaultHookRegistrar implements FaultHookRegistrar {
    volatile UncaughtExceptionHandler installed;

    @Override
    public void install(UncaughtExceptionHandler handler) {
      installed = handler;
    }
  }

  /** Metrics port keeping counters and last observations in memory. */
  static final class RecordingMetrics implements MetricsPort {
    final Map<String, AtomicInteger> counters = new ConcurrentHashMap<>();
    final Map<String, Long> observations = new ConcurrentHashMap<>();

    @Override
    public void increment(String key) {
      counters.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
    }

    @Override
    public void observe(String key, long value) {
      observations.put(key, value);
    }

    int counter(String key) {
      AtomicInteger value = counters.get(key);
      return value == null ? 0 : value.get();
    }
  }
}
