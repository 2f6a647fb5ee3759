package ca.gc.cra.beacon.config;

import ca.gc.cra.beacon.adapter.kafka.KafkaMessagingTransport;
import ca.gc.cra.beacon.application.lifecycle.LifecycleOrchestrator;
import ca.gc.cra.beacon.application.port.DiagnosticLog;
import ca.gc.cra.beacon.application.port.MetricsPort;
import ca.gc.cra.beacon.application.port.ProcessTerminator;
import ca.gc.cra.beacon.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.beacon.infrastructure.http.JavalinListener;
import ca.gc.cra.beacon.infrastructure.persistence.HikariPersistence;
import ca.gc.cra.beacon.infrastructure.process.JvmFaultHookRegistrar;
import ca.gc.cra.beacon.infrastructure.process.SunMiscSignalRegistrar;
import ca.gc.cra.beacon.logging.LogbackLoggerBootstrap;
import ca.gc.cra.beacon.logging.Logs;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicReference;

/**
 * <strong>What:</strong> Wires the lifecycle orchestrator with its production adapters.
 * <p><strong>Why:</strong> Keeps the entry point free of construction details and gives tests one place to see the
 * startup order: logger, persistence, messaging transport, listener.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded use during startup.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private static final int SUBSYSTEM_WORKERS = 2;

  private final ServiceConfig config;
  private final boolean verbose;

  /**
   * Creates a composition root.
   *
   * @param config effective configuration
   * @param verbose whether DEBUG logging was requested on the command line
   */
  public CompositionRoot(ServiceConfig config, boolean verbose) {
    this.config = Objects.requireNonNull(config, "config");
    this.verbose = verbose;
  }

  /**
   * Builds the orchestrator for the configured service.
   *
   * @param metrics metrics sink
   * @param terminator process terminator
   * @param fallbackLog console channel used until logging is configured
   * @return orchestrator in {@code NOT_STARTED}
   */
  public LifecycleOrchestrator orchestrator(
      MetricsPort metrics, ProcessTerminator terminator, DiagnosticLog fallbackLog) {
    ExecutorService subsystemPool = ExecutorFactories.newSubsystemPool(SUBSYSTEM_WORKERS, "beacon-subsystem");
    AtomicReference<LifecycleOrchestrator> self = new AtomicReference<>();

    LifecycleOrchestrator.Builder builder = LifecycleOrchestrator.builder()
        .host(config.host())
        .port(config.port())
        .loggerBootstrap(new LogbackLoggerBootstrap(
            config.logging().configFile().orElse(null), config.logging().level(), verbose))
        .subsystem(new HikariPersistence(config.database(), subsystemPool));
    if (config.messaging().enabled()) {
      builder.subsystem(new KafkaMessagingTransport(config.messaging(), subsystemPool));
    }
    LifecycleOrchestrator orchestrator = builder
        .listener(new JavalinListener(() -> self.get().state()))
        .signals(new SunMiscSignalRegistrar())
        .faultHooks(new JvmFaultHookRegistrar())
        .terminator(terminator)
        .metrics(metrics)
        .fallbackLog(fallbackLog)
        .build();
    self.set(orchestrator);
    return orchestrator;
  }

  /**
   * Describes the startup plan without starting anything.
   *
   * @return human readable lines, secrets redacted
   */
  public List<String> describePlan() {
    List<String> lines = new ArrayList<>();
    lines.add("BEACON startup plan");
    lines.add("  1. logger       level=" + config.logging().level()
        + config.logging().configFile().map(path -> " config=" + path).orElse(""));
    lines.add("  2. persistence  url=" + config.database().url()
        + " username=" + config.database().username()
        + " password=" + Logs.redact(config.database().password())
        + " maxPoolSize=" + config.database().maxPoolSize());
    if (config.messaging().enabled()) {
      lines.add("  3. messaging    bootstrap=" + config.messaging().bootstrap()
          + " topic=" + config.messaging().topic()
          + " maxBlockMs=" + config.messaging().maxBlockMs());
    } else {
      lines.add("  3. messaging    disabled");
    }
    lines.add("  4. listener     " + config.host() + ":" + config.port() + " readiness=" + JavalinListener.HEALTH_PATH);
    lines.add("  metrics exporter=" + config.telemetry().exporter());
    return lines;
  }
}
