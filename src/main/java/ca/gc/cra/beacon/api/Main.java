package ca.gc.cra.beacon.api;

import ca.gc.cra.beacon.application.lifecycle.LifecycleOrchestrator;
import ca.gc.cra.beacon.config.CompositionRoot;
import ca.gc.cra.beacon.config.ConfigLoader;
import ca.gc.cra.beacon.config.ServiceConfig;
import ca.gc.cra.beacon.domain.lifecycle.ExitCode;
import ca.gc.cra.beacon.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.beacon.infrastructure.process.JvmProcessTerminator;
import ca.gc.cra.beacon.logging.ConsoleDiagnosticLog;
import ca.gc.cra.beacon.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * BEACON entry point: resolves configuration, then runs the service until it shuts down.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: beacon [--help] [--verbose] [--dry-run] [key=value ...]";
  private static final String HELP_TEXT = """
      BEACON service

      Usage:
        beacon [flags] [key=value ...]

      Flags:
        --help      Show this message
        --verbose   Enable DEBUG logging
        --dry-run   Print the startup plan and exit without starting anything

      Keys (CLI > environment > YAML > defaults):
        config=PATH               YAML file with 'common' and 'serve' sections
        port=3000                 Listener port (PORT)
        host=0.0.0.0              Listener interface (HOST)
        database.url=...          JDBC URL (DB_URL)
        database.username=sa      Database user (DB_USERNAME)
        database.password=        Database password (DB_PASSWORD)
        database.maxPoolSize=10   Pool size (DB_MAX_POOL_SIZE)
        messaging.enabled=true    Register the Kafka transport (MESSAGING_ENABLED)
        messaging.bootstrap=...   Kafka bootstrap servers (KAFKA_BOOTSTRAP)
        messaging.topic=...       Outbound topic (KAFKA_TOPIC)
        messaging.maxBlockMs=...  Metadata fetch bound (KAFKA_MAX_BLOCK_MS)
        logging.level=INFO        Root log level (LOG_LEVEL)
        logging.config=PATH       External Logback file (LOGBACK_CONFIG)
        metricsExporter=none      otlp|none (OTEL_METRICS_EXPORTER)
        otelEndpoint=URL          OTLP endpoint (OTEL_EXPORTER_OTLP_ENDPOINT)

      Exit codes: 0 clean shutdown, 1 startup or teardown failure, 2 invalid arguments
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args, System.getenv(), Main::serve);
    System.exit(exit.code());
  }

  /**
   * Parses arguments and either prints help, prints the plan, or launches the service.
   *
   * @param args raw CLI arguments
   * @param environment environment snapshot
   * @param launcher runs the service for a resolved configuration
   * @return exit code without terminating the JVM
   */
  static ExitCode run(String[] args, Map<String, String> environment, Launcher launcher) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled");
    }
    Set<String> unknownFlags = input.unknownFlags();
    if (!unknownFlags.isEmpty()) {
      log.error("Unknown flag(s): {}", unknownFlags);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    ServiceConfig config;
    try {
      config = ConfigLoader.load(CliArgsParser.toMap(input.keyValueArgs()), environment);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration: {}", ex.getMessage(), ex);
      return ExitCode.INVALID_ARGS;
    }

    CompositionRoot root = new CompositionRoot(config, input.verbose());
    if (input.dryRun()) {
      List<String> plan = root.describePlan();
      CliPrinter.printLines(plan);
      log.info("Dry run complete; nothing started");
      return ExitCode.SUCCESS;
    }
    try {
      TelemetryConfigurator.configureMetrics(config.telemetry());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    }
    return launcher.launch(root);
  }

  private static ExitCode serve(CompositionRoot root) {
    OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter();
    LifecycleOrchestrator orchestrator = root.orchestrator(
        metrics, new JvmProcessTerminator(List.of(metrics)), new ConsoleDiagnosticLog());
    orchestrator.start();
    try {
      return orchestrator.awaitTermination();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for shutdown; requesting stop");
      orchestrator.requestShutdown();
      return ExitCode.FAILURE;
    }
  }

  /** Runs the service for a resolved configuration. */
  @FunctionalInterface
  interface Launcher {
    ExitCode launch(CompositionRoot root);
  }
}
