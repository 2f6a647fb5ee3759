package ca.gc.cra.beacon.logging;

import ca.gc.cra.beacon.application.lifecycle.LifecycleOrchestrator;
import ca.gc.cra.beacon.application.port.DiagnosticLog;
import ca.gc.cra.beacon.application.port.LoggerBootstrap;
import java.nio.file.Path;
import org.slf4j.LoggerFactory;

/**
 * Logger bootstrap that configures Logback and hands back an SLF4J-backed diagnostic log.
 *
 * @since 0.1.0
 */
public final class LogbackLoggerBootstrap implements LoggerBootstrap {
  private final Path configFile;
  private final String level;
  private final boolean verbose;

  /**
   * Creates a bootstrap.
   *
   * @param configFile optional external Logback file; {@code null} keeps the classpath configuration
   * @param level root level; blank keeps the configured level
   * @param verbose forces DEBUG after the file and level are applied
   */
  public LogbackLoggerBootstrap(Path configFile, String level, boolean verbose) {
    this.configFile = configFile;
    this.level = level;
    this.verbose = verbose;
  }

  @Override
  public DiagnosticLog initialize() {
    LoggingConfigurator.configure(configFile, level);
    if (verbose) {
      LoggingConfigurator.enableVerboseLogging();
    }
    return new Slf4jDiagnosticLog(LoggerFactory.getLogger(LifecycleOrchestrator.class));
  }
}
