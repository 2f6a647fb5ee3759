package ca.gc.cra.beacon.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Configures BEACON runtime logging from configuration and CLI flags.
 * <p><strong>Why:</strong> Allows operators to point the service at an external Logback file or raise verbosity
 * without rebuilding the artifact.</p>
 * <p><strong>Role:</strong> Adapter-side utility that bridges configuration to the logging backend.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Load an optional external Logback configuration through Joran.</li>
 *   <li>Apply the configured root level.</li>
 *   <li>Warn when the backend does not support dynamic level changes.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Intended for the single startup thread; races with concurrent Logback
 * reconfiguration may produce undefined results.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to warning and retain defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Applies an optional external configuration file and the root level.
   *
   * @param configFile Logback XML file; {@code null} keeps the classpath configuration
   * @param level root level name such as {@code INFO}; blank keeps the configured level
   * @throws IllegalStateException when the file is missing or cannot be parsed
   * @throws IllegalArgumentException when {@code level} is not a Logback level
   */
  public static void configure(Path configFile, String level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn("Logging configuration requested but backend {} is not Logback; keeping defaults",
          factory.getClass().getName());
      return;
    }
    if (configFile != null) {
      loadExternal(context, configFile);
    }
    if (level != null && !level.isBlank()) {
      context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(parseLevel(level));
    }
  }

  /**
   * Elevates the root logger level to DEBUG within the running JVM.
   */
  public static void enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!Level.DEBUG.equals(root.getLevel())) {
        root.setLevel(Level.DEBUG);
      }
      return;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
  }

  static Level parseLevel(String raw) {
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    Level parsed = Level.toLevel(normalized, null);
    if (parsed == null) {
      throw new IllegalArgumentException("logging.level must be one of TRACE, DEBUG, INFO, WARN, ERROR, OFF (was "
          + raw + ")");
    }
    return parsed;
  }

  private static void loadExternal(LoggerContext context, Path configFile) {
    if (!Files.isRegularFile(configFile)) {
      throw new IllegalStateException("logging.config does not exist: " + configFile);
    }
    JoranConfigurator configurator = new JoranConfigurator();
    configurator.setContext(context);
    context.reset();
    try {
      configurator.doConfigure(configFile.toFile());
    } catch (JoranException ex) {
      throw new IllegalStateException("Failed to load logging.config " + configFile, ex);
    }
  }
}
