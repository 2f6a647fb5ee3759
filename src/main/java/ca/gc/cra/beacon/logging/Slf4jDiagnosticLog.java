package ca.gc.cra.beacon.logging;

import ca.gc.cra.beacon.application.port.DiagnosticLog;
import java.util.Objects;
import org.slf4j.Logger;

/**
 * Diagnostic channel backed by an SLF4J logger.
 *
 * @since 0.1.0
 */
public final class Slf4jDiagnosticLog implements DiagnosticLog {
  private final Logger logger;

  public Slf4jDiagnosticLog(Logger logger) {
    this.logger = Objects.requireNonNull(logger, "logger");
  }

  @Override
  public void debug(String message) {
    logger.debug(message);
  }

  @Override
  public void info(String message) {
    logger.info(message);
  }

  @Override
  public void warn(String message) {
    logger.warn(message);
  }

  @Override
  public void error(String message, Throwable failure) {
    if (failure == null) {
      logger.error(message);
    } else {
      logger.error(message, failure);
    }
  }
}
