package ca.gc.cra.beacon.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {
  @TempDir Path tempDir;

  private Logger root;
  private Level previous;

  @BeforeEach
  void setUp() {
    root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    previous = root.getLevel();
  }

  @AfterEach
  void tearDown() {
    root.setLevel(previous);
  }

  @Test
  void configureAppliesRootLevel() {
    LoggingConfigurator.configure(null, "warn");

    assertEquals(Level.WARN, root.getLevel());
  }

  @Test
  void blankLevelKeepsCurrentLevel() {
    root.setLevel(Level.ERROR);

    LoggingConfigurator.configure(null, " ");

    assertEquals(Level.ERROR, root.getLevel());
  }

  @Test
  void verboseLoggingRaisesRootToDebug() {
    LoggingConfigurator.enableVerboseLogging();

    assertEquals(Level.DEBUG, root.getLevel());
  }

  @Test
  void invalidLevelIsRejected() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> LoggingConfigurator.parseLevel("loud"));

    assertEquals("logging.level must be one of TRACE, DEBUG, INFO, WARN, ERROR, OFF (was loud)", ex.getMessage());
  }

  @Test
  void missingExternalFileFailsBootstrap() {
    Path missing = tempDir.resolve("absent-logback.xml");

    assertThrows(IllegalStateException.class, () -> LoggingConfigurator.configure(missing, "INFO"));
    assertThrows(IllegalStateException.class,
        () -> new LogbackLoggerBootstrap(missing, "INFO", false).initialize());
  }
}
