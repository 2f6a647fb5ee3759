package ca.gc.cra.beacon.logging;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.Test;

class ConsoleDiagnosticLogTest {

  @Test
  void writesLevelAndStackTraceAndDropsDebug() {
    StringWriter buffer = new StringWriter();
    ConsoleDiagnosticLog log = new ConsoleDiagnosticLog(new PrintWriter(buffer));

    log.debug("hidden detail");
    log.info("[startup] Starting service");
    log.error("[startup] Logger initialization failed", new IllegalStateException("bad xml"));

    String output = buffer.toString();
    assertFalse(output.contains("hidden detail"));
    assertTrue(output.contains(" INFO [startup] Starting service"));
    assertTrue(output.contains(" ERROR [startup] Logger initialization failed"));
    assertTrue(output.contains("java.lang.IllegalStateException: bad xml"));
  }
}
