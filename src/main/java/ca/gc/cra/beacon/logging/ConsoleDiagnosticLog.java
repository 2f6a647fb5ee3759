package ca.gc.cra.beacon.logging;

import ca.gc.cra.beacon.application.port.DiagnosticLog;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Objects;

/**
 * Fallback diagnostic channel writing plain lines to stderr.
 *
 * <p>Used before the Logback sink is configured; debug output is dropped.</p>
 *
 * @since 0.1.0
 */
public final class ConsoleDiagnosticLog implements DiagnosticLog {
  private final PrintWriter out;

  /** Creates a channel on the process stderr descriptor. */
  public ConsoleDiagnosticLog() {
    this(new PrintWriter(
        new OutputStreamWriter(new FileOutputStream(FileDescriptor.err), StandardCharsets.UTF_8), true));
  }

  ConsoleDiagnosticLog(PrintWriter out) {
    this.out = Objects.requireNonNull(out, "out");
  }

  @Override
  public void debug(String message) {
    // dropped until the structured sink is up
  }

  @Override
  public void info(String message) {
    write("INFO", message, null);
  }

  @Override
  public void warn(String message) {
    write("WARN", message, null);
  }

  @Override
  public void error(String message, Throwable failure) {
    write("ERROR", message, failure);
  }

  private synchronized void write(String level, String message, Throwable failure) {
    out.println(Instant.now() + " " + level + " " + message);
    if (failure != null) {
      failure.printStackTrace(out);
    }
    out.flush();
  }
}
