package ca.gc.cra.beacon.infrastructure.process;

import ca.gc.cra.beacon.application.port.ProcessTerminator;
import ca.gc.cra.beacon.domain.lifecycle.ExitCode;
import java.util.List;
import java.util.Objects;
import java.util.function.IntConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ends the JVM after closing process-scoped resources such as the telemetry pipeline.
 */
public final class JvmProcessTerminator implements ProcessTerminator {
  private static final Logger log = LoggerFactory.getLogger(JvmProcessTerminator.class);

  private final List<AutoCloseable> beforeExit;
  private final IntConsumer exit;

  /**
   * Creates a terminator calling {@link System#exit(int)}.
   *
   * @param beforeExit resources closed, in order, before the JVM exits
   */
  public JvmProcessTerminator(List<AutoCloseable> beforeExit) {
    this(beforeExit, System::exit);
  }

  JvmProcessTerminator(List<AutoCloseable> beforeExit, IntConsumer exit) {
    this.beforeExit = List.copyOf(Objects.requireNonNull(beforeExit, "beforeExit"));
    this.exit = Objects.requireNonNull(exit, "exit");
  }

  @Override
  public void exit(ExitCode code) {
    for (AutoCloseable resource : beforeExit) {
      try {
        resource.close();
      } catch (Exception ex) {
        log.warn("Failed to close {} before exit", resource.getClass().getSimpleName(), ex);
      }
    }
    log.info("Exiting with status {} ({})", code.code(), code);
    exit.accept(code.code());
  }
}
