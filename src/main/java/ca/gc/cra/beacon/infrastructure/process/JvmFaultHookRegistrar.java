package ca.gc.cra.beacon.infrastructure.process;

import ca.gc.cra.beacon.application.port.FaultHookRegistrar;
import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;

/**
 * Installs the handler as the JVM-wide default uncaught exception handler.
 */
public final class JvmFaultHookRegistrar implements FaultHookRegistrar {
  @Override
  public void install(UncaughtExceptionHandler handler) {
    Thread.setDefaultUncaughtExceptionHandler(Objects.requireNonNull(handler, "handler"));
  }
}
