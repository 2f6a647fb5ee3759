package ca.gc.cra.beacon.application.lifecycle;

import ca.gc.cra.beacon.application.port.DiagnosticLog;
import ca.gc.cra.beacon.application.port.SignalRegistrar;
import ca.gc.cra.beacon.domain.lifecycle.ShutdownCause;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Translates operating system termination signals into shutdown requests.
 *
 * <p>Every receipt forwards a {@link ShutdownCause#signal(String)}; repeated signals are absorbed by the
 * orchestrator's shutdown guard.</p>
 *
 * @since 0.1.0
 */
public final class SignalInterceptor {
  /** Signals intercepted by default. */
  public static final List<String> SIGNALS = List.of("INT", "TERM", "QUIT");

  private final DiagnosticLog log;
  private final Consumer<ShutdownCause> shutdown;

  public SignalInterceptor(DiagnosticLog log, Consumer<ShutdownCause> shutdown) {
    this.log = Objects.requireNonNull(log, "log");
    this.shutdown = Objects.requireNonNull(shutdown, "shutdown");
  }

  /**
   * Registers a handler for each of {@link #SIGNALS}.
   *
   * @param registrar platform signal registrar
   * @return names of the signals actually intercepted
   */
  public List<String> install(SignalRegistrar registrar) {
    Objects.requireNonNull(registrar, "registrar");
    List<String> installed = new ArrayList<>(SIGNALS.size());
    for (String name : SIGNALS) {
      if (registrar.register(name, () -> onSignal(name))) {
        installed.add(name);
      } else {
        log.warn("[shutdown] SIG" + name + " is reserved by the runtime; not intercepted");
      }
    }
    log.debug("[shutdown] Intercepting signals " + installed);
    return List.copyOf(installed);
  }

  void onSignal(String name) {
    log.info("[shutdown] Received SIG" + name);
    shutdown.accept(ShutdownCause.signal(name));
  }
}
