package ca.gc.cra.beacon.infrastructure.process;

import ca.gc.cra.beacon.application.port.SignalRegistrar;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sun.misc.Signal;

/**
 * Signal registrar built on {@code sun.misc.Signal} from the {@code jdk.unsupported} module.
 *
 * <p>HotSpot reserves {@code QUIT} for thread dumps unless the VM runs with {@code -Xrs}; such signals are reported as
 * not installed.</p>
 */
public final class SunMiscSignalRegistrar implements SignalRegistrar {
  private static final Logger log = LoggerFactory.getLogger(SunMiscSignalRegistrar.class);

  @Override
  public boolean register(String signalName, Runnable handler) {
    Objects.requireNonNull(signalName, "signalName");
    Objects.requireNonNull(handler, "handler");
    try {
      Signal.handle(new Signal(signalName), signal -> handler.run());
      return true;
    } catch (IllegalArgumentException ex) {
      log.debug("Signal SIG{} unavailable: {}", signalName, ex.getMessage());
      return false;
    }
  }
}
