package ca.gc.cra.beacon.application.lifecycle;

import java.net.BindException;
import java.util.Locale;

/**
 * Raised when the listener reports an error while the service is still starting.
 *
 * @since 0.1.0
 */
public final class BindFailureException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String host;
  private final int port;

  public BindFailureException(String host, int port, Throwable cause) {
    super("Failed to bind listener on " + host + ":" + port + ": " + StartupFailureException.describe(cause), cause);
    this.host = host;
    this.port = port;
  }

  public String host() {
    return host;
  }

  public int port() {
    return port;
  }

  /**
   * Indicates whether the cause chain reports that the address is already in use.
   *
   * @return {@code true} for {@link BindException} or an "address already in use" message anywhere in the chain
   */
  public boolean addressInUse() {
    Throwable current = getCause();
    int depth = 0;
    while (current != null && depth++ < 16) {
      if (current instanceof BindException) {
        return true;
      }
      String message = current.getMessage();
      if (message != null) {
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("already in use") || lower.contains("eaddrinuse")) {
          return true;
        }
      }
      if (current.getCause() == current) {
        break;
      }
      current = current.getCause();
    }
    return false;
  }
}
