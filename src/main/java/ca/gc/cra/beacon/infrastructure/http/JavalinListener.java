package ca.gc.cra.beacon.infrastructure.http;

import ca.gc.cra.beacon.application.port.ListenerHandle;
import ca.gc.cra.beacon.application.port.ListenerPort;
import ca.gc.cra.beacon.domain.lifecycle.ServiceState;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import org.eclipse.jetty.util.thread.QueuedThreadPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Binds the service endpoint with an embedded Javalin (Jetty) server.
 * <p><strong>Why:</strong> Supervisors need a readiness probe that reflects the lifecycle state while the service
 * accepts traffic.</p>
 * <p><strong>Role:</strong> Infrastructure adapter implementing {@link ListenerPort}.</p>
 * <p><strong>Thread-safety:</strong> {@link #listen(String, int)} binds synchronously on the caller thread; the
 * returned handle may be closed from any thread.</p>
 *
 * @since 0.1.0
 */
public final class JavalinListener implements ListenerPort {
  private static final Logger log = LoggerFactory.getLogger(JavalinListener.class);
  /** Readiness probe route. */
  public static final String HEALTH_PATH = "/health";

  private final Supplier<ServiceState> stateProbe;
  private final int minThreads;
  private final int maxThreads;
  private final int idleTimeoutMs;

  /**
   * Creates a listener with a small default Jetty pool.
   *
   * @param stateProbe supplies the lifecycle state reported by {@value #HEALTH_PATH}
   */
  public JavalinListener(Supplier<ServiceState> stateProbe) {
    this(stateProbe, 2, 16, 60_000);
  }

  JavalinListener(Supplier<ServiceState> stateProbe, int minThreads, int maxThreads, int idleTimeoutMs) {
    this.stateProbe = Objects.requireNonNull(stateProbe, "stateProbe");
    this.minThreads = minThreads;
    this.maxThreads = maxThreads;
    this.idleTimeoutMs = idleTimeoutMs;
  }

  @Override
  public ListenerHandle listen(String host, int port) {
    Objects.requireNonNull(host, "host");
    Javalin app = Javalin.create(config -> {
      config.showJavalinBanner = false;
      QueuedThreadPool threadPool = new QueuedThreadPool(maxThreads, minThreads, idleTimeoutMs);
      threadPool.setName("beacon-http");
      config.jetty.threadPool = threadPool;
    });
    app.get(HEALTH_PATH, this::health);
    app.exception(Exception.class, (ex, ctx) -> {
      log.error("[listener] Request to {} failed", ctx.path(), ex);
      ctx.status(HttpStatus.INTERNAL_SERVER_ERROR).result("internal error");
    });

    JavalinHandle handle = new JavalinHandle(app, host, port);
    try {
      app.start(host, port);
    } catch (RuntimeException ex) {
      handle.abandon();
      handle.fireError(ex);
      return handle;
    }
    handle.boundPort = app.port();
    log.debug("[listener] Registered route GET {}", HEALTH_PATH);
    log.info("[listener] HTTP server bound to {}:{}", host, app.port());
    handle.fireReady();
    return handle;
  }

  private void health(Context ctx) {
    ServiceState state = stateProbe.get();
    ctx.status(state == ServiceState.RUNNING ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
        .result(state.name());
  }

  static final class JavalinHandle extends ReplayingListenerHandle {
    private final Javalin app;
    private final String host;
    private final int requestedPort;
    private final CompletableFuture<Void> closed = new CompletableFuture<>();
    private volatile int boundPort;
    private volatile boolean closing;

    private JavalinHandle(Javalin app, String host, int requestedPort) {
      this.app = app;
      this.host = host;
      this.requestedPort = requestedPort;
      this.boundPort = requestedPort;
    }

    @Override
    public InetSocketAddress address() {
      return InetSocketAddress.createUnresolved(host, boundPort);
    }

    @Override
    public CompletableFuture<Void> close() {
      synchronized (this) {
        if (closing) {
          return closed;
        }
        closing = true;
      }
      try {
        app.stop();
        log.info("[listener] HTTP server on {}:{} stopped", host, requestedPort);
        closed.complete(null);
      } catch (RuntimeException ex) {
        closed.completeExceptionally(ex);
      }
      return closed;
    }

    private void abandon() {
      try {
        app.stop();
      } catch (RuntimeException ex) {
        log.debug("[listener] Cleanup after failed bind raised {}", ex.toString());
      }
      closing = true;
      closed.complete(null);
    }
  }
}
