package ca.gc.cra.beacon.application.lifecycle;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.beacon.application.lifecycle.LifecycleFakes.FakeFaultHookRegistrar;
import ca.gc.cra.beacon.application.lifecycle.LifecycleFakes.FakeSignalRegistrar;
import ca.gc.cra.beacon.application.lifecycle.LifecycleFakes.RecordingLog;
import ca.gc.cra.beacon.application.lifecycle.LifecycleFakes.RecordingTerminator;
import ca.gc.cra.beacon.config.ServiceConfig.DatabaseSettings;
import ca.gc.cra.beacon.domain.lifecycle.ExitCode;
import ca.gc.cra.beacon.domain.lifecycle.ServiceState;
import ca.gc.cra.beacon.infrastructure.http.JavalinListener;
import ca.gc.cra.beacon.infrastructure.persistence.HikariPersistence;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class LifecycleOrchestratorIntegrationTest {
  private final ExecutorService pool = Executors.newFixedThreadPool(2);
  private final RecordingLog sink = new RecordingLog();
  private final RecordingTerminator terminator = new RecordingTerminator();
  private final FakeSignalRegistrar signals = new FakeSignalRegistrar();

  @AfterEach
  void tearDown() {
    pool.shutdownNow();
  }

  @Test
  void servesHealthThenShutsDownOnSignal() throws Exception {
    HikariPersistence persistence = new HikariPersistence(h2Settings(), pool);
    LifecycleOrchestrator orchestrator = orchestrator(persistence, 0);

    orchestrator.start();

    assertEquals(ServiceState.RUNNING, orchestrator.state());
    assertTrue(persistence.dataSource().isPresent());
    assertTrue(sink.contains("[listener] Server is running on http://localhost:"));

    signals.raise("TERM");

    assertEquals(ExitCode.SUCCESS, orchestrator.awaitTermination());
    assertEquals(ServiceState.STOPPED, orchestrator.state());
    assertTrue(persistence.dataSource().isEmpty());
    assertEquals(List.of(ExitCode.SUCCESS), terminator.exits);
  }

  @Test
  void occupiedPortReleasesPersistenceAndExitsOne() throws Exception {
    HikariPersistence persistence = new HikariPersistence(h2Settings(), pool);
    try (ServerSocket occupied = new ServerSocket(0, 1, InetAddress.getByName("127.0.0.1"))) {
      LifecycleOrchestrator orchestrator = orchestrator(persistence, occupied.getLocalPort());

      orchestrator.start();

      assertTrue(orchestrator.awaitTermination(10, TimeUnit.SECONDS));
      assertEquals(ServiceState.FAILED, orchestrator.state());
      assertEquals(List.of(ExitCode.FAILURE), terminator.exits);
      assertTrue(persistence.dataSource().isEmpty());
      assertTrue(sink.contains("Port " + occupied.getLocalPort() + " is already in use"));
    }
  }

  private LifecycleOrchestrator orchestrator(HikariPersistence persistence, int port) {
    LifecycleOrchestrator[] self = new LifecycleOrchestrator[1];
    self[0] = LifecycleOrchestrator.builder()
        .host("127.0.0.1")
        .port(port)
        .loggerBootstrap(() -> sink)
        .subsystem(persistence)
        .listener(new JavalinListener(() -> self[0].state()))
        .signals(signals)
        .faultHooks(new FakeFaultHookRegistrar())
        .terminator(terminator)
        .fallbackLog(new RecordingLog())
        .build();
    return self[0];
  }

  private static DatabaseSettings h2Settings() {
    String db = "beacon_" + UUID.randomUUID().toString().replace('-', '_');
    return new DatabaseSettings("jdbc:h2:mem:" + db + ";DB_CLOSE_DELAY=-1", "sa", "", 2, "beacon-it");
  }
}
