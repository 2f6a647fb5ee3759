package ca.gc.cra.beacon.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.beacon.application.lifecycle.LifecycleOrchestrator;
import ca.gc.cra.beacon.application.port.DiagnosticLog;
import ca.gc.cra.beacon.application.port.MetricsPort;
import ca.gc.cra.beacon.domain.lifecycle.ServiceState;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CompositionRootTest {

  @Test
  void planListsStepsInStartupOrderAndRedactsPassword() {
    ServiceConfig config = ServiceConfig.fromMap(Map.of("database.password", "s3cret", "port", "8080"));

    List<String> plan = new CompositionRoot(config, false).describePlan();

    assertEquals("BEACON startup plan", plan.get(0));
    assertTrue(plan.get(1).contains("1. logger"));
    assertTrue(plan.get(2).contains("2. persistence"));
    assertTrue(plan.get(2).contains("password=[REDACTED]"));
    assertTrue(plan.get(3).contains("3. messaging    bootstrap=localhost:9092"));
    assertTrue(plan.get(4).contains("4. listener     0.0.0.0:8080 readiness=/health"));
    assertFalse(String.join("\n", plan).contains("s3cret"));
  }

  @Test
  void planShowsDisabledMessaging() {
    ServiceConfig config = ServiceConfig.fromMap(Map.of("messaging.enabled", "false"));

    List<String> plan = new CompositionRoot(config, false).describePlan();

    assertEquals("  3. messaging    disabled", plan.get(3));
  }

  @Test
  void orchestratorIsBuiltWithoutStartingAnything() {
    CompositionRoot root = new CompositionRoot(ServiceConfig.defaults(), false);

    LifecycleOrchestrator orchestrator = root.orchestrator(MetricsPort.NO_OP, code -> {}, new SilentLog());

    assertEquals(ServiceState.NOT_STARTED, orchestrator.state());
  }

  private static final class SilentLog implements DiagnosticLog {
    @Override
    public void debug(String message) {}

    @Override
    public void info(String message) {}

    @Override
    public void warn(String message) {}

    @Override
    public void error(String message, Throwable failure) {}
  }
}
