package ca.gc.cra.beacon.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ServiceConfigTest {

  @Test
  void defaultsDescribeLocalService() {
    ServiceConfig config = ServiceConfig.defaults();

    assertEquals("0.0.0.0", config.host());
    assertEquals(3000, config.port());
    assertTrue(config.database().url().startsWith("jdbc:h2:mem:"));
    assertTrue(config.messaging().enabled());
    assertEquals("localhost:9092", config.messaging().bootstrap());
    assertEquals("INFO", config.logging().level());
    assertTrue(config.logging().configFile().isEmpty());
    assertEquals("none", config.telemetry().exporter());
  }

  @Test
  void fromMapParsesOverrides() {
    Map<String, String> kv = new HashMap<>();
    kv.put("port", "0");
    kv.put("host", "127.0.0.1");
    kv.put("messaging.enabled", "no");
    kv.put("logging.level", "debug");
    kv.put("logging.config", "/etc/beacon/logback.xml");

    ServiceConfig config = ServiceConfig.fromMap(kv);

    assertEquals(0, config.port());
    assertFalse(config.messaging().enabled());
    assertEquals("DEBUG", config.logging().level());
    assertEquals(Path.of("/etc/beacon/logback.xml"), config.logging().configFile().orElseThrow());
  }

  @Test
  void invalidPortNamesTheKey() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ServiceConfig.fromMap(Map.of("port", "abc")));

    assertTrue(ex.getMessage().startsWith("port must be an integer"));
  }

  @Test
  void portAboveRangeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> ServiceConfig.fromMap(Map.of("port", "70000")));
  }

  @Test
  void nonJdbcUrlIsRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ServiceConfig.fromMap(Map.of("database.url", "postgres://db")));

    assertTrue(ex.getMessage().contains("database.url"));
  }

  @Test
  void bootstrapListIsValidatedWhenEnabled() {
    assertThrows(IllegalArgumentException.class,
        () -> ServiceConfig.fromMap(Map.of("messaging.bootstrap", "broker-without-port")));
    assertEquals("a:9092,b:9093",
        ServiceConfig.fromMap(Map.of("messaging.bootstrap", " a:9092 , b:9093 ")).messaging().bootstrap());
  }

  @Test
  void unknownExporterIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> ServiceConfig.fromMap(Map.of("metricsExporter", "prometheus")));
  }

  @Test
  void databaseSettingsHidePassword() {
    ServiceConfig config = ServiceConfig.fromMap(Map.of("database.password", "s3cret"));

    assertEquals("s3cret", config.database().password());
    assertFalse(config.database().toString().contains("s3cret"));
  }
}
