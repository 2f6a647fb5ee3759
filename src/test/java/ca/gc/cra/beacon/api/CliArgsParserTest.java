package ca.gc.cra.beacon.api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairs() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"port=8080", "database.url=jdbc:h2:mem:x;MODE=PG"});
    assertEquals("8080", map.get("port"));
    assertEquals("jdbc:h2:mem:x;MODE=PG", map.get("database.url"));
  }

  @Test
  void keepsEmptyValues() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"database.password="});
    assertEquals("", map.get("database.password"));
  }

  @Test
  void rejectsArgumentsWithoutEquals() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"invalid"}));
  }

  @Test
  void rejectsMalformedKeys() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"bad key=1"}));
  }
}
