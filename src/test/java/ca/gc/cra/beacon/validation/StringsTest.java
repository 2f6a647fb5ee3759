package ca.gc.cra.beacon.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("value", Strings.requireNonBlank("test", "  value  "));
  }

  @Test
  void requireNonBlankRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "bad\u0001"));
  }

  @Test
  void sanitizeTopicAllowsSafeCharacters() {
    assertEquals("beacon.outbound-1", Strings.sanitizeTopic("messaging.topic", "beacon.outbound-1"));
  }

  @Test
  void sanitizeTopicRejectsInvalidCharacters() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Strings.sanitizeTopic("messaging.topic", "beacon outbound"));
    assertEquals("messaging.topic must only contain letters, digits, dot, underscore, or hyphen", ex.getMessage());
  }

  @Test
  void requirePrintableAsciiRejectsNonAscii() {
    assertThrows(IllegalArgumentException.class,
        () -> Strings.requirePrintableAscii("database.poolName", "p☃l", 16));
  }

  @Test
  void requirePrintableAsciiRejectsExcessLength() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("database.poolName", "abc", 2));
  }
}
