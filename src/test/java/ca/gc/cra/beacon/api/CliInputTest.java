package ca.gc.cra.beacon.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;
import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromKeyValues() {
    CliInput input = CliInput.parse(new String[] {"--dry-run", "port=8080", "-v"});

    assertTrue(input.dryRun());
    assertTrue(input.verbose());
    assertFalse(input.help());
    assertArrayEquals(new String[] {"port=8080"}, input.keyValueArgs());
    assertTrue(input.unknownFlags().isEmpty());
  }

  @Test
  void reportsUnknownFlags() {
    CliInput input = CliInput.parse(new String[] {"--daemon", "-h"});

    assertTrue(input.help());
    assertEquals(Set.of("--daemon"), input.unknownFlags());
  }

  @Test
  void emptyArgumentsHaveNoFlags() {
    CliInput input = CliInput.parse(null);

    assertFalse(input.dryRun());
    assertEquals(0, input.keyValueArgs().length);
  }
}
