package org.eao.jsa.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class CliInputTest {
  @Test
  void separatesSwitchesFromSettings() {
    CliInput input = CliInput.parse(new String[] {"ingest", "--Dry-Run", "store=s", "-v", " ", "--allow-remove"});

    assertArrayEquals(new String[] {"ingest", "store=s"}, input.keyValueArgs());
    assertTrue(input.verbose());
    assertFalse(input.help());
    assertTrue(input.has(CliInput.Switch.DRY_RUN));
    assertTrue(input.has(CliInput.Switch.ALLOW_REMOVE));
    assertTrue(input.unknownSwitches().isEmpty());
  }

  @Test
  void helpAliasesAndUnknownSwitches() {
    CliInput input = CliInput.parse(new String[] {"-h", "--force", "-n"});

    assertTrue(input.help());
    assertTrue(input.has(CliInput.Switch.DRY_RUN));
    assertEquals(List.of("--force"), input.unknownSwitches());
  }

  @Test
  void nullArgumentsParseToNothing() {
    CliInput input = CliInput.parse(null);

    assertEquals(0, input.keyValueArgs().length);
    assertFalse(input.verbose());
  }
}
