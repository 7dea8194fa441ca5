package ca.gc.cra.chronos.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CliInputTest {
  @Test
  void separatesFlagsFromKeyValuePairs() {
    CliInput input = CliInput.parse(new String[] {"--Apply", "accountId=me", "-v", " ", "from=2024-03-04"});

    assertTrue(input.verbose());
    assertFalse(input.help());
    assertTrue(input.hasFlag("--apply"));
    assertFalse(input.hasFlag("--submit"));
    assertArrayEquals(new String[] {"accountId=me", "from=2024-03-04"}, input.keyValueArgs());
  }

  @Test
  void recognizesHelpSpellings() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"HELP"}).help());
    assertFalse(CliInput.parse(null).help());
  }

  @Test
  void dashedKeyValueIsNotAFlag() {
    CliInput input = CliInput.parse(new String[] {"--config=chronos.yaml"});

    assertFalse(input.hasFlag("--config=chronos.yaml"));
    assertArrayEquals(new String[] {"--config=chronos.yaml"}, input.keyValueArgs());
  }
}
