package tools.smith.sosumi.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class CliInputTest {
  @Test
  void splitsFlagsPairsAndWords() {
    CliInput input = CliInput.parse(
        new String[] {"swift", "concurrency", "limit=3", "--format=json", "--allow-placeholder", "-v"});

    assertEquals(List.of("swift", "concurrency"), input.positionals());
    assertArrayEquals(new String[] {"limit=3", "format=json"}, input.keyValueArgs());
    assertTrue(input.hasFlag("--ALLOW-PLACEHOLDER"));
    assertTrue(input.verbose());
    assertFalse(input.help());
  }

  @Test
  void helpAliasesAreRecognised() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"help"}).help());
    assertTrue(CliInput.parse(new String[] {"--help"}).hasFlag("--help"));
  }

  @Test
  void emptyInput() {
    CliInput input = CliInput.parse(null);

    assertTrue(input.positionals().isEmpty());
    assertEquals(0, input.keyValueArgs().length);
    assertFalse(input.hasFlag(""));
  }
}
