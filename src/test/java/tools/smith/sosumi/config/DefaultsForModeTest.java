package tools.smith.sosumi.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void perCommandLimits() {
    assertEquals("20", DefaultsForMode.asFlatMap("search").get("limit"));
    assertEquals("10", DefaultsForMode.asFlatMap("wwdc").get("limit"));
    assertEquals("200", DefaultsForMode.asFlatMap("year").get("limit"));
  }

  @Test
  void commonDefaultsApplyEverywhere() {
    Map<String, String> stats = DefaultsForMode.asFlatMap("stats");

    assertEquals(DefaultsForMode.DEFAULT_KEY_ENV, stats.get("keyEnv"));
    assertEquals("1", stats.get("scanThreads"));
    assertEquals("user", stats.get("mode"));
  }

  @Test
  void unknownCommandIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("deploy"));
  }
}
