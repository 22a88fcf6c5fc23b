package tools.smith.sosumi.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {
  @TempDir Path tempDir;

  @Test
  void commandSectionOverridesCommon() throws IOException {
    Path config = Files.writeString(tempDir.resolve("sosumi.yaml"), """
        common:
          scanThreads: 2
          limit: 15
        wwdc:
          limit: 5
          verbosity: full
        year:
          mode: agent
        """);

    Map<String, String> wwdc = YamlConfigLoader.load(config, "wwdc").orElseThrow();
    Map<String, String> year = YamlConfigLoader.load(config, "YEAR").orElseThrow();

    assertEquals("5", wwdc.get("limit"));
    assertEquals("full", wwdc.get("verbosity"));
    assertEquals("2", wwdc.get("scanThreads"));
    assertEquals("15", year.get("limit"));
    assertEquals("agent", year.get("mode"));
  }

  @Test
  void missingFileIsEmpty() throws IOException {
    assertTrue(YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "wwdc").isEmpty());
  }

  @Test
  void emptyFileIsEmptyMap() throws IOException {
    Path config = Files.writeString(tempDir.resolve("sosumi.yaml"), "");

    assertEquals(Map.of(), YamlConfigLoader.load(config, "wwdc").orElseThrow());
  }

  @Test
  void arraysAndBrokenYamlAreRejected() throws IOException {
    Path arrays = Files.writeString(tempDir.resolve("arrays.yaml"), "common:\n  limit: [1, 2]\n");
    Path broken = Files.writeString(tempDir.resolve("broken.yaml"), "common: [unclosed\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(arrays, "wwdc"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(broken, "wwdc"));
  }

  @Test
  void duplicateKeysAreRejected() throws IOException {
    Path config = Files.writeString(tempDir.resolve("dup.yaml"), "wwdc:\n  limit: 1\n  limit: 2\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(config, "wwdc"));
  }

  @Test
  void sectionNamesIgnoreCaseAndUnderscores() throws IOException {
    Path config = Files.writeString(tempDir.resolve("sosumi.yaml"), """
        Bundle_Status:
          bundle: /data/wwdc.db
        telemetry:
          enabled: true
        """);

    Map<String, String> status = YamlConfigLoader.load(config, "bundle-status").orElseThrow();

    assertEquals(Map.of("bundle", "/data/wwdc.db"), status);
  }

  @Test
  void nestedMappingsBecomeDottedKeys() throws IOException {
    Path config = Files.writeString(tempDir.resolve("sosumi.yaml"), "common:\n  scan:\n    threads: 4\n");

    assertEquals("4", YamlConfigLoader.load(config, "search").orElseThrow().get("scan.threads"));
  }
}
