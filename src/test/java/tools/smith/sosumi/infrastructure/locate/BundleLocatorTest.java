package tools.smith.sosumi.infrastructure.locate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BundleLocatorTest {
  @TempDir Path tempDir;

  @Test
  void candidatesFollowPrecedence() {
    Path home = tempDir.resolve("home");
    Path cwd = tempDir.resolve("cwd");
    Path app = tempDir.resolve("app");

    BundleLocator locator = new BundleLocator(null, home, cwd, app);

    assertEquals(List.of(
        home.resolve("wwdc.db"),
        home.resolve("wwdc_bundle.encrypted"),
        cwd.resolve("wwdc_bundle.encrypted"),
        app.resolve("DATA").resolve("wwdc_bundle.encrypted")), locator.candidates());
  }

  @Test
  void plainDatabaseInHomeBeatsBundle() throws IOException {
    Path home = Files.createDirectories(tempDir.resolve("home"));
    Path cwd = Files.createDirectories(tempDir.resolve("cwd"));
    Files.writeString(home.resolve(BundleLocator.PLAIN_DATABASE), "{}");
    Files.writeString(home.resolve(BundleLocator.BUNDLE_FILE), "x");
    Files.writeString(cwd.resolve(BundleLocator.BUNDLE_FILE), "x");

    BundleLocator locator = new BundleLocator(null, home, cwd, null);

    assertEquals(home.resolve(BundleLocator.PLAIN_DATABASE), locator.locate().orElseThrow());
  }

  @Test
  void fallsThroughToWorkingDirectoryAndAppDir() throws IOException {
    Path home = tempDir.resolve("home");
    Path cwd = Files.createDirectories(tempDir.resolve("cwd"));
    Path app = Files.createDirectories(tempDir.resolve("app").resolve("DATA")).getParent();
    Files.writeString(app.resolve("DATA").resolve(BundleLocator.BUNDLE_FILE), "x");

    BundleLocator locator = new BundleLocator(null, home, cwd, app);
    assertEquals(app.resolve("DATA").resolve(BundleLocator.BUNDLE_FILE), locator.locate().orElseThrow());

    Files.writeString(cwd.resolve(BundleLocator.BUNDLE_FILE), "x");
    assertEquals(cwd.resolve(BundleLocator.BUNDLE_FILE), locator.locate().orElseThrow());
  }

  @Test
  void directoriesAreNotBundles() throws IOException {
    Path home = tempDir.resolve("home");
    Files.createDirectories(home.resolve(BundleLocator.BUNDLE_FILE));

    BundleLocator locator = new BundleLocator(null, home, tempDir.resolve("cwd"), null);

    assertFalse(locator.exists());
    assertTrue(locator.locate().isEmpty());
    assertEquals(3, locator.candidates().size());
  }

  @Test
  void explicitPathIsTheOnlyCandidate() throws IOException {
    Path home = Files.createDirectories(tempDir.resolve("home"));
    Path explicit = Files.writeString(tempDir.resolve("custom.bundle"), "x");
    Files.writeString(home.resolve(BundleLocator.BUNDLE_FILE), "x");

    BundleLocator locator = new BundleLocator(explicit, home, tempDir.resolve("cwd"), null);

    assertEquals(List.of(explicit), locator.candidates());
    assertEquals(explicit, locator.locate().orElseThrow());
  }

  @Test
  void missingExplicitPathDoesNotFallBackToDefaults() throws IOException {
    Path home = Files.createDirectories(tempDir.resolve("home"));
    Files.writeString(home.resolve(BundleLocator.BUNDLE_FILE), "x");
    Path typo = tempDir.resolve("typo.bin");

    BundleLocator locator = new BundleLocator(typo, home, tempDir.resolve("cwd"), null);

    assertTrue(locator.locate().isEmpty());
    assertFalse(locator.exists());
    assertEquals(List.of(typo), locator.candidates());
  }
}
