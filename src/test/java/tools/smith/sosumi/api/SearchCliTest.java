package tools.smith.sosumi.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tools.smith.sosumi.testutil.SampleBundles;

class SearchCliTest {
  @TempDir Path tempDir;

  private CliHarness cli;

  @BeforeEach
  void setUp() throws Exception {
    cli = new CliHarness(tempDir);
    SampleBundles.buildSealed(tempDir.resolve("work"), cli.sosumiHome().resolve("wwdc_bundle.encrypted"));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void recentMatchesLandInRecentBand() {
    ExitCode code = SearchCli.run(new String[] {"SwiftUI"}, cli.context(SampleBundles.keyEnv()));

    assertEquals(ExitCode.SUCCESS, code);
    String out = cli.stdout();
    assertTrue(out.startsWith("# Results for \"SwiftUI\""));
    assertTrue(out.contains("## Recent Sessions (2023-2024)"));
    assertTrue(out.contains("**Meet SwiftUI for spatial computing** (2024)"));
    assertTrue(out.contains("   Score: "));
  }

  @Test
  void bandsFollowNewestMatchedYear() {
    ExitCode code = SearchCli.run(new String[] {"core", "data"}, cli.context(SampleBundles.keyEnv()));

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(cli.stdout().contains("## Recent Sessions (2021-2022)"));
    assertTrue(cli.stdout().contains("Introduction to Core Data"));
  }

  @Test
  void noMatchIsNoResults() {
    ExitCode code = SearchCli.run(new String[] {"kubernetes"}, cli.context(SampleBundles.keyEnv()));

    assertEquals(ExitCode.NO_RESULTS, code);
  }

  @Test
  void missingQueryIsInvalidArgs() {
    ExitCode code = SearchCli.run(new String[0], cli.context(SampleBundles.keyEnv()));

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(cli.stdout().contains("usage: sosumi search"));
  }
}
