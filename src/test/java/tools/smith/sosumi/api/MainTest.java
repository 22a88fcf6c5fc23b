package tools.smith.sosumi.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;
import tools.smith.sosumi.testutil.SampleBundles;

class MainTest {
  @TempDir Path tempDir;

  private CliHarness cli;
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private boolean originalAdditive;

  @BeforeEach
  void setUp() {
    cli = new CliHarness(tempDir);
    logger = (Logger) LoggerFactory.getLogger(Main.class);
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    logger.setAdditive(originalAdditive);
    CliPrinter.clearTestWriter();
  }

  @Test
  void noCommandPrintsUsage() {
    ExitCode code = Main.run(new String[0], cli.context());

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(cli.stdout().contains("usage: sosumi <wwdc|search|session|year|stats|build|bundle-status>"));
    assertTrue(appender.list.stream().anyMatch(e -> e.getFormattedMessage().equals("Missing command")));
  }

  @Test
  void helpListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}, cli.context()));
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"help"}, cli.context()));
    assertTrue(cli.stdout().contains("bundle-status  Show which bundle would be used"));
  }

  @Test
  void unknownCommandIsInvalidArgs() {
    ExitCode code = Main.run(new String[] {"frobnicate"}, cli.context());

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(appender.list.stream().anyMatch(e -> e.getFormattedMessage().equals("Unknown command: frobnicate")));
  }

  @Test
  void dispatchesWithLeadingOptions() throws Exception {
    Path bundle = SampleBundles.buildPlain(tempDir.resolve("work"), tempDir.resolve("dev.db"));

    ExitCode code = Main.run(new String[] {"bundle=" + bundle, "Bundle-Status"}, cli.context());

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(cli.stdout().startsWith("Bundle found: " + bundle));
  }

  @Test
  void commandOptionsReachSubcommand() throws Exception {
    SampleBundles.buildPlain(tempDir.resolve("work"), cli.sosumiHome().resolve("wwdc.db"));

    ExitCode code = Main.run(new String[] {"session", "wwdc2024-10201"}, cli.context());

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(cli.stdout().startsWith("# Design spatial experiences (2024)"));
  }

  @Test
  void subcommandExitCodeIsPropagated() {
    ExitCode code = Main.run(new String[] {"stats"}, cli.context());

    assertEquals(ExitCode.BUNDLE_MISSING, code);
  }
}
