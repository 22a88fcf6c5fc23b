package tools.smith.sosumi.api;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.smith.sosumi.api.CommandSupport.Invocation;
import tools.smith.sosumi.api.CommandSupport.Prepared;
import tools.smith.sosumi.application.bundle.BundleException;
import tools.smith.sosumi.application.pipeline.SearchOutcome;
import tools.smith.sosumi.config.SosumiConfig;
import tools.smith.sosumi.validation.Strings;

/**
 * Entry point for {@code sosumi wwdc}: searches session transcripts and renders user or agent output.
 *
 * @since 1.2.0
 */
public final class WwdcCli {
  private static final Logger log = LoggerFactory.getLogger(WwdcCli.class);
  static final int MAX_QUERY_LENGTH = 256;
  private static final String SUMMARY_USAGE =
      "usage: sosumi wwdc <query> [limit=N] [verbosity=compact|detailed|full] [format=markdown|json] "
          + "[bundle=PATH] [--allow-placeholder]";
  private static final String HELP_TEXT = """
      sosumi wwdc: search WWDC session transcripts

      Usage:
        sosumi wwdc <query> [options]

      Options:
        limit=N                            Maximum results to show (default 10)
        verbosity=compact|detailed|full    One line per result, snippets, or full agent output (default detailed)
        format=markdown|json               Output format (default markdown)
        bundle=PATH                        Use this bundle instead of searching the default locations
        scanThreads=N                      Worker threads for the transcript scan (default 1)
        synonyms=PATH                      YAML synonym table overriding the packaged one
        config=PATH                        YAML config file (default ~/.sosumi/sosumi.yaml)
        --allow-placeholder                Return generic Apple search links when no real data is available
        --verbose                          Enable DEBUG logging
        --help                             Show this message

      Environment:
        SOSUMI_ENCRYPTION_KEY              32-byte key used to decrypt transcripts
      """;

  private WwdcCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the command and returns a normalized exit code.
   *
   * @param args raw CLI arguments
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    return run(args, CommandContext.system());
  }

  static ExitCode run(String[] args, CommandContext ctx) {
    Prepared prepared = CommandSupport.prepare("wwdc", args, ctx, log, SUMMARY_USAGE, HELP_TEXT);
    if (prepared.stop()) {
      return prepared.exit();
    }
    Invocation invocation = prepared.invocation();
    Optional<Path> bundle = CommandSupport.locateOrReport("wwdc", invocation.root());
    if (bundle.isEmpty()) {
      return ExitCode.BUNDLE_MISSING;
    }

    String query;
    try {
      query = Strings.requireQuery(CommandSupport.joinPositionals(invocation, "query"), MAX_QUERY_LENGTH);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid query: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    boolean allowPlaceholder = invocation.input().hasFlag("--allow-placeholder");

    SosumiConfig config = invocation.config();
    try {
      SearchOutcome outcome =
          invocation.root().wwdcSearchUseCase().search(bundle.get(), query, allowPlaceholder);
      if (outcome.placeholder()) {
        CliPrinter.println("Note: real WWDC data unavailable; showing generic Apple search links.");
      }
      CliPrinter.println(invocation.root().renderer()
          .renderResults(query, outcome.results(), config.verbosity(), config.limit())
          .stripTrailing());
      return ExitCode.SUCCESS;
    } catch (BundleException ex) {
      return CommandSupport.fail(log, ex);
    } catch (IOException ex) {
      log.error("wwdc search I/O failure", ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("wwdc configuration error: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("wwdc search interrupted", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in wwdc search", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
