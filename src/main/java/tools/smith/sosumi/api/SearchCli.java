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
import tools.smith.sosumi.infrastructure.render.LegacyResultFormatter;
import tools.smith.sosumi.validation.Strings;

/**
 * Entry point for {@code sosumi search}: the banded recent/earlier listing with segment times.
 *
 * @since 1.2.0
 */
public final class SearchCli {
  private static final Logger log = LoggerFactory.getLogger(SearchCli.class);
  private static final String SUMMARY_USAGE =
      "usage: sosumi search <query> [limit=N] [bundle=PATH] [--allow-placeholder]";
  private static final String HELP_TEXT = """
      sosumi search: WWDC transcript search grouped by recency

      Usage:
        sosumi search <query> [options]

      Options:
        limit=N               Maximum results across both groups (default 20)
        bundle=PATH           Use this bundle instead of searching the default locations
        --allow-placeholder   Return generic Apple search links when no real data is available
        --verbose             Enable DEBUG logging
        --help                Show this message
      """;

  private SearchCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    return run(args, CommandContext.system());
  }

  static ExitCode run(String[] args, CommandContext ctx) {
    Prepared prepared = CommandSupport.prepare("search", args, ctx, log, SUMMARY_USAGE, HELP_TEXT);
    if (prepared.stop()) {
      return prepared.exit();
    }
    Invocation invocation = prepared.invocation();
    Optional<Path> bundle = CommandSupport.locateOrReport("search", invocation.root());
    if (bundle.isEmpty()) {
      return ExitCode.BUNDLE_MISSING;
    }

    String query;
    try {
      query = Strings.requireQuery(CommandSupport.joinPositionals(invocation, "query"), WwdcCli.MAX_QUERY_LENGTH);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid query: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try {
      SearchOutcome outcome = invocation.root().wwdcSearchUseCase()
          .search(bundle.get(), query, invocation.input().hasFlag("--allow-placeholder"));
      CliPrinter.println(
          LegacyResultFormatter.format(query, outcome.results(), invocation.config().limit()).stripTrailing());
      return ExitCode.SUCCESS;
    } catch (BundleException ex) {
      return CommandSupport.fail(log, ex);
    } catch (IOException ex) {
      log.error("search I/O failure", ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("search configuration error: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("search interrupted", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in search", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
