package tools.smith.sosumi.api;

import java.nio.file.Path;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.smith.sosumi.api.CommandSupport.Invocation;
import tools.smith.sosumi.api.CommandSupport.Prepared;
import tools.smith.sosumi.application.bundle.BundleException;
import tools.smith.sosumi.application.port.ClockPort;
import tools.smith.sosumi.domain.search.SearchResult;
import tools.smith.sosumi.infrastructure.render.RenderStyle;
import tools.smith.sosumi.validation.Numbers;

/**
 * Entry point for {@code sosumi year}: lists the sessions of one conference year.
 *
 * @since 1.2.0
 */
public final class YearCli {
  private static final Logger log = LoggerFactory.getLogger(YearCli.class);
  static final int FIRST_YEAR = 2007;
  private static final String SUMMARY_USAGE =
      "usage: sosumi year <year> [mode=user|agent] [limit=N] [format=markdown|json] [bundle=PATH]";
  private static final String HELP_TEXT = """
      sosumi year: list WWDC sessions from one year

      Usage:
        sosumi year <year> [options]

      Options:
        mode=user|agent        Titles and links, or titles with transcripts (default user)
        limit=N                Maximum sessions to show (default 200)
        format=markdown|json   Output format (default markdown)
        bundle=PATH            Use this bundle instead of searching the default locations
        --verbose              Enable DEBUG logging
        --help                 Show this message
      """;

  private YearCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    return run(args, CommandContext.system());
  }

  static ExitCode run(String[] args, CommandContext ctx) {
    Prepared prepared = CommandSupport.prepare("year", args, ctx, log, SUMMARY_USAGE, HELP_TEXT);
    if (prepared.stop()) {
      return prepared.exit();
    }
    Invocation invocation = prepared.invocation();
    Optional<Path> bundle = CommandSupport.locateOrReport("year", invocation.root());
    if (bundle.isEmpty()) {
      return ExitCode.BUNDLE_MISSING;
    }

    int year;
    try {
      int currentYear = ClockPort.SYSTEM.now().atZone(ZoneOffset.UTC).getYear();
      year = Numbers.parseInt("year", CommandSupport.joinPositionals(invocation, "year"), FIRST_YEAR, currentYear + 1);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid year: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    RenderStyle style = invocation.config().mode();
    try {
      List<SearchResult> sessions =
          invocation.root().yearListingUseCase().list(bundle.get(), year, style == RenderStyle.AGENT);
      CliPrinter.println(invocation.root().renderer()
          .renderListing("WWDC " + year + " sessions", sessions, style, invocation.config().limit())
          .stripTrailing());
      return ExitCode.SUCCESS;
    } catch (BundleException ex) {
      return CommandSupport.fail(log, ex);
    } catch (IllegalArgumentException ex) {
      log.error("year configuration error: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in year listing", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
