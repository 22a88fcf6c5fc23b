package tools.smith.sosumi.api;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.smith.sosumi.api.CommandSupport.Invocation;
import tools.smith.sosumi.api.CommandSupport.Prepared;
import tools.smith.sosumi.application.bundle.BundleException;
import tools.smith.sosumi.application.pipeline.BundleStatistics;

/**
 * Entry point for {@code sosumi stats}: summarizes the located bundle without decrypting it.
 *
 * @since 1.2.0
 */
public final class StatsCli {
  private static final Logger log = LoggerFactory.getLogger(StatsCli.class);
  private static final String SUMMARY_USAGE = "usage: sosumi stats [bundle=PATH]";
  private static final String HELP_TEXT = """
      sosumi stats: summarize the WWDC bundle

      Usage:
        sosumi stats [bundle=PATH] [--verbose]

      Prints session counts per year, index size, build time, artifact size, and content protection.
      """;

  private StatsCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    return run(args, CommandContext.system());
  }

  static ExitCode run(String[] args, CommandContext ctx) {
    Prepared prepared = CommandSupport.prepare("stats", args, ctx, log, SUMMARY_USAGE, HELP_TEXT);
    if (prepared.stop()) {
      return prepared.exit();
    }
    Invocation invocation = prepared.invocation();
    Optional<Path> bundle = CommandSupport.locateOrReport("stats", invocation.root());
    if (bundle.isEmpty()) {
      return ExitCode.BUNDLE_MISSING;
    }
    try {
      BundleStatistics stats = invocation.root().bundleStatsUseCase().stats(bundle.get());
      CliPrinter.printLines(lines(stats).toArray(String[]::new));
      return ExitCode.SUCCESS;
    } catch (BundleException ex) {
      return CommandSupport.fail(log, ex);
    } catch (IllegalArgumentException ex) {
      log.error("stats configuration error: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in stats", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static List<String> lines(BundleStatistics stats) {
    List<String> lines = new ArrayList<>();
    lines.add("WWDC bundle statistics");
    lines.add(" Bundle           : " + stats.path());
    lines.add(" Size             : " + CommandSupport.formatBytes(stats.sizeBytes()));
    lines.add(" Protection       : " + stats.protection().wireName());
    lines.add(" Built            : " + (stats.createdAt() == null ? "<unknown>" : stats.createdAt()));
    lines.add(" Sessions         : " + stats.recordCount());
    if (stats.firstYear().isPresent()) {
      lines.add(" Years            : " + stats.firstYear().getAsInt() + "-" + stats.lastYear().getAsInt());
    } else {
      lines.add(" Years            : <none>");
    }
    lines.add(" Index terms      : " + stats.indexTerms());
    if (!stats.sessionsPerYear().isEmpty()) {
      lines.add(" Sessions by year :");
      for (Map.Entry<Integer, Integer> entry : stats.sessionsPerYear().entrySet()) {
        lines.add("   " + entry.getKey() + "  " + entry.getValue());
      }
    }
    return lines;
  }
}
