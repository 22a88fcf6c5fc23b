package tools.smith.sosumi.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.smith.sosumi.api.CommandSupport.Prepared;
import tools.smith.sosumi.infrastructure.locate.BundleLocator;

/**
 * Entry point for {@code sosumi bundle-status}: reports where the bundle was found. Diagnostic only; a missing bundle
 * is reported but is not an error.
 *
 * @since 1.2.0
 */
public final class BundleStatusCli {
  private static final Logger log = LoggerFactory.getLogger(BundleStatusCli.class);
  private static final String SUMMARY_USAGE = "usage: sosumi bundle-status [bundle=PATH]";
  private static final String HELP_TEXT = """
      sosumi bundle-status: show which bundle sosumi would use

      Usage:
        sosumi bundle-status [bundle=PATH] [--verbose]
      """;

  private BundleStatusCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    return run(args, CommandContext.system());
  }

  static ExitCode run(String[] args, CommandContext ctx) {
    Prepared prepared = CommandSupport.prepare("bundle-status", args, ctx, log, SUMMARY_USAGE, HELP_TEXT);
    if (prepared.stop()) {
      return prepared.exit();
    }
    BundleLocator locator = prepared.invocation().root().bundleLocator();
    Optional<Path> located = locator.locate();
    if (located.isEmpty()) {
      CliPrinter.println("Bundle not found");
      CliPrinter.println(" Searched:");
      for (Path candidate : locator.candidates()) {
        CliPrinter.println("  - " + candidate);
      }
      return ExitCode.SUCCESS;
    }
    Path bundle = located.get();
    CliPrinter.println("Bundle found: " + bundle);
    try {
      CliPrinter.println(" Size: " + CommandSupport.formatBytes(Files.size(bundle)));
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Unable to read bundle size for {}", bundle, ex);
      return ExitCode.IO_ERROR;
    }
  }
}
