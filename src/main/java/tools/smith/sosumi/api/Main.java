package tools.smith.sosumi.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * sosumi CLI dispatcher that routes to subcommands.
 *
 * @since 1.2.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE =
      "usage: sosumi <wwdc|search|session|year|stats|build|bundle-status> [options]";
  private static final String HELP_TEXT = """
      sosumi: offline WWDC session search

      Usage:
        sosumi <command> [options]

      Commands:
        wwdc           Search session transcripts (user or agent output)
        search         Search with results grouped into recent and earlier sessions
        session        Show one session by id
        year           List the sessions of one year
        stats          Summarize the installed bundle
        build          Build a bundle from plaintext sessions
        bundle-status  Show which bundle would be used

      Global flags:
        --help      Show this message (or <command> --help for details)
        --verbose   Enable DEBUG logging
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    return run(args, CommandContext.system());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments; the first bare word names the subcommand
   * @param ctx process environment
   * @return exit code reported by the delegated command
   */
  static ExitCode run(String[] args, CommandContext ctx) {
    String command = null;
    List<String> delegate = new ArrayList<>();
    if (args != null) {
      for (String arg : args) {
        if (arg == null) {
          continue;
        }
        if (command == null && CliInput.classify(arg) == CliInput.Kind.WORD) {
          command = arg.trim().toLowerCase(Locale.ROOT);
          continue;
        }
        delegate.add(arg);
      }
    }
    if (command == null) {
      if (CliInput.parse(args).help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String[] delegateArgs = delegate.toArray(String[]::new);
    return switch (command) {
      case "wwdc" -> WwdcCli.run(delegateArgs, ctx);
      case "search" -> SearchCli.run(delegateArgs, ctx);
      case "session" -> SessionCli.run(delegateArgs, ctx);
      case "year" -> YearCli.run(delegateArgs, ctx);
      case "stats" -> StatsCli.run(delegateArgs, ctx);
      case "build" -> BuildCli.run(delegateArgs, ctx);
      case "bundle-status" -> BundleStatusCli.run(delegateArgs, ctx);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
