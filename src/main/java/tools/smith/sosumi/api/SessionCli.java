package tools.smith.sosumi.api;

import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.smith.sosumi.api.CommandSupport.Invocation;
import tools.smith.sosumi.api.CommandSupport.Prepared;
import tools.smith.sosumi.application.bundle.BundleException;
import tools.smith.sosumi.domain.search.SearchResult;
import tools.smith.sosumi.validation.Strings;

/**
 * Entry point for {@code sosumi session}: prints one session by id.
 *
 * @since 1.2.0
 */
public final class SessionCli {
  private static final Logger log = LoggerFactory.getLogger(SessionCli.class);
  private static final String SUMMARY_USAGE =
      "usage: sosumi session <id> [mode=user|agent] [format=markdown|json] [bundle=PATH]";
  private static final String HELP_TEXT = """
      sosumi session: show one WWDC session

      Usage:
        sosumi session <id> [options]

      Options:
        mode=user|agent        Snippet and link, or full transcript in paragraphs (default user)
        format=markdown|json   Output format (default markdown)
        bundle=PATH            Use this bundle instead of searching the default locations
        --verbose              Enable DEBUG logging
        --help                 Show this message
      """;

  private SessionCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    return run(args, CommandContext.system());
  }

  static ExitCode run(String[] args, CommandContext ctx) {
    Prepared prepared = CommandSupport.prepare("session", args, ctx, log, SUMMARY_USAGE, HELP_TEXT);
    if (prepared.stop()) {
      return prepared.exit();
    }
    Invocation invocation = prepared.invocation();
    Optional<Path> bundle = CommandSupport.locateOrReport("session", invocation.root());
    if (bundle.isEmpty()) {
      return ExitCode.BUNDLE_MISSING;
    }

    String id;
    try {
      id = Strings.requireIdentifier("session id", CommandSupport.joinPositionals(invocation, "id"));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid session id: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try {
      Optional<SearchResult> session = invocation.root().sessionLookupUseCase().lookup(bundle.get(), id);
      if (session.isEmpty()) {
        log.error("Session not found: {}", id);
        return ExitCode.NOT_FOUND;
      }
      CliPrinter.println(invocation.root().renderer()
          .renderSession(session.get(), invocation.config().mode())
          .stripTrailing());
      return ExitCode.SUCCESS;
    } catch (BundleException ex) {
      return CommandSupport.fail(log, ex);
    } catch (IllegalArgumentException ex) {
      log.error("session configuration error: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in session lookup", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
