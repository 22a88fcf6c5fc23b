package tools.smith.sosumi.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.smith.sosumi.api.CommandSupport.Invocation;
import tools.smith.sosumi.api.CommandSupport.Prepared;
import tools.smith.sosumi.application.pipeline.BuildReport;
import tools.smith.sosumi.application.pipeline.BundleBuildException;
import tools.smith.sosumi.application.port.ContentCipher;
import tools.smith.sosumi.config.SosumiConfig;

/**
 * Entry point for {@code sosumi build}: turns a plaintext session corpus into a bundle.
 *
 * @since 1.2.0
 */
public final class BuildCli {
  private static final Logger log = LoggerFactory.getLogger(BuildCli.class);
  private static final String SUMMARY_USAGE = "usage: sosumi build in=PATH out=PATH [plain=true]";
  private static final String HELP_TEXT = """
      sosumi build: create a WWDC bundle from plaintext sessions

      Usage:
        sosumi build in=PATH out=PATH [plain=true]

      Options:
        in=PATH        JSON corpus: {"sessions": [...], "search_index": {...}} or a bare session array
        out=PATH       Artifact to write (replaced atomically)
        plain=true     Write the uncompressed, unencrypted development database (no key needed)
        keyEnv=NAME    Environment variable holding the key (default SOSUMI_ENCRYPTION_KEY)
        --verbose      Enable DEBUG logging
        --help         Show this message

      Sessions need hash, title, year, and content; excerpt and web_url are optional.
      """;

  private BuildCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    return run(args, CommandContext.system());
  }

  static ExitCode run(String[] args, CommandContext ctx) {
    Prepared prepared = CommandSupport.prepare("build", args, ctx, log, SUMMARY_USAGE, HELP_TEXT);
    if (prepared.stop()) {
      return prepared.exit();
    }
    Invocation invocation = prepared.invocation();
    Map<String, String> options = invocation.options();
    String in = options.get("in");
    String out = options.get("out");
    if (in == null || out == null) {
      log.error("Both in= and out= are required");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    Path input = SosumiConfig.expand(in, ctx.userHome());
    Path output = SosumiConfig.expand(out, ctx.userHome());
    if (!Files.isRegularFile(input)) {
      log.error("Input corpus does not exist: {}", input);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    boolean plain = Boolean.parseBoolean(options.getOrDefault("plain", "false").trim().toLowerCase(Locale.ROOT));

    Optional<ContentCipher> cipher;
    try {
      cipher = plain ? Optional.empty() : invocation.root().contentCipher(true);
    } catch (IllegalArgumentException ex) {
      log.error("Encryption key unavailable: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    try {
      BuildReport report = invocation.root().bundleBuildUseCase().build(input, output, cipher, plain);
      CliPrinter.printLines(
          "Bundle written: " + report.output(),
          " Sessions       : " + report.recordCount() + " (" + report.skipped() + " skipped)",
          " Index terms    : " + report.indexTerms(),
          " Protection     : " + report.protection().wireName(),
          " Plaintext size : " + CommandSupport.formatBytes(report.plaintextBytes()),
          " Artifact size  : " + CommandSupport.formatBytes(report.artifactBytes()),
          " Compression    : " + String.format(Locale.ROOT, "%.1f%%", report.compressionRatio()));
      return ExitCode.SUCCESS;
    } catch (BundleBuildException ex) {
      log.error("Bundle build aborted: {}", ex.getMessage(), ex);
      return ExitCode.DATA_ERROR;
    } catch (IOException ex) {
      log.error("Bundle build I/O failure", ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Bundle build configuration error: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in bundle build", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
