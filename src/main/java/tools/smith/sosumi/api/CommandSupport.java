package tools.smith.sosumi.api;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import tools.smith.sosumi.application.bundle.BundleException;
import tools.smith.sosumi.config.CompositionRoot;
import tools.smith.sosumi.config.ConfigMerger;
import tools.smith.sosumi.config.DefaultsForMode;
import tools.smith.sosumi.config.SosumiConfig;
import tools.smith.sosumi.config.YamlConfigLoader;
import tools.smith.sosumi.infrastructure.locate.BundleLocator;
import tools.smith.sosumi.logging.LoggingConfigurator;

/**
 * Shared command bootstrap: help, verbosity, argument parsing, config file merge, and bundle location.
 */
final class CommandSupport {

  private CommandSupport() {}

  /**
   * Result of bootstrapping a command: either an invocation to run or an exit code to return immediately.
   *
   * @param invocation parsed invocation, or {@code null} when {@code exit} is set
   * @param exit early exit code, or {@code null} when the command should run
   */
  record Prepared(Invocation invocation, ExitCode exit) {
    boolean stop() {
      return exit != null;
    }
  }

  /**
   * Parsed command invocation.
   *
   * @param input raw parsed input
   * @param options effective key/value configuration
   * @param root wired adapters and use cases
   */
  record Invocation(CliInput input, Map<String, String> options, CompositionRoot root) {
    List<String> positionals() {
      return input.positionals();
    }

    SosumiConfig config() {
      return root.config();
    }
  }

  static Prepared prepare(
      String command, String[] args, CommandContext ctx, Logger log, String summaryUsage, String helpText) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(helpText.stripTrailing());
      return new Prepared(null, ExitCode.SUCCESS);
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {} command", command);
    }

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(summaryUsage);
      return new Prepared(null, ExitCode.INVALID_ARGS);
    }

    Path configPath = configPath(kv, ctx.userHome());
    Optional<Map<String, String>> yamlConfig;
    try {
      yamlConfig = YamlConfigLoader.load(configPath, command);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid YAML configuration: {}", ex.getMessage());
      return new Prepared(null, ExitCode.CONFIG_ERROR);
    } catch (IOException ex) {
      log.error("Unable to read configuration file {}", configPath, ex);
      return new Prepared(null, ExitCode.IO_ERROR);
    }
    yamlConfig.ifPresent(values -> log.debug("Loaded {} settings from {}", values.size(), configPath));

    SosumiConfig config;
    Map<String, String> effective;
    try {
      effective = ConfigMerger.buildEffectiveConfig(
          command, yamlConfig, kv, DefaultsForMode.asFlatMap(command), log::warn);
      config = SosumiConfig.fromMap(effective, ctx.userHome());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", command, ex.getMessage());
      CliPrinter.println(summaryUsage);
      return new Prepared(null, ExitCode.INVALID_ARGS);
    }
    CompositionRoot root = new CompositionRoot(config, ctx.env(), ctx.workingDir(), ctx.appDir());
    return new Prepared(new Invocation(input, effective, root), null);
  }

  /**
   * Locates the bundle or prints the missing-bundle report.
   *
   * @param command command name used in the remediation examples
   * @param root composition root
   * @return bundle path, or empty after the report was printed
   */
  static Optional<Path> locateOrReport(String command, CompositionRoot root) {
    BundleLocator locator = root.bundleLocator();
    Optional<Path> located = locator.locate();
    if (located.isEmpty()) {
      MissingBundleReport.print(command, locator.candidates());
    }
    return located;
  }

  /**
   * Logs a bundle failure and maps it to an exit code.
   *
   * @param log command logger
   * @param ex failure
   * @return exit code for the failure category
   */
  static ExitCode fail(Logger log, BundleException ex) {
    log.error("{} ({})", ex.getMessage(), ex.failure().label());
    if (ex.getCause() != null) {
      log.debug("Underlying cause", ex.getCause());
    }
    return ExitCode.forFailure(ex.failure());
  }

  static String joinPositionals(Invocation invocation, String key) {
    String joined = String.join(" ", invocation.positionals());
    if (!joined.isBlank()) {
      return joined;
    }
    return invocation.options().get(key);
  }

  static String formatBytes(long bytes) {
    if (bytes < 1024) {
      return bytes + " B";
    }
    String[] units = {"KB", "MB", "GB", "TB"};
    double value = bytes;
    int unit = -1;
    while (value >= 1024 && unit < units.length - 1) {
      value /= 1024;
      unit++;
    }
    return String.format(Locale.ROOT, "%.1f %s", value, units[unit]);
  }

  private static Path configPath(Map<String, String> kv, Path userHome) {
    String explicit = kv.remove("config");
    if (explicit != null && !explicit.isBlank()) {
      return SosumiConfig.expand(explicit.trim(), userHome);
    }
    String home = kv.get("home");
    Path base = home == null || home.isBlank()
        ? SosumiConfig.defaultHome(userHome)
        : SosumiConfig.expand(home.trim(), userHome);
    return base.resolve(SosumiConfig.CONFIG_FILE);
  }
}
