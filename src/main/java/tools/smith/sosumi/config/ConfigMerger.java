package tools.smith.sosumi.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import tools.smith.sosumi.infrastructure.render.OutputFormat;
import tools.smith.sosumi.infrastructure.render.RenderStyle;
import tools.smith.sosumi.validation.Numbers;
import tools.smith.sosumi.validation.Strings;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and invariants.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI > YAML > defaults.
   *
   * @param command active CLI command
   * @param yaml optional YAML-derived settings for the command
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the command
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String command,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(command, "command");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      String value = entry.getValue();
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (value != null) {
        merged.put(key, value);
      }
    }

    validate(merged);
    return Map.copyOf(merged);
  }

  private static void validate(Map<String, String> effective) {
    Numbers.parseInt("limit", effective.getOrDefault("limit", "10"), 1, SosumiConfig.MAX_LIMIT);
    Numbers.parseInt("scanThreads", effective.getOrDefault("scanThreads", "1"), 1, SosumiConfig.MAX_SCAN_THREADS);
    RenderStyle.fromVerbosity(effective.getOrDefault("verbosity", "detailed"));
    RenderStyle.fromMode(effective.getOrDefault("mode", "user"));
    OutputFormat.parse(effective.getOrDefault("format", "markdown"));
    Strings.requireEnvName("keyEnv", effective.getOrDefault("keyEnv", DefaultsForMode.DEFAULT_KEY_ENV));
  }
}
