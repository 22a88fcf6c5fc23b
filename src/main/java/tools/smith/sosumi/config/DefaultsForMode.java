package tools.smith.sosumi.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Supplies flattened default configuration maps for each sosumi command.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys and CLI options.</p>
 */
public final class DefaultsForMode {
  /** Environment variable holding the shared content key. */
  public static final String DEFAULT_KEY_ENV = "SOSUMI_ENCRYPTION_KEY";

  /** Commands that may carry their own section in {@code sosumi.yaml}. */
  public static final Set<String> COMMANDS =
      Set.of("search", "wwdc", "session", "year", "stats", "build", "bundle-status");

  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested command merged with common defaults.
   *
   * @param command CLI command
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException for unknown commands
   */
  public static Map<String, String> asFlatMap(String command) {
    Objects.requireNonNull(command, "command");
    String normalized = command.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "search" -> Map.of("limit", "20");
      case "wwdc" -> Map.of("limit", "10", "verbosity", "detailed", "format", "markdown");
      case "session" -> Map.of("mode", "user", "format", "markdown");
      case "year" -> Map.of("mode", "user", "format", "markdown", "limit", "200");
      case "stats", "bundle-status", "build" -> Map.of();
      default -> throw new IllegalArgumentException("Unsupported command: " + command);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("home", "");
    map.put("bundle", "");
    map.put("keyEnv", DEFAULT_KEY_ENV);
    map.put("scanThreads", "1");
    map.put("synonyms", "");
    map.put("limit", "10");
    map.put("verbosity", "detailed");
    map.put("format", "markdown");
    map.put("mode", "user");
    return Map.copyOf(map);
  }
}
