package tools.smith.sosumi.config;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import tools.smith.sosumi.infrastructure.render.OutputFormat;
import tools.smith.sosumi.infrastructure.render.RenderStyle;
import tools.smith.sosumi.validation.Numbers;
import tools.smith.sosumi.validation.Strings;

/**
 * Immutable effective configuration shared by every sosumi command.
 *
 * @param home sosumi home directory holding the installed bundle and config file
 * @param bundle explicit bundle path that takes precedence over the search locations
 * @param limit maximum results rendered
 * @param verbosity rendering style selected by {@code verbosity}
 * @param mode rendering style selected by {@code mode}
 * @param format output format
 * @param scanThreads worker count for the search scan phase
 * @param keyEnv environment variable holding the shared key
 * @param synonyms synonym table file overriding the packaged table
 * @since 1.2.0
 */
public record SosumiConfig(
    Path home,
    Optional<Path> bundle,
    int limit,
    RenderStyle verbosity,
    RenderStyle mode,
    OutputFormat format,
    int scanThreads,
    String keyEnv,
    Optional<Path> synonyms) {

  static final int MAX_LIMIT = 1000;
  static final int MAX_SCAN_THREADS = 64;
  /** Directory under the user home that holds sosumi data. */
  public static final String HOME_DIR = ".sosumi";
  /** Config file name inside the sosumi home directory. */
  public static final String CONFIG_FILE = "sosumi.yaml";

  public SosumiConfig {
    Objects.requireNonNull(home, "home");
    Objects.requireNonNull(bundle, "bundle");
    Objects.requireNonNull(verbosity, "verbosity");
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(format, "format");
    Objects.requireNonNull(keyEnv, "keyEnv");
    Objects.requireNonNull(synonyms, "synonyms");
  }

  /**
   * Returns the default sosumi home for a user home directory.
   *
   * @param userHome user home directory
   * @return {@code <userHome>/.sosumi}
   */
  public static Path defaultHome(Path userHome) {
    return userHome.resolve(HOME_DIR);
  }

  /**
   * Builds a configuration from a flat key/value map.
   *
   * @param values effective configuration map
   * @param userHome user home used when {@code home} is blank
   * @return parsed configuration
   * @throws IllegalArgumentException when a value is invalid
   */
  public static SosumiConfig fromMap(Map<String, String> values, Path userHome) {
    Objects.requireNonNull(values, "values");
    Objects.requireNonNull(userHome, "userHome");
    String homeText = trim(values.get("home"));
    Path home = homeText.isEmpty() ? defaultHome(userHome) : expand(homeText, userHome);
    String bundleText = trim(values.get("bundle"));
    String synonymsText = trim(values.get("synonyms"));
    return new SosumiConfig(
        home,
        bundleText.isEmpty() ? Optional.empty() : Optional.of(expand(bundleText, userHome)),
        Numbers.parseInt("limit", orDefault(values, "limit", "10"), 1, MAX_LIMIT),
        RenderStyle.fromVerbosity(orDefault(values, "verbosity", "detailed")),
        RenderStyle.fromMode(orDefault(values, "mode", "user")),
        OutputFormat.parse(orDefault(values, "format", "markdown")),
        Numbers.parseInt("scanThreads", orDefault(values, "scanThreads", "1"), 1, MAX_SCAN_THREADS),
        Strings.requireEnvName("keyEnv", orDefault(values, "keyEnv", DefaultsForMode.DEFAULT_KEY_ENV)),
        synonymsText.isEmpty() ? Optional.empty() : Optional.of(expand(synonymsText, userHome)));
  }

  /**
   * Expands a leading {@code ~} against the user home.
   *
   * @param path configured path text
   * @param userHome user home directory
   * @return expanded path
   */
  public static Path expand(String path, Path userHome) {
    if (path.equals("~")) {
      return userHome;
    }
    if (path.startsWith("~/")) {
      return userHome.resolve(path.substring(2));
    }
    return Path.of(path);
  }

  private static String orDefault(Map<String, String> values, String key, String fallback) {
    String value = trim(values.get(key));
    return value.isEmpty() ? fallback : value;
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
