package tools.smith.sosumi.api;

import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.CodeSource;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process environment a command runs in: environment variables, working directory, install directory, and user
 * home. Tests substitute their own values.
 *
 * @param env environment variables
 * @param workingDir current working directory
 * @param appDir directory the application is installed in, or {@code null} when unknown
 * @param userHome user home directory
 * @since 1.2.0
 */
record CommandContext(Map<String, String> env, Path workingDir, Path appDir, Path userHome) {
  private static final Logger log = LoggerFactory.getLogger(CommandContext.class);
  static final String APP_DIR_PROPERTY = "sosumi.app.dir";

  CommandContext {
    env = Map.copyOf(Objects.requireNonNull(env, "env"));
    Objects.requireNonNull(workingDir, "workingDir");
    Objects.requireNonNull(userHome, "userHome");
  }

  static CommandContext system() {
    return new CommandContext(
        System.getenv(),
        Path.of("").toAbsolutePath(),
        detectAppDir(),
        Path.of(System.getProperty("user.home")));
  }

  private static Path detectAppDir() {
    String configured = System.getProperty(APP_DIR_PROPERTY);
    if (configured != null && !configured.isBlank()) {
      return Path.of(configured.trim());
    }
    try {
      CodeSource source = Main.class.getProtectionDomain().getCodeSource();
      if (source == null || source.getLocation() == null) {
        return null;
      }
      Path location = Path.of(source.getLocation().toURI());
      return Files.isRegularFile(location) ? location.getParent() : location;
    } catch (URISyntaxException | SecurityException | IllegalArgumentException ex) {
      log.debug("Unable to determine application directory: {}", ex.getMessage());
      return null;
    }
  }
}
