package tools.smith.sosumi.infrastructure.locate;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Finds the bundle artifact by checking an ordered list of filesystem locations.
 * <p><strong>Order:</strong> {@code <home>/wwdc.db}, {@code <home>/wwdc_bundle.encrypted},
 * {@code <cwd>/wwdc_bundle.encrypted}, and {@code <appDir>/DATA/wwdc_bundle.encrypted}. The first regular, readable
 * file wins. A configured explicit path replaces the list: it is the only candidate, and a missing explicit path is
 * never answered with a default location.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 1.2.0
 */
public final class BundleLocator {
  private static final Logger log = LoggerFactory.getLogger(BundleLocator.class);

  /** File name of the plain, already-decrypted development database. */
  public static final String PLAIN_DATABASE = "wwdc.db";
  /** File name of the distributed encrypted bundle. */
  public static final String BUNDLE_FILE = "wwdc_bundle.encrypted";
  /** Directory under the application directory that ships the bundle. */
  public static final String DATA_DIR = "DATA";

  private final Path explicit;
  private final List<Path> defaults;

  /**
   * Creates a locator.
   *
   * @param explicit configured bundle path that replaces the default locations; may be {@code null}
   * @param home sosumi home directory, normally {@code ~/.sosumi}
   * @param workingDir current working directory
   * @param appDir application install directory; may be {@code null} when unknown
   */
  public BundleLocator(Path explicit, Path home, Path workingDir, Path appDir) {
    Objects.requireNonNull(home, "home");
    Objects.requireNonNull(workingDir, "workingDir");
    this.explicit = explicit;
    List<Path> paths = new ArrayList<>(4);
    paths.add(home.resolve(PLAIN_DATABASE));
    paths.add(home.resolve(BUNDLE_FILE));
    paths.add(workingDir.resolve(BUNDLE_FILE));
    if (appDir != null) {
      paths.add(appDir.resolve(DATA_DIR).resolve(BUNDLE_FILE));
    }
    this.defaults = List.copyOf(paths);
  }

  /**
   * Returns every location this locator checks, in order.
   *
   * @return candidate paths
   */
  public List<Path> candidates() {
    return explicit == null ? defaults : List.of(explicit);
  }

  /**
   * Finds the first existing artifact.
   *
   * @return path of the artifact, or empty when none exists
   */
  public Optional<Path> locate() {
    for (Path candidate : candidates()) {
      if (Files.isRegularFile(candidate) && Files.isReadable(candidate)) {
        log.debug("Using bundle at {}", candidate);
        return Optional.of(candidate);
      }
      log.debug("No bundle at {}", candidate);
    }
    return Optional.empty();
  }

  /**
   * Indicates whether any candidate exists.
   *
   * @return {@code true} when {@link #locate()} would succeed
   */
  public boolean exists() {
    return locate().isPresent();
  }
}
