package tools.smith.sosumi.infrastructure.persistence;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * File helpers for bundle artifacts. Writes go through a sibling temp file so a failed build never leaves a partial
 * artifact behind.
 *
 * @since 1.2.0
 */
public final class BundleFiles {
  private static final Logger log = LoggerFactory.getLogger(BundleFiles.class);

  private BundleFiles() {}

  /**
   * Writes {@code data} to {@code target}, replacing any existing file only once the bytes are fully on disk.
   *
   * @param target destination file
   * @param data bytes to write
   * @throws IOException if the temp file cannot be written or moved into place
   */
  public static void writeAtomically(Path target, byte[] data) throws IOException {
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(data, "data");
    Path absolute = target.toAbsolutePath();
    Path parent = absolute.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Path temp = Files.createTempFile(parent, absolute.getFileName().toString(), ".tmp");
    try {
      Files.write(temp, data);
      try {
        Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException ex) {
        log.debug("Atomic move unsupported for {}; falling back to replace", absolute);
        Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  /**
   * Reads a whole file.
   *
   * @param source file to read
   * @return file bytes
   * @throws IOException if the file cannot be read
   */
  public static byte[] readAll(Path source) throws IOException {
    return Files.readAllBytes(Objects.requireNonNull(source, "source"));
  }
}
