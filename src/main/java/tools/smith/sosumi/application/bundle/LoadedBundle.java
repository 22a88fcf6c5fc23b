package tools.smith.sosumi.application.bundle;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import tools.smith.sosumi.domain.bundle.Archive;
import tools.smith.sosumi.domain.bundle.SessionRecord;

/**
 * <strong>What:</strong> A parsed archive paired with lazily decrypted record content.
 * <p><strong>Why:</strong> Records are decrypted only when they become candidates, and at most once per load, so a
 * query never pays for decrypting the whole corpus up front.</p>
 * <p><strong>Thread-safety:</strong> The archive is immutable and the content cache is concurrent; scan workers may
 * share one instance.</p>
 *
 * @since 1.2.0
 */
public final class LoadedBundle {
  private final Path source;
  private final long sizeBytes;
  private final Archive archive;
  private final RecordDecryptor decryptor;
  private final Map<String, RecordContent> contents = new ConcurrentHashMap<>();

  /**
   * Creates a loaded bundle.
   *
   * @param source file the archive was read from; may be {@code null} for in-memory archives
   * @param sizeBytes on-disk size of the artifact
   * @param archive parsed archive
   * @param decryptor decryptor bound to the archive's protection mode
   */
  public LoadedBundle(Path source, long sizeBytes, Archive archive, RecordDecryptor decryptor) {
    this.source = source;
    this.sizeBytes = sizeBytes;
    this.archive = Objects.requireNonNull(archive, "archive");
    this.decryptor = Objects.requireNonNull(decryptor, "decryptor");
  }

  public Optional<Path> source() {
    return Optional.ofNullable(source);
  }

  public long sizeBytes() {
    return sizeBytes;
  }

  public Archive archive() {
    return archive;
  }

  /**
   * Indicates whether content can be opened with the current key configuration.
   *
   * @return {@code false} for a sealed archive without a key
   */
  public boolean contentAccessible() {
    return decryptor.canOpen();
  }

  /**
   * Returns the memoized content outcome for a record, opening it on first access.
   *
   * @param record record belonging to this archive
   * @return content outcome
   */
  public RecordContent content(SessionRecord record) {
    Objects.requireNonNull(record, "record");
    return contents.computeIfAbsent(record.id(), id -> decryptor.open(record));
  }

  /**
   * Returns the record's plaintext, or empty when the key is absent or authentication fails.
   *
   * @param record record belonging to this archive
   * @return optional plaintext
   */
  public Optional<String> decrypt(SessionRecord record) {
    return content(record).plaintext();
  }
}
