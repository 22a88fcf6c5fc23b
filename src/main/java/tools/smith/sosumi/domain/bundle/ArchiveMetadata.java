package tools.smith.sosumi.domain.bundle;

import java.util.Objects;

/**
 * Informational archive metadata. Never consulted for search correctness.
 *
 * @param totalSessions record count recorded at build time
 * @param firstYear earliest session year recorded at build time
 * @param lastYear latest session year recorded at build time
 * @param createdAt ISO-8601 build timestamp; may be {@code null} for hand-made archives
 * @param obfuscationVersion title substitution table version
 * @param protection how record content is stored
 * @since 1.2.0
 */
public record ArchiveMetadata(
    int totalSessions,
    int firstYear,
    int lastYear,
    String createdAt,
    int obfuscationVersion,
    ContentProtection protection) {

  public ArchiveMetadata {
    Objects.requireNonNull(protection, "protection");
  }

  /**
   * Metadata used when an envelope omits the section entirely.
   *
   * @return empty sealed metadata
   */
  public static ArchiveMetadata empty() {
    return new ArchiveMetadata(0, 0, 0, null, 1, ContentProtection.SEALED);
  }
}
