package tools.smith.sosumi.application.pipeline;

import java.nio.file.Path;
import tools.smith.sosumi.domain.bundle.ContentProtection;

/**
 * Outcome of a bundle build.
 *
 * @param output written artifact
 * @param recordCount sessions written
 * @param skipped input sessions skipped as incomplete or duplicate
 * @param indexTerms search index terms written
 * @param plaintextBytes size of the serialized envelope before compression
 * @param artifactBytes size of the written artifact
 * @param protection content protection of the artifact
 * @since 1.2.0
 */
public record BuildReport(
    Path output,
    int recordCount,
    int skipped,
    int indexTerms,
    long plaintextBytes,
    long artifactBytes,
    ContentProtection protection) {

  /**
   * Space saved by compression as a percentage of the plaintext size.
   *
   * @return {@code 100 - artifact / plaintext * 100}, or {@code 0} for an empty envelope
   */
  public double compressionRatio() {
    if (plaintextBytes == 0) {
      return 0.0;
    }
    return 100.0 - (artifactBytes * 100.0 / plaintextBytes);
  }
}
