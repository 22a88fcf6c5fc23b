package tools.smith.sosumi.domain.search;

import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> One matched session with its score, excerpt, and decrypted transcript.
 * <p><strong>Role:</strong> Produced by the search engine, consumed by renderers. Carries no ordering; renderers
 * sort by {@link #relevanceScore()}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param id record identifier
 * @param title de-obfuscated title
 * @param year session year
 * @param relevanceScore heuristic score, never below {@code 1.0}
 * @param excerpt best matching sentence or transcript prefix
 * @param timeSegments up to four timestamped contexts mentioning the query; never {@code null}
 * @param transcript full decrypted transcript; empty for placeholder results
 * @param webUrl canonical link to the session video
 * @since 1.2.0
 */
public record SearchResult(
    String id,
    String title,
    int year,
    double relevanceScore,
    String excerpt,
    List<TimeSegment> timeSegments,
    String transcript,
    String webUrl) {

  public SearchResult {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(title, "title");
    Objects.requireNonNull(excerpt, "excerpt");
    timeSegments = timeSegments == null ? List.of() : List.copyOf(timeSegments);
    transcript = transcript == null ? "" : transcript;
    Objects.requireNonNull(webUrl, "webUrl");
  }
}
