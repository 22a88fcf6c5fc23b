package tools.smith.sosumi.infrastructure.render;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import tools.smith.sosumi.domain.search.SearchResult;

/**
 * <strong>What:</strong> Turns search results and session details into printable text.
 * <p><strong>Ordering:</strong> implementations present results by score descending, then id ascending, and apply the
 * limit after sorting (see {@link #ranked(List, int)}).</p>
 *
 * @since 1.2.0
 */
public interface ResultRenderer {
  /** Sort order shared by all renderers. */
  Comparator<SearchResult> RANKING =
      Comparator.comparingDouble(SearchResult::relevanceScore).reversed().thenComparing(SearchResult::id);

  /**
   * Renders query results.
   *
   * @param query raw query text
   * @param results unordered results
   * @param style output contract
   * @param limit maximum results to show
   * @return rendered text
   */
  String renderResults(String query, List<SearchResult> results, RenderStyle style, int limit);

  /**
   * Renders a non-query listing such as all sessions of one year.
   *
   * @param heading listing title
   * @param results unordered entries
   * @param style output contract
   * @param limit maximum entries to show
   * @return rendered text
   */
  String renderListing(String heading, List<SearchResult> results, RenderStyle style, int limit);

  /**
   * Renders a single session.
   *
   * @param session session detail
   * @param style output contract
   * @return rendered text
   */
  String renderSession(SearchResult session, RenderStyle style);

  /**
   * Sorts by score descending then id ascending and keeps the first {@code limit} entries.
   *
   * @param results unordered results
   * @param limit maximum entries; must be positive
   * @return ordered, limited copy
   */
  static List<SearchResult> ranked(List<SearchResult> results, int limit) {
    Objects.requireNonNull(results, "results");
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be positive");
    }
    List<SearchResult> sorted = new ArrayList<>(results);
    sorted.sort(RANKING);
    return sorted.size() > limit ? List.copyOf(sorted.subList(0, limit)) : List.copyOf(sorted);
  }

  /**
   * Returns the renderer for a format.
   *
   * @param format output format
   * @return renderer
   */
  static ResultRenderer forFormat(OutputFormat format) {
    return switch (Objects.requireNonNull(format, "format")) {
      case MARKDOWN -> new MarkdownResultRenderer();
      case JSON -> new JsonResultRenderer();
    };
  }
}
