package tools.smith.sosumi.infrastructure.render;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import tools.smith.sosumi.domain.search.SearchResult;
import tools.smith.sosumi.domain.search.TimeSegment;

/**
 * Plain listing used by the {@code search} command: results split into recent and earlier bands, each sorted by score.
 * <p>The recent band holds sessions from the newest result year and the year before it.</p>
 *
 * @since 1.2.0
 */
public final class LegacyResultFormatter {

  private LegacyResultFormatter() {}

  /**
   * Formats results in the banded layout.
   *
   * @param query raw query text
   * @param results unordered results
   * @param limit maximum results across both bands
   * @return formatted text
   */
  public static String format(String query, List<SearchResult> results, int limit) {
    StringBuilder out = new StringBuilder();
    out.append("# Results for \"").append(query).append("\"\n\n");
    if (results.isEmpty()) {
      out.append("No sessions matched.\n");
      return out.toString();
    }
    List<SearchResult> shown = ResultRenderer.ranked(results, limit);
    int latest = shown.stream().mapToInt(SearchResult::year).max().orElse(0);
    List<SearchResult> recent = new ArrayList<>();
    List<SearchResult> earlier = new ArrayList<>();
    for (SearchResult result : shown) {
      (result.year() >= latest - 1 ? recent : earlier).add(result);
    }
    if (!recent.isEmpty()) {
      out.append("## Recent Sessions (").append(latest - 1).append('-').append(latest).append(") - ")
          .append(recent.size()).append(" results\n\n");
      appendBand(out, recent);
    }
    if (!earlier.isEmpty()) {
      if (!recent.isEmpty()) {
        out.append('\n');
      }
      int first = earlier.stream().mapToInt(SearchResult::year).min().orElse(latest - 2);
      int last = earlier.stream().mapToInt(SearchResult::year).max().orElse(latest - 2);
      out.append("## Earlier Sessions (").append(first).append('-').append(last).append(") - ")
          .append(earlier.size()).append(" results\n\n");
      appendBand(out, earlier);
    }
    return out.toString();
  }

  private static void appendBand(StringBuilder out, List<SearchResult> band) {
    int index = 1;
    for (SearchResult result : band) {
      out.append(index++).append(". **").append(result.title()).append("** (").append(result.year()).append(")\n");
      out.append("   Score: ").append(MarkdownResultRenderer.formatScore(result.relevanceScore())).append('\n');
      if (!result.timeSegments().isEmpty()) {
        out.append("   Segments: ")
            .append(result.timeSegments().stream()
                .map(TimeSegment::approximateTime)
                .collect(Collectors.joining(", ")))
            .append('\n');
      }
      out.append("   ").append(result.excerpt()).append("\n\n");
    }
  }
}
