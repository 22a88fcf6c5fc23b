package tools.smith.sosumi.infrastructure.render;

import java.util.List;
import java.util.Locale;
import tools.smith.sosumi.domain.search.SearchResult;
import tools.smith.sosumi.domain.search.TimeSegment;

/**
 * Markdown rendering for terminals and agent transcripts.
 *
 * @since 1.2.0
 */
public final class MarkdownResultRenderer implements ResultRenderer {
  static final int USER_SNIPPET_LENGTH = 200;

  @Override
  public String renderResults(String query, List<SearchResult> results, RenderStyle style, int limit) {
    StringBuilder out = new StringBuilder();
    if (results.isEmpty()) {
      out.append("No results found for \"").append(query).append("\"\n\n");
      out.append("Try different keywords or browse sessions by year.\n");
      return out.toString();
    }
    List<SearchResult> shown = ResultRenderer.ranked(results, limit);
    out.append("# WWDC results for \"").append(query).append("\"\n\n");
    appendEntries(out, shown, style);
    out.append("---\n\n");
    out.append("**Search query:** \"").append(query).append("\" | ");
    out.append("**Showing:** ").append(shown.size()).append(" of ").append(results.size()).append(" | ");
    out.append("**Source:** WWDC Sessions Archive\n");
    return out.toString();
  }

  @Override
  public String renderListing(String heading, List<SearchResult> results, RenderStyle style, int limit) {
    StringBuilder out = new StringBuilder();
    out.append("# ").append(heading).append("\n\n");
    if (results.isEmpty()) {
      out.append("No sessions found.\n");
      return out.toString();
    }
    List<SearchResult> shown = ResultRenderer.ranked(results, limit);
    appendEntries(out, shown, style);
    out.append("---\n\n**Sessions:** ").append(shown.size()).append(" of ").append(results.size()).append('\n');
    return out.toString();
  }

  @Override
  public String renderSession(SearchResult session, RenderStyle style) {
    StringBuilder out = new StringBuilder();
    out.append("# ").append(session.title()).append(" (").append(session.year()).append(")\n\n");
    out.append("**Session:** ").append(session.id()).append('\n');
    if (style == RenderStyle.AGENT) {
      out.append("\n## Transcript\n\n");
      for (String paragraph : TranscriptParagraphs.split(session.transcript())) {
        out.append(paragraph).append("\n\n");
      }
      out.append("**Source:** [Apple Developer](").append(session.webUrl()).append(")\n");
    } else {
      String snippet = snippet(session);
      if (!snippet.isEmpty()) {
        out.append('\n').append(snippet).append("\n\n");
      }
      out.append("**Full video:** [Watch on Apple Developer](").append(session.webUrl()).append(")\n");
    }
    return out.toString();
  }

  private static void appendEntries(StringBuilder out, List<SearchResult> shown, RenderStyle style) {
    int index = 1;
    for (SearchResult result : shown) {
      switch (style) {
        case COMPACT -> appendCompact(out, result, index);
        case USER -> appendUser(out, result, index);
        case AGENT -> appendAgent(out, result, index);
        default -> throw new IllegalStateException("Unhandled style " + style);
      }
      index++;
    }
    if (style == RenderStyle.COMPACT) {
      out.append('\n');
    }
  }

  private static void appendCompact(StringBuilder out, SearchResult result, int index) {
    out.append(index).append(". **").append(result.title()).append("** (").append(result.year()).append(") | ")
        .append(result.id()).append(" | ").append(result.webUrl()).append('\n');
  }

  private static void appendUser(StringBuilder out, SearchResult result, int index) {
    out.append(index).append(". **").append(result.title()).append("** (").append(result.year()).append(")\n");
    String snippet = snippet(result);
    if (!snippet.isEmpty()) {
      out.append("   ").append(snippet).append('\n');
    }
    out.append("   **Full video:** [Watch on Apple Developer](").append(result.webUrl()).append(")\n\n");
  }

  private static void appendAgent(StringBuilder out, SearchResult result, int index) {
    out.append("## ").append(index).append(". ").append(result.title()).append(" (").append(result.year())
        .append(")\n\n");
    out.append("- **Session:** ").append(result.id()).append('\n');
    out.append("- **Relevance Score:** ").append(formatScore(result.relevanceScore())).append('\n');
    out.append("- **Link:** ").append(result.webUrl()).append("\n\n");
    if (!result.excerpt().isEmpty()) {
      out.append("**Matching content:**\n\n> ").append(result.excerpt()).append("\n\n");
    }
    if (!result.timeSegments().isEmpty()) {
      out.append("**Time segments:**\n\n");
      for (TimeSegment segment : result.timeSegments()) {
        out.append("- `").append(segment.approximateTime()).append("` ").append(segment.text()).append('\n');
      }
      out.append('\n');
    }
    List<String> paragraphs = TranscriptParagraphs.split(result.transcript());
    if (!paragraphs.isEmpty()) {
      out.append("**Transcript:**\n\n");
      for (String paragraph : paragraphs) {
        out.append(paragraph).append("\n\n");
      }
    }
    out.append("**Source:** [Apple Developer](").append(result.webUrl()).append(")\n\n");
  }

  static String snippet(SearchResult result) {
    String excerpt = result.excerpt();
    if (excerpt == null || excerpt.isBlank()) {
      return "";
    }
    if (excerpt.length() <= USER_SNIPPET_LENGTH) {
      return excerpt;
    }
    return excerpt.substring(0, USER_SNIPPET_LENGTH) + "...";
  }

  static String formatScore(double score) {
    return String.format(Locale.ROOT, "%.1f", score);
  }
}
