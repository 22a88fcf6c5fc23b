package tools.smith.sosumi.application.search;

import java.util.Locale;
import java.util.OptionalInt;

/**
 * <strong>What:</strong> Additive relevance score for a matched session.
 * <p><strong>Weights:</strong> title hit +20, each non-overlapping content occurrence +2.5, recency +10/+5/+2 when the
 * title mentions the latest indexed year or one of the two before it, +8 for introductory titles, +12 for advanced
 * titles. Scores never drop below 1.0.</p>
 *
 * @since 1.2.0
 */
public final class RelevanceScorer {
  static final double TITLE_MATCH = 20.0;
  static final double CONTENT_OCCURRENCE = 2.5;
  static final double INTRODUCTORY = 8.0;
  static final double ADVANCED = 12.0;
  static final double FLOOR = 1.0;
  private static final double[] RECENCY = {10.0, 5.0, 2.0};

  private RelevanceScorer() {}

  /**
   * Scores one session.
   *
   * @param title plain (de-obfuscated) title
   * @param content plaintext transcript
   * @param normalizedQuery trimmed, lowercased query
   * @param latestYear latest session year in the archive, if any
   * @return score of at least {@code 1.0}
   */
  public static double score(String title, String content, String normalizedQuery, OptionalInt latestYear) {
    String lowerTitle = title == null ? "" : title.toLowerCase(Locale.ROOT);
    String lowerContent = content == null ? "" : content.toLowerCase(Locale.ROOT);
    double score = 0.0;
    if (!normalizedQuery.isEmpty() && lowerTitle.contains(normalizedQuery)) {
      score += TITLE_MATCH;
    }
    score += CONTENT_OCCURRENCE * countOccurrences(lowerContent, normalizedQuery);
    if (latestYear.isPresent()) {
      int latest = latestYear.getAsInt();
      for (int offset = 0; offset < RECENCY.length; offset++) {
        if (lowerTitle.contains(Integer.toString(latest - offset))) {
          score += RECENCY[offset];
          break;
        }
      }
    }
    if (lowerTitle.contains("introduction") || lowerTitle.contains("fundamentals")) {
      score += INTRODUCTORY;
    }
    if (lowerTitle.contains("advanced") || lowerTitle.contains("deep dive")) {
      score += ADVANCED;
    }
    return Math.max(FLOOR, score);
  }

  static int countOccurrences(String haystack, String needle) {
    if (needle == null || needle.isEmpty()) {
      return 0;
    }
    int count = 0;
    int from = 0;
    while (true) {
      int at = haystack.indexOf(needle, from);
      if (at < 0) {
        return count;
      }
      count++;
      from = at + needle.length();
    }
  }
}
