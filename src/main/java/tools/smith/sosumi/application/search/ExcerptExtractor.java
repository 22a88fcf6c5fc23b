package tools.smith.sosumi.application.search;

import java.util.Locale;

/** Picks the preview sentence shown for a matched session. */
public final class ExcerptExtractor {
  static final int MAX_LENGTH = 150;
  static final String ELLIPSIS = "...";

  private ExcerptExtractor() {}

  /**
   * Returns the first sentence mentioning the query, or the opening of the transcript when none does.
   *
   * @param content plaintext transcript
   * @param normalizedQuery trimmed, lowercased query
   * @return excerpt of at most 150 characters plus an ellipsis
   */
  public static String extract(String content, String normalizedQuery) {
    if (content == null || content.isEmpty()) {
      return "";
    }
    if (!normalizedQuery.isEmpty()) {
      for (String sentence : content.split("\\. ", -1)) {
        if (sentence.toLowerCase(Locale.ROOT).contains(normalizedQuery)) {
          return clip(sentence.trim());
        }
      }
    }
    return clip(content);
  }

  private static String clip(String text) {
    if (text.length() <= MAX_LENGTH) {
      return text;
    }
    return text.substring(0, MAX_LENGTH) + ELLIPSIS;
  }
}
