package tools.smith.sosumi.application.search;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import tools.smith.sosumi.domain.search.TimeSegment;

/**
 * Finds timestamped passages ({@code m:ss} or {@code mm:ss}) near mentions of the query.
 *
 * @since 1.2.0
 */
public final class TimeSegmentExtractor {
  private static final Pattern TIMESTAMP = Pattern.compile("\\b(\\d{1,2}:\\d{2})\\b");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  static final int BEFORE = 50;
  static final int AFTER = 100;
  static final int MAX_SEGMENTS = 4;
  static final int MAX_TEXT = 80;

  private TimeSegmentExtractor() {}

  /**
   * Extracts up to four segments whose surrounding text mentions the query.
   *
   * @param content plaintext transcript
   * @param normalizedQuery trimmed, lowercased query
   * @return segments in transcript order
   */
  public static List<TimeSegment> extract(String content, String normalizedQuery) {
    List<TimeSegment> segments = new ArrayList<>();
    if (content == null || content.isEmpty() || normalizedQuery.isEmpty()) {
      return segments;
    }
    Matcher matcher = TIMESTAMP.matcher(content);
    while (matcher.find() && segments.size() < MAX_SEGMENTS) {
      int start = Math.max(0, matcher.start() - BEFORE);
      int end = Math.min(content.length(), matcher.end() + AFTER);
      String context =
          WHITESPACE.matcher(content.substring(start, end).replace("\n", " ")).replaceAll(" ").trim();
      if (!context.toLowerCase(Locale.ROOT).contains(normalizedQuery)) {
        continue;
      }
      String text = context.length() > MAX_TEXT ? context.substring(0, MAX_TEXT) + "..." : context;
      segments.add(new TimeSegment(matcher.group(1), text));
    }
    return segments;
  }
}
