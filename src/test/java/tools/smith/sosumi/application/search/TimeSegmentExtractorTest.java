package tools.smith.sosumi.application.search;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import tools.smith.sosumi.domain.search.TimeSegment;

class TimeSegmentExtractorTest {

  @Test
  void keepsTimestampsWhoseContextMentionsQuery() {
    String content = "00:12 Welcome everyone. " + "filler ".repeat(30)
        + "05:40 Now SharePlay joins the call.";

    List<TimeSegment> segments = TimeSegmentExtractor.extract(content, "shareplay");

    assertEquals(1, segments.size());
    assertEquals("05:40", segments.get(0).approximateTime());
    assertTrue(segments.get(0).text().toLowerCase().contains("shareplay"));
  }

  @Test
  void capsSegmentCountAndTextLength() {
    StringBuilder content = new StringBuilder();
    for (int i = 0; i < 8; i++) {
      content.append(String.format("%02d:00 shareplay ", i)).append("z".repeat(200)).append(' ');
    }

    List<TimeSegment> segments = TimeSegmentExtractor.extract(content.toString(), "shareplay");

    assertEquals(4, segments.size());
    for (TimeSegment segment : segments) {
      assertTrue(segment.text().length() <= TimeSegmentExtractor.MAX_TEXT + 3);
    }
  }

  @Test
  void noTimestampsMeansNoSegments() {
    assertTrue(TimeSegmentExtractor.extract("shareplay everywhere", "shareplay").isEmpty());
  }
}
