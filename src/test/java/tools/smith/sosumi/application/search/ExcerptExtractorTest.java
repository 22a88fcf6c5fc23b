package tools.smith.sosumi.application.search;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class ExcerptExtractorTest {

  @Test
  void picksFirstSentenceMentioningQuery() {
    String content = "Welcome to the session. SharePlay lets people watch together. More SharePlay later.";

    assertEquals("SharePlay lets people watch together", ExcerptExtractor.extract(content, "shareplay"));
  }

  @Test
  void longSentenceIsClippedWithEllipsis() {
    String sentence = "shareplay " + "x".repeat(200);

    String excerpt = ExcerptExtractor.extract(sentence, "shareplay");

    assertEquals(153, excerpt.length());
    assertEquals("...", excerpt.substring(150));
  }

  @Test
  void fallsBackToClippedOpening() {
    String content = "y".repeat(300);

    assertEquals("y".repeat(150) + "...", ExcerptExtractor.extract(content, "shareplay"));
    assertEquals("z".repeat(150), ExcerptExtractor.extract("z".repeat(150), "shareplay"));
    assertEquals("short", ExcerptExtractor.extract("short", "shareplay"));
    assertEquals("", ExcerptExtractor.extract("", "shareplay"));
  }
}
