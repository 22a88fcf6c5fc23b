package tools.smith.sosumi.infrastructure.render;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class TranscriptParagraphsTest {

  @Test
  void blankLinesSeparateParagraphs() {
    assertEquals(List.of("First part.", "Second part."), TranscriptParagraphs.split("First part.\n\nSecond part."));
  }

  @Test
  void singleBlockIsGroupedByFourSentences() {
    List<String> paragraphs = TranscriptParagraphs.split("One. Two. Three. Four. Five.");

    assertEquals(2, paragraphs.size());
    assertTrue(paragraphs.get(1).startsWith("Five"));
  }

  @Test
  void blankTranscriptHasNoParagraphs() {
    assertTrue(TranscriptParagraphs.split("  ").isEmpty());
    assertTrue(TranscriptParagraphs.split(null).isEmpty());
  }
}
