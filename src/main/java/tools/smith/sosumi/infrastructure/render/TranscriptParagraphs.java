package tools.smith.sosumi.infrastructure.render;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits a transcript into readable paragraphs. Blank lines separate paragraphs; a transcript without blank lines is
 * grouped into runs of {@value #SENTENCES_PER_PARAGRAPH} sentences.
 */
final class TranscriptParagraphs {
  static final int SENTENCES_PER_PARAGRAPH = 4;
  private static final Pattern BLANK_LINE = Pattern.compile("\\n\\s*\\n");
  private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private TranscriptParagraphs() {}

  static List<String> split(String transcript) {
    List<String> paragraphs = new ArrayList<>();
    if (transcript == null || transcript.isBlank()) {
      return paragraphs;
    }
    String[] blocks = BLANK_LINE.split(transcript.strip());
    if (blocks.length > 1) {
      for (String block : blocks) {
        String text = WHITESPACE.matcher(block).replaceAll(" ").trim();
        if (!text.isEmpty()) {
          paragraphs.add(text);
        }
      }
      return paragraphs;
    }
    String[] sentences = SENTENCE_END.split(WHITESPACE.matcher(blocks[0]).replaceAll(" ").trim());
    StringBuilder current = new StringBuilder();
    int count = 0;
    for (String sentence : sentences) {
      if (current.length() > 0) {
        current.append(' ');
      }
      current.append(sentence);
      if (++count == SENTENCES_PER_PARAGRAPH) {
        paragraphs.add(current.toString());
        current.setLength(0);
        count = 0;
      }
    }
    if (current.length() > 0) {
      paragraphs.add(current.toString());
    }
    return paragraphs;
  }
}
