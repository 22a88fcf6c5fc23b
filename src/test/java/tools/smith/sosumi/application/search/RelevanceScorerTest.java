package tools.smith.sosumi.application.search;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

class RelevanceScorerTest {
  private static final OptionalInt LATEST = OptionalInt.of(2025);

  @Test
  void titleMatchAndContentOccurrencesAccumulate() {
    double score = RelevanceScorer.score(
        "Add SharePlay to your app", "SharePlay here, shareplay there", "shareplay", LATEST);

    assertEquals(20.0 + 2 * 2.5, score, 1e-9);
  }

  @Test
  void recencyBonusUsesYearInTitle() {
    assertEquals(10.0, RelevanceScorer.score("What's new in 2025", "", "zzz", LATEST), 1e-9);
    assertEquals(5.0, RelevanceScorer.score("What's new in 2024", "", "zzz", LATEST), 1e-9);
    assertEquals(2.0, RelevanceScorer.score("What's new in 2023", "", "zzz", LATEST), 1e-9);
    assertEquals(1.0, RelevanceScorer.score("What's new in 2023", "", "zzz", OptionalInt.empty()), 1e-9);
  }

  @Test
  void levelKeywordsAddBonuses() {
    assertEquals(8.0, RelevanceScorer.score("Introduction to Metal", "", "zzz", LATEST), 1e-9);
    assertEquals(12.0, RelevanceScorer.score("Metal deep dive", "", "zzz", LATEST), 1e-9);
    assertEquals(20.0, RelevanceScorer.score("Advanced fundamentals", "", "zzz", LATEST), 1e-9);
  }

  @Test
  void scoreNeverDropsBelowFloor() {
    assertEquals(1.0, RelevanceScorer.score("Unrelated", "nothing here", "shareplay", LATEST), 1e-9);
  }

  @Test
  void occurrencesDoNotOverlap() {
    assertEquals(2, RelevanceScorer.countOccurrences("aaaa", "aa"));
    assertEquals(0, RelevanceScorer.countOccurrences("abc", ""));
  }
}
