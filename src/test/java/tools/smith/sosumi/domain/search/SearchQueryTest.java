package tools.smith.sosumi.domain.search;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;

class SearchQueryTest {

  @Test
  void normalizeTrimsAndLowercases() {
    assertEquals("shareplay", SearchQuery.normalize("  SharePlay "));
  }

  @Test
  void termsKeepQueryFirstAndDropDuplicates() {
    SearchQuery query = new SearchQuery("SharePlay", "shareplay", List.of("Group Activities", "shareplay", " "));

    assertEquals(List.of("shareplay", "group activities"), query.terms());
  }
}
