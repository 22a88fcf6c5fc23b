package tools.smith.sosumi.application.pipeline;

import java.util.List;
import tools.smith.sosumi.domain.search.SearchResult;

/**
 * Results of one query.
 *
 * @param results matched results, unordered
 * @param placeholder {@code true} when the results are generic placeholder links
 * @since 1.2.0
 */
public record SearchOutcome(List<SearchResult> results, boolean placeholder) {
  public SearchOutcome {
    results = List.copyOf(results);
  }
}
