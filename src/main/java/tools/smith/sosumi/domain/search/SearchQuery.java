package tools.smith.sosumi.domain.search;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Normalized query plus its synonym expansion.
 *
 * @param raw query as supplied by the caller
 * @param normalized trimmed, lower-cased query used for scoring and excerpts
 * @param synonyms expansion terms for the whole normalized query; never {@code null}
 * @since 1.2.0
 */
public record SearchQuery(String raw, String normalized, List<String> synonyms) {

  public SearchQuery {
    Objects.requireNonNull(raw, "raw");
    Objects.requireNonNull(normalized, "normalized");
    synonyms = synonyms == null ? List.of() : List.copyOf(synonyms);
  }

  /**
   * Lower-cases and trims a query without stemming.
   *
   * @param query raw query; must not be {@code null}
   * @return normalized form
   */
  public static String normalize(String query) {
    return Objects.requireNonNull(query, "query").trim().toLowerCase(Locale.ROOT);
  }

  /**
   * Returns the query followed by its synonyms, each lower-cased, without duplicates.
   *
   * @return ordered search terms
   */
  public List<String> terms() {
    Set<String> terms = new LinkedHashSet<>();
    terms.add(normalized);
    for (String synonym : synonyms) {
      terms.add(normalize(synonym));
    }
    terms.remove("");
    return new ArrayList<>(terms);
  }
}
