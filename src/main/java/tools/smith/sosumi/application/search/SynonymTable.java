package tools.smith.sosumi.application.search;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Query expansion table. Lookup is an exact match on the whole normalized query and is not transitive.
 *
 * @since 1.2.0
 */
public final class SynonymTable {
  private static final SynonymTable EMPTY = new SynonymTable(Map.of());

  private final Map<String, List<String>> entries;

  private SynonymTable(Map<String, List<String>> entries) {
    this.entries = entries;
  }

  /**
   * Builds a table, lowercasing keys.
   *
   * @param entries term to synonyms
   * @return immutable table
   */
  public static SynonymTable of(Map<String, List<String>> entries) {
    Objects.requireNonNull(entries, "entries");
    Map<String, List<String>> copy = new LinkedHashMap<>();
    entries.forEach(
        (term, synonyms) -> {
          if (term != null && synonyms != null) {
            copy.put(term.trim().toLowerCase(Locale.ROOT), List.copyOf(synonyms));
          }
        });
    return new SynonymTable(Map.copyOf(copy));
  }

  public static SynonymTable empty() {
    return EMPTY;
  }

  /**
   * Returns the synonyms for a normalized query.
   *
   * @param normalizedQuery trimmed, lowercased query
   * @return synonyms, or an empty list when the query has no entry
   */
  public List<String> expand(String normalizedQuery) {
    if (normalizedQuery == null) {
      return List.of();
    }
    return entries.getOrDefault(normalizedQuery, List.of());
  }

  public int size() {
    return entries.size();
  }
}
