package tools.smith.sosumi.application.search;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import tools.smith.sosumi.domain.bundle.PlainSession;

/**
 * Builds and sanitizes the term to record-id index stored in an archive.
 *
 * @since 1.2.0
 */
public final class SearchIndexBuilder {
  private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}]{3,}");

  private SearchIndexBuilder() {}

  /**
   * Generates an index from title and excerpt tokens.
   *
   * @param sessions plaintext sessions
   * @return term to ids, terms sorted
   */
  public static Map<String, Set<String>> fromTokens(Collection<PlainSession> sessions) {
    Map<String, Set<String>> index = new TreeMap<>();
    for (PlainSession session : sessions) {
      addTokens(index, session.title(), session.id());
      if (session.excerpt() != null) {
        addTokens(index, session.excerpt(), session.id());
      }
    }
    return index;
  }

  /**
   * Lowercases terms, merges postings that collide, and drops ids that are not in {@code knownIds}.
   *
   * @param supplied caller-supplied index
   * @param knownIds ids of the records that made it into the archive
   * @return sanitized index; terms whose postings become empty are removed
   */
  public static Map<String, Set<String>> prune(Map<String, ? extends Collection<String>> supplied, Set<String> knownIds) {
    Map<String, Set<String>> index = new LinkedHashMap<>();
    supplied.forEach(
        (term, ids) -> {
          if (term == null || ids == null) {
            return;
          }
          for (String id : ids) {
            if (knownIds.contains(id)) {
              index.computeIfAbsent(term.trim().toLowerCase(Locale.ROOT), k -> new LinkedHashSet<>()).add(id);
            }
          }
        });
    index.keySet().remove("");
    return index;
  }

  private static void addTokens(Map<String, Set<String>> index, String text, String id) {
    Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
    while (matcher.find()) {
      index.computeIfAbsent(matcher.group(), k -> new LinkedHashSet<>()).add(id);
    }
  }
}
