package tools.smith.sosumi.application.search;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.smith.sosumi.application.bundle.BundleException;
import tools.smith.sosumi.application.bundle.LoadedBundle;
import tools.smith.sosumi.application.bundle.RecordContent;
import tools.smith.sosumi.application.bundle.SearchFailure;
import tools.smith.sosumi.domain.bundle.SessionRecord;
import tools.smith.sosumi.domain.search.SearchQuery;
import tools.smith.sosumi.domain.search.SearchResult;
import tools.smith.sosumi.domain.text.CanonicalLinks;
import tools.smith.sosumi.domain.text.TitleObfuscator;
import tools.smith.sosumi.infrastructure.exec.ExecutorFactories;
import tools.smith.sosumi.logging.Logs;

/**
 * <strong>What:</strong> Full-text search over a loaded bundle.
 * <p><strong>Phases:</strong></p>
 * <ol>
 *   <li>Normalize the query and expand it through the {@link SynonymTable}.</li>
 *   <li>Index phase: union of the stored postings for every term.</li>
 *   <li>Scan phase: records whose title or excerpt contains a term, then records whose decrypted content does.</li>
 *   <li>Final phase: every match is decrypted and verified, then scored and excerpted.</li>
 * </ol>
 * <p><strong>Failure policy:</strong> a sealed match with no configured key raises
 * {@link SearchFailure#DECRYPTION_FAILED}; a match that fails authentication or its checksum is dropped with a WARN
 * line.</p>
 * <p><strong>Thread-safety:</strong> Instances are immutable. The scan phase fans out over {@code scanThreads}
 * daemon workers when more than one is configured; results do not depend on the pool size.</p>
 *
 * @since 1.2.0
 */
public final class SearchEngine {
  private static final Logger log = LoggerFactory.getLogger(SearchEngine.class);
  private static final int MIN_RECORDS_PER_TASK = 64;

  private final SynonymTable synonyms;
  private final int scanThreads;

  /**
   * Creates an engine.
   *
   * @param synonyms synonym table used for query expansion
   * @param scanThreads worker count for the scan phase; {@code 1} scans on the caller thread
   */
  public SearchEngine(SynonymTable synonyms, int scanThreads) {
    this.synonyms = Objects.requireNonNull(synonyms, "synonyms");
    if (scanThreads <= 0) {
      throw new IllegalArgumentException("scanThreads must be positive");
    }
    this.scanThreads = scanThreads;
  }

  /**
   * Normalizes and expands a raw query.
   *
   * @param rawQuery user query
   * @return prepared query
   */
  public SearchQuery prepare(String rawQuery) {
    String normalized = SearchQuery.normalize(rawQuery);
    return new SearchQuery(rawQuery, normalized, synonyms.expand(normalized));
  }

  /**
   * Runs a query against a bundle.
   *
   * @param bundle loaded bundle
   * @param rawQuery user query
   * @return matched results in archive order; callers sort for display
   * @throws BundleException when a sealed match cannot be opened because no key is configured
   * @throws InterruptedException if interrupted while waiting for scan workers
   */
  public List<SearchResult> search(LoadedBundle bundle, String rawQuery)
      throws BundleException, InterruptedException {
    Objects.requireNonNull(bundle, "bundle");
    SearchQuery query = prepare(rawQuery);
    List<String> terms = query.terms();
    if (terms.isEmpty()) {
      return List.of();
    }
    log.debug("Searching for '{}' with terms {}", Logs.truncate(query.normalized(), 64), terms);

    Set<String> matched = new HashSet<>();
    for (String term : terms) {
      Set<String> postings = bundle.archive().searchIndex().get(term);
      if (postings != null) {
        matched.addAll(postings);
      }
    }
    int indexed = matched.size();
    matched.addAll(scan(bundle, terms, matched));
    log.debug("Index phase matched {} records, scan phase {} more", indexed, matched.size() - indexed);

    OptionalInt latestYear = bundle.archive().latestYear();
    List<SearchResult> results = new ArrayList<>();
    for (SessionRecord record : bundle.archive().records()) {
      if (!matched.contains(record.id())) {
        continue;
      }
      RecordContent content = bundle.content(record);
      switch (content.status()) {
        case KEY_UNAVAILABLE -> throw new BundleException(
            SearchFailure.DECRYPTION_FAILED,
            "Session content is encrypted and no encryption key is configured");
        case AUTHENTICATION_FAILED, CHECKSUM_MISMATCH -> {
          log.warn("Dropping session {} from results: {}", record.id(), content.status());
          continue;
        }
        default -> results.add(toResult(record, content.text(), query.normalized(), latestYear));
      }
    }
    return results;
  }

  /**
   * Builds the result for one verified record.
   *
   * @param record matched record
   * @param plaintext verified transcript
   * @param normalizedQuery normalized query text
   * @param latestYear latest year in the archive
   * @return search result
   */
  public static SearchResult toResult(
      SessionRecord record, String plaintext, String normalizedQuery, OptionalInt latestYear) {
    String title = TitleObfuscator.deobfuscate(record.title());
    return new SearchResult(
        record.id(),
        title,
        record.year(),
        RelevanceScorer.score(title, plaintext, normalizedQuery, latestYear),
        ExcerptExtractor.extract(plaintext, normalizedQuery),
        TimeSegmentExtractor.extract(plaintext, normalizedQuery),
        plaintext,
        CanonicalLinks.forSession(record.id(), record.webUrl()));
  }

  private Set<String> scan(LoadedBundle bundle, List<String> terms, Set<String> alreadyMatched)
      throws InterruptedException {
    List<SessionRecord> pending = new ArrayList<>();
    for (SessionRecord record : bundle.archive().records()) {
      if (!alreadyMatched.contains(record.id())) {
        pending.add(record);
      }
    }
    if (scanThreads == 1 || pending.size() < MIN_RECORDS_PER_TASK * 2) {
      return scanRange(bundle, terms, pending);
    }
    int chunk = Math.max(MIN_RECORDS_PER_TASK, (pending.size() + scanThreads - 1) / scanThreads);
    List<Callable<Set<String>>> tasks = new ArrayList<>();
    for (int from = 0; from < pending.size(); from += chunk) {
      List<SessionRecord> slice = pending.subList(from, Math.min(pending.size(), from + chunk));
      tasks.add(() -> scanRange(bundle, terms, slice));
    }
    ExecutorService pool = ExecutorFactories.newScanPool(Math.min(scanThreads, tasks.size()), "sosumi-scan", null);
    try {
      Set<String> found = new HashSet<>();
      for (Future<Set<String>> future : pool.invokeAll(tasks)) {
        try {
          found.addAll(future.get());
        } catch (ExecutionException ex) {
          Throwable cause = ex.getCause();
          if (cause instanceof RuntimeException runtime) {
            throw runtime;
          }
          throw new IllegalStateException("Scan worker failed", cause);
        }
      }
      return found;
    } finally {
      pool.shutdownNow();
      if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("Scan workers did not terminate within 5 seconds");
      }
    }
  }

  private static Set<String> scanRange(LoadedBundle bundle, List<String> terms, List<SessionRecord> records) {
    Set<String> found = new LinkedHashSet<>();
    boolean contentAccessible = bundle.contentAccessible();
    for (SessionRecord record : records) {
      String title = TitleObfuscator.deobfuscate(record.title()).toLowerCase(Locale.ROOT);
      String excerpt = record.excerptValue().map(value -> value.toLowerCase(Locale.ROOT)).orElse("");
      if (containsAny(title, terms) || containsAny(excerpt, terms)) {
        found.add(record.id());
        continue;
      }
      if (contentAccessible) {
        String content = bundle.decrypt(record).map(value -> value.toLowerCase(Locale.ROOT)).orElse("");
        if (containsAny(content, terms)) {
          found.add(record.id());
        }
      }
    }
    return found;
  }

  private static boolean containsAny(String haystack, List<String> terms) {
    if (haystack.isEmpty()) {
      return false;
    }
    for (String term : terms) {
      if (haystack.contains(term)) {
        return true;
      }
    }
    return false;
  }
}
