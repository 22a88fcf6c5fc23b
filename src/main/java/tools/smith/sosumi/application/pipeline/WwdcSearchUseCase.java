package tools.smith.sosumi.application.pipeline;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.smith.sosumi.application.bundle.ArchiveLoader;
import tools.smith.sosumi.application.bundle.BundleException;
import tools.smith.sosumi.application.bundle.LoadedBundle;
import tools.smith.sosumi.application.bundle.SearchFailure;
import tools.smith.sosumi.application.search.PlaceholderResults;
import tools.smith.sosumi.application.search.SearchEngine;
import tools.smith.sosumi.domain.search.SearchResult;
import tools.smith.sosumi.logging.Logs;

/**
 * <strong>What:</strong> Loads the bundle and runs one query against it.
 * <p><strong>Failure policy:</strong> by default every load or decryption failure propagates and an empty result set
 * raises {@link SearchFailure#REAL_DATA_FAILED}. Only when the caller allows placeholders are those cases answered
 * with {@link PlaceholderResults} instead.</p>
 *
 * @since 1.2.0
 */
public final class WwdcSearchUseCase {
  private static final Logger log = LoggerFactory.getLogger(WwdcSearchUseCase.class);

  private final ArchiveLoader loader;
  private final SearchEngine engine;

  /**
   * Creates the use case.
   *
   * @param loader bundle loader
   * @param engine search engine
   */
  public WwdcSearchUseCase(ArchiveLoader loader, SearchEngine engine) {
    this.loader = Objects.requireNonNull(loader, "loader");
    this.engine = Objects.requireNonNull(engine, "engine");
  }

  /**
   * Searches the bundle at {@code bundlePath}.
   *
   * @param bundlePath located bundle
   * @param query validated query text
   * @param allowPlaceholder whether placeholder links may stand in for real results
   * @return search outcome
   * @throws BundleException when real data is mandatory and cannot be produced
   * @throws InterruptedException if interrupted during the scan phase
   */
  public SearchOutcome search(Path bundlePath, String query, boolean allowPlaceholder)
      throws BundleException, InterruptedException {
    Objects.requireNonNull(bundlePath, "bundlePath");
    Objects.requireNonNull(query, "query");
    List<SearchResult> results;
    try {
      LoadedBundle bundle = loader.load(bundlePath);
      results = engine.search(bundle, query);
    } catch (BundleException ex) {
      if (!allowPlaceholder) {
        throw ex;
      }
      log.warn("Real data unavailable ({}); returning placeholder results", ex.failure().label());
      return new SearchOutcome(PlaceholderResults.forQuery(query), true);
    }
    if (results.isEmpty()) {
      if (allowPlaceholder) {
        log.warn("No sessions matched '{}'; returning placeholder results", Logs.truncate(query, 64));
        return new SearchOutcome(PlaceholderResults.forQuery(query), true);
      }
      throw new BundleException(
          SearchFailure.REAL_DATA_FAILED, "No WWDC sessions matched \"" + query.trim() + "\"");
    }
    log.debug("Query '{}' matched {} sessions", Logs.truncate(query, 64), results.size());
    return new SearchOutcome(results, false);
  }
}
