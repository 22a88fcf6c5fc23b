/**
 * Query preparation, synonym expansion, scoring, excerpt and time-segment extraction.
 * <p><strong>Concurrency:</strong> Scorers and extractors are stateless; {@link tools.smith.sosumi.application.search.SearchEngine}
 * may fan the scan out over a worker pool and still returns results in archive order.</p>
 */
package tools.smith.sosumi.application.search;
