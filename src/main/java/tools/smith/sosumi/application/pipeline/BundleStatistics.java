package tools.smith.sosumi.application.pipeline;

import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.OptionalInt;
import java.util.TreeMap;
import tools.smith.sosumi.domain.bundle.ContentProtection;

/**
 * Summary of a bundle's contents.
 *
 * @param recordCount number of sessions
 * @param firstYear earliest session year, if any
 * @param lastYear latest session year, if any
 * @param sessionsPerYear session count keyed by year, ascending
 * @param indexTerms number of search index terms
 * @param createdAt build timestamp recorded in the metadata, or {@code null}
 * @param path artifact path
 * @param sizeBytes artifact size on disk
 * @param protection content protection mode
 * @since 1.2.0
 */
public record BundleStatistics(
    int recordCount,
    OptionalInt firstYear,
    OptionalInt lastYear,
    Map<Integer, Integer> sessionsPerYear,
    int indexTerms,
    String createdAt,
    Path path,
    long sizeBytes,
    ContentProtection protection) {

  public BundleStatistics {
    sessionsPerYear = Collections.unmodifiableMap(new TreeMap<>(sessionsPerYear));
  }
}
