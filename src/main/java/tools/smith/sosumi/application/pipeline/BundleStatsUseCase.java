package tools.smith.sosumi.application.pipeline;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import tools.smith.sosumi.application.bundle.ArchiveLoader;
import tools.smith.sosumi.application.bundle.BundleException;
import tools.smith.sosumi.application.bundle.LoadedBundle;
import tools.smith.sosumi.domain.bundle.Archive;
import tools.smith.sosumi.domain.bundle.SessionRecord;

/** Computes {@link BundleStatistics} without decrypting any content. */
public final class BundleStatsUseCase {
  private final ArchiveLoader loader;

  public BundleStatsUseCase(ArchiveLoader loader) {
    this.loader = Objects.requireNonNull(loader, "loader");
  }

  /**
   * Loads the bundle and summarizes it.
   *
   * @param bundlePath located bundle
   * @return statistics
   * @throws BundleException when the bundle cannot be loaded
   */
  public BundleStatistics stats(Path bundlePath) throws BundleException {
    LoadedBundle bundle = loader.load(bundlePath);
    Archive archive = bundle.archive();
    Map<Integer, Integer> perYear = new TreeMap<>();
    for (SessionRecord record : archive.records()) {
      perYear.merge(record.year(), 1, Integer::sum);
    }
    return new BundleStatistics(
        archive.records().size(),
        archive.earliestYear(),
        archive.latestYear(),
        perYear,
        archive.searchIndex().size(),
        archive.metadata().createdAt(),
        bundlePath,
        bundle.sizeBytes(),
        archive.metadata().protection());
  }
}
