package tools.smith.sosumi.application.pipeline;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.smith.sosumi.application.bundle.ArchiveLoader;
import tools.smith.sosumi.application.bundle.BundleException;
import tools.smith.sosumi.application.bundle.LoadedBundle;
import tools.smith.sosumi.application.bundle.RecordContent;
import tools.smith.sosumi.application.bundle.SearchFailure;
import tools.smith.sosumi.domain.bundle.SessionRecord;
import tools.smith.sosumi.domain.search.SearchResult;
import tools.smith.sosumi.domain.text.CanonicalLinks;
import tools.smith.sosumi.domain.text.TitleObfuscator;

/**
 * Lists the sessions of one conference year.
 * <p>Titles are always de-obfuscated. Transcripts are opened only when requested; unreadable transcripts are dropped
 * with a warning, and a missing key raises {@link SearchFailure#DECRYPTION_FAILED}.</p>
 *
 * @since 1.2.0
 */
public final class YearListingUseCase {
  private static final Logger log = LoggerFactory.getLogger(YearListingUseCase.class);

  private final ArchiveLoader loader;

  public YearListingUseCase(ArchiveLoader loader) {
    this.loader = Objects.requireNonNull(loader, "loader");
  }

  /**
   * Lists a year.
   *
   * @param bundlePath located bundle
   * @param year conference year
   * @param withTranscripts whether transcripts should be decrypted and attached
   * @return sessions of that year in archive order
   * @throws BundleException when the bundle cannot be loaded or transcripts are required without a key
   */
  public List<SearchResult> list(Path bundlePath, int year, boolean withTranscripts) throws BundleException {
    LoadedBundle bundle = loader.load(bundlePath);
    List<SearchResult> sessions = new ArrayList<>();
    for (SessionRecord record : bundle.archive().records()) {
      if (record.year() != year) {
        continue;
      }
      String transcript = "";
      if (withTranscripts) {
        RecordContent content = bundle.content(record);
        if (content.status() == RecordContent.Status.KEY_UNAVAILABLE) {
          throw new BundleException(
              SearchFailure.DECRYPTION_FAILED, "Transcripts are encrypted and no encryption key is configured");
        }
        if (!content.status().available()) {
          log.warn("Dropping session {} from listing: {}", record.id(), content.status());
          continue;
        }
        transcript = content.text();
      }
      sessions.add(new SearchResult(
          record.id(),
          TitleObfuscator.deobfuscate(record.title()),
          record.year(),
          0.0,
          record.excerptValue().orElse(""),
          List.of(),
          transcript,
          CanonicalLinks.forSession(record.id(), record.webUrl())));
    }
    log.debug("Year {} lists {} sessions", year, sessions.size());
    return sessions;
  }
}
