package tools.smith.sosumi.application.pipeline;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
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
 * Retrieves one session by id with its verified transcript.
 * <p>Explicit retrieval fails loudly: a missing key or failed authentication raises
 * {@link SearchFailure#DECRYPTION_FAILED} and a checksum mismatch raises {@link SearchFailure#INTEGRITY_CHECK_FAILED}.</p>
 *
 * @since 1.2.0
 */
public final class SessionLookupUseCase {
  static final int PREVIEW_LENGTH = 150;

  private final ArchiveLoader loader;

  public SessionLookupUseCase(ArchiveLoader loader) {
    this.loader = Objects.requireNonNull(loader, "loader");
  }

  /**
   * Looks up a session.
   *
   * @param bundlePath located bundle
   * @param id session id
   * @return session detail, or empty when no record has that id
   * @throws BundleException when the bundle cannot be loaded or the content cannot be verified
   */
  public Optional<SearchResult> lookup(Path bundlePath, String id) throws BundleException {
    LoadedBundle bundle = loader.load(bundlePath);
    Optional<SessionRecord> found = bundle.archive().find(id);
    if (found.isEmpty()) {
      return Optional.empty();
    }
    SessionRecord record = found.get();
    String plaintext = requireContent(bundle, record);
    String preview = record.excerptValue()
        .orElseGet(() -> plaintext.length() > PREVIEW_LENGTH ? plaintext.substring(0, PREVIEW_LENGTH) : plaintext);
    return Optional.of(new SearchResult(
        record.id(),
        TitleObfuscator.deobfuscate(record.title()),
        record.year(),
        0.0,
        preview,
        List.of(),
        plaintext,
        CanonicalLinks.forSession(record.id(), record.webUrl())));
  }

  static String requireContent(LoadedBundle bundle, SessionRecord record) throws BundleException {
    RecordContent content = bundle.content(record);
    return switch (content.status()) {
      case PLAIN, DECRYPTED -> content.text();
      case KEY_UNAVAILABLE -> throw new BundleException(
          SearchFailure.DECRYPTION_FAILED,
          "Session " + record.id() + " is encrypted and no encryption key is configured");
      case AUTHENTICATION_FAILED -> throw new BundleException(
          SearchFailure.DECRYPTION_FAILED, "Session " + record.id() + " failed authentication");
      case CHECKSUM_MISMATCH -> throw new BundleException(
          SearchFailure.INTEGRITY_CHECK_FAILED, "Session " + record.id() + " failed its integrity check");
    };
  }
}
