package tools.smith.sosumi.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tools.smith.sosumi.application.bundle.BundleException;
import tools.smith.sosumi.application.bundle.LoadedBundle;
import tools.smith.sosumi.application.bundle.SearchFailure;
import tools.smith.sosumi.domain.bundle.SessionRecord;
import tools.smith.sosumi.domain.search.SearchResult;
import tools.smith.sosumi.infrastructure.crypto.AesGcmContentCipher;
import tools.smith.sosumi.infrastructure.crypto.SharedKey;
import tools.smith.sosumi.testutil.SampleBundles;

class SessionLookupUseCaseTest {
  @TempDir Path tempDir;

  private Path bundle;

  @BeforeEach
  void setUp() throws Exception {
    bundle = SampleBundles.buildSealed(tempDir, tempDir.resolve("wwdc_bundle.encrypted"));
  }

  @Test
  void returnsDecryptedSessionWithPlainTitle() throws Exception {
    SessionLookupUseCase useCase =
        new SessionLookupUseCase(PipelineFixtures.loader(Optional.of(SampleBundles.cipher())));

    SearchResult session = useCase.lookup(bundle, "wwdc2024-10102").orElseThrow();

    assertEquals("Meet SwiftUI for spatial computing", session.title());
    assertEquals("Explore SwiftUI on visionOS.", session.excerpt());
    assertTrue(session.transcript().contains("Windows, volumes, and spaces"));
    assertEquals("https://developer.apple.com/videos/play/wwdc2024/10102/", session.webUrl());
  }

  @Test
  void previewFallsBackToTranscriptOpening() throws Exception {
    SessionLookupUseCase useCase =
        new SessionLookupUseCase(PipelineFixtures.loader(Optional.of(SampleBundles.cipher())));

    SearchResult session = useCase.lookup(bundle, "wwdc2024-10201").orElseThrow();

    assertTrue(session.excerpt().startsWith("00:40 Designing for presence."));
  }

  @Test
  void unknownIdIsEmpty() throws Exception {
    SessionLookupUseCase useCase =
        new SessionLookupUseCase(PipelineFixtures.loader(Optional.of(SampleBundles.cipher())));

    assertTrue(useCase.lookup(bundle, "wwdc1999-1").isEmpty());
  }

  @Test
  void missingOrWrongKeyIsDecryptionFailure() {
    SessionLookupUseCase noKey = new SessionLookupUseCase(PipelineFixtures.loader(Optional.empty()));
    SessionLookupUseCase wrongKey = new SessionLookupUseCase(PipelineFixtures.loader(
        Optional.of(new AesGcmContentCipher(SharedKey.fromText(SampleBundles.OTHER_KEY_TEXT)))));

    BundleException absent = assertThrows(BundleException.class, () -> noKey.lookup(bundle, "wwdc2024-10102"));
    BundleException wrong = assertThrows(BundleException.class, () -> wrongKey.lookup(bundle, "wwdc2024-10102"));

    assertEquals(SearchFailure.DECRYPTION_FAILED, absent.failure());
    assertEquals(SearchFailure.DECRYPTION_FAILED, wrong.failure());
  }

  @Test
  void checksumMismatchIsIntegrityFailure() {
    SessionRecord tampered = new SessionRecord("a", "T", 2024, "changed text", "00ff", null, null);
    LoadedBundle loaded = SampleBundles.plainBundle(List.of(tampered));

    BundleException ex =
        assertThrows(BundleException.class, () -> SessionLookupUseCase.requireContent(loaded, tampered));

    assertEquals(SearchFailure.INTEGRITY_CHECK_FAILED, ex.failure());
  }
}
