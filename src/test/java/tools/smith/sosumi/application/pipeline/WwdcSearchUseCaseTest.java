package tools.smith.sosumi.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tools.smith.sosumi.application.bundle.BundleException;
import tools.smith.sosumi.application.bundle.SearchFailure;
import tools.smith.sosumi.application.search.PlaceholderResults;
import tools.smith.sosumi.application.search.SearchEngine;
import tools.smith.sosumi.application.search.SynonymTable;
import tools.smith.sosumi.domain.search.SearchResult;
import tools.smith.sosumi.testutil.SampleBundles;

class WwdcSearchUseCaseTest {
  @TempDir Path tempDir;

  private Path bundle;
  private final SearchEngine engine =
      new SearchEngine(SynonymTable.of(Map.of("shareplay", List.of("group activities"))), 1);

  @BeforeEach
  void setUp() throws Exception {
    bundle = SampleBundles.buildSealed(tempDir, tempDir.resolve("wwdc_bundle.encrypted"));
  }

  @Test
  void sharePlayQueryFindsTitleAndSynonymMatches() throws Exception {
    WwdcSearchUseCase useCase =
        new WwdcSearchUseCase(PipelineFixtures.loader(Optional.of(SampleBundles.cipher())), engine);

    SearchOutcome outcome = useCase.search(bundle, "SharePlay", false);

    assertFalse(outcome.placeholder());
    List<SearchResult> results = outcome.results();
    assertEquals(List.of("wwdc2023-10239", "wwdc2024-10201"),
        results.stream().map(SearchResult::id).toList());
    assertTrue(results.get(0).relevanceScore() >= 20.0);
    assertTrue(results.get(0).transcript().contains("collaborative whiteboard"));
  }

  @Test
  void noMatchesIsRealDataFailureUnlessPlaceholdersAllowed() throws Exception {
    WwdcSearchUseCase useCase =
        new WwdcSearchUseCase(PipelineFixtures.loader(Optional.of(SampleBundles.cipher())), engine);

    BundleException ex =
        assertThrows(BundleException.class, () -> useCase.search(bundle, "kubernetes", false));
    SearchOutcome fallback = useCase.search(bundle, "kubernetes", true);

    assertEquals(SearchFailure.REAL_DATA_FAILED, ex.failure());
    assertTrue(fallback.placeholder());
    assertTrue(fallback.results().stream().allMatch(PlaceholderResults::isPlaceholder));
  }

  @Test
  void realDataFailureQuotesWholeQuery() {
    WwdcSearchUseCase useCase =
        new WwdcSearchUseCase(PipelineFixtures.loader(Optional.of(SampleBundles.cipher())), engine);
    String query = "kubernetes operators for distributed orchestration across many clusters in production";

    BundleException ex = assertThrows(BundleException.class, () -> useCase.search(bundle, query, false));

    assertEquals("No WWDC sessions matched \"" + query + "\"", ex.getMessage());
    assertFalse(ex.getMessage().contains("truncated"));
  }

  @Test
  void missingKeyFailsInsteadOfReturningPartialResults() {
    WwdcSearchUseCase useCase = new WwdcSearchUseCase(PipelineFixtures.loader(Optional.empty()), engine);

    BundleException ex = assertThrows(BundleException.class, () -> useCase.search(bundle, "SwiftUI", false));

    assertEquals(SearchFailure.DECRYPTION_FAILED, ex.failure());
  }

  @Test
  void unreadableBundleFallsBackOnlyWhenAllowed() throws Exception {
    WwdcSearchUseCase useCase = new WwdcSearchUseCase(PipelineFixtures.loader(Optional.empty()), engine);
    Path missing = tempDir.resolve("nothing-here");

    BundleException ex = assertThrows(BundleException.class, () -> useCase.search(missing, "SwiftUI", false));

    assertEquals(SearchFailure.DATA_NOT_AVAILABLE, ex.failure());
    assertTrue(useCase.search(missing, "SwiftUI", true).placeholder());
  }
}
