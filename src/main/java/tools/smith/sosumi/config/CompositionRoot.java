package tools.smith.sosumi.config;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import tools.smith.sosumi.application.bundle.ArchiveLoader;
import tools.smith.sosumi.application.pipeline.BundleBuildUseCase;
import tools.smith.sosumi.application.pipeline.BundleStatsUseCase;
import tools.smith.sosumi.application.pipeline.SessionLookupUseCase;
import tools.smith.sosumi.application.pipeline.WwdcSearchUseCase;
import tools.smith.sosumi.application.pipeline.YearListingUseCase;
import tools.smith.sosumi.application.port.ArchiveCodec;
import tools.smith.sosumi.application.port.BlockCompressor;
import tools.smith.sosumi.application.port.ClockPort;
import tools.smith.sosumi.application.port.ContentCipher;
import tools.smith.sosumi.application.search.SearchEngine;
import tools.smith.sosumi.application.search.SynonymTable;
import tools.smith.sosumi.infrastructure.codec.JsonArchiveCodec;
import tools.smith.sosumi.infrastructure.compression.DeflateBlockCompressor;
import tools.smith.sosumi.infrastructure.crypto.AesGcmContentCipher;
import tools.smith.sosumi.infrastructure.locate.BundleLocator;
import tools.smith.sosumi.infrastructure.render.ResultRenderer;

/**
 * <strong>What:</strong> Central composition root that wires sosumi use cases to concrete adapters.
 * <p><strong>Why:</strong> Keeps configuration-to-adapter translation in one place so CLI classes only parse
 * arguments and map outcomes to exit codes.</p>
 * <p><strong>Thread-safety:</strong> Holds immutable configuration; factory methods create new instances and are
 * not synchronized.</p>
 *
 * @since 1.2.0
 */
public final class CompositionRoot {
  private final SosumiConfig config;
  private final Map<String, String> env;
  private final Path workingDir;
  private final Path appDir;
  private final ClockPort clock;

  /**
   * Creates a composition root.
   *
   * @param config effective configuration
   * @param env environment variables (key source)
   * @param workingDir current working directory
   * @param appDir application install directory, or {@code null} when unknown
   */
  public CompositionRoot(SosumiConfig config, Map<String, String> env, Path workingDir, Path appDir) {
    this(config, env, workingDir, appDir, ClockPort.SYSTEM);
  }

  CompositionRoot(SosumiConfig config, Map<String, String> env, Path workingDir, Path appDir, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.env = Map.copyOf(Objects.requireNonNull(env, "env"));
    this.workingDir = Objects.requireNonNull(workingDir, "workingDir");
    this.appDir = appDir;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public SosumiConfig config() {
    return config;
  }

  public BundleLocator bundleLocator() {
    return new BundleLocator(config.bundle().orElse(null), config.home(), workingDir, appDir);
  }

  /**
   * Builds the content cipher from the configured key variable.
   *
   * @param required whether an absent key is an error
   * @return cipher, or empty when the key is absent and not required
   * @throws IllegalArgumentException when the key is malformed, or absent while required
   */
  public Optional<ContentCipher> contentCipher(boolean required) {
    return KeyProvider.resolve(env, config.keyEnv(), required).map(AesGcmContentCipher::new);
  }

  public ArchiveCodec archiveCodec() {
    return new JsonArchiveCodec();
  }

  public BlockCompressor blockCompressor() {
    return new DeflateBlockCompressor();
  }

  /**
   * Builds a loader whose cipher is bound to the configured key, if any.
   *
   * @return archive loader
   * @throws IllegalArgumentException when the configured key is malformed
   */
  public ArchiveLoader archiveLoader() {
    return new ArchiveLoader(archiveCodec(), blockCompressor(), contentCipher(false));
  }

  /**
   * Loads the synonym table, preferring the configured file over the packaged table.
   *
   * @return synonym table
   * @throws IOException if the table cannot be read
   */
  public SynonymTable synonymTable() throws IOException {
    Optional<Path> override = config.synonyms();
    return override.isPresent() ? SynonymTableLoader.load(override.get()) : SynonymTableLoader.loadDefault();
  }

  public SearchEngine searchEngine() throws IOException {
    return new SearchEngine(synonymTable(), config.scanThreads());
  }

  public WwdcSearchUseCase wwdcSearchUseCase() throws IOException {
    return new WwdcSearchUseCase(archiveLoader(), searchEngine());
  }

  public SessionLookupUseCase sessionLookupUseCase() {
    return new SessionLookupUseCase(archiveLoader());
  }

  public YearListingUseCase yearListingUseCase() {
    return new YearListingUseCase(archiveLoader());
  }

  public BundleStatsUseCase bundleStatsUseCase() {
    return new BundleStatsUseCase(new ArchiveLoader(archiveCodec(), blockCompressor(), Optional.empty()));
  }

  public BundleBuildUseCase bundleBuildUseCase() {
    return new BundleBuildUseCase(archiveCodec(), blockCompressor(), clock);
  }

  public ResultRenderer renderer() {
    return ResultRenderer.forFormat(config.format());
  }
}
