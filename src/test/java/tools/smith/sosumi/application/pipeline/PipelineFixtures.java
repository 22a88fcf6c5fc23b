package tools.smith.sosumi.application.pipeline;

import java.util.Optional;
import tools.smith.sosumi.application.bundle.ArchiveLoader;
import tools.smith.sosumi.application.port.ContentCipher;
import tools.smith.sosumi.infrastructure.codec.JsonArchiveCodec;
import tools.smith.sosumi.infrastructure.compression.DeflateBlockCompressor;

final class PipelineFixtures {
  private PipelineFixtures() {}

  static ArchiveLoader loader(Optional<ContentCipher> cipher) {
    return new ArchiveLoader(new JsonArchiveCodec(), new DeflateBlockCompressor(), cipher);
  }
}
