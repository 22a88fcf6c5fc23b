package tools.smith.sosumi.application.port;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import tools.smith.sosumi.domain.bundle.Archive;

/**
 * <strong>What:</strong> Serializes the archive envelope to a self-describing byte form and back.
 * <p><strong>Contract:</strong> decoding tolerates unknown fields but rejects a missing or ill-typed mandatory field
 * and any version other than {@link Archive#FORMAT_VERSION} with {@link IllegalArgumentException}.</p>
 *
 * @since 1.2.0
 */
public interface ArchiveCodec {
  /**
   * Encodes an archive.
   *
   * @param archive archive to encode
   * @return UTF-8 envelope bytes
   * @throws IOException if serialization fails
   */
  byte[] encode(Archive archive) throws IOException;

  /**
   * Decodes an archive.
   *
   * @param data UTF-8 envelope bytes
   * @return parsed archive
   * @throws IllegalArgumentException when the envelope is malformed or the version is unsupported
   */
  Archive decode(byte[] data);

  /**
   * Decodes a plaintext build corpus without validating individual sessions.
   *
   * @param data UTF-8 corpus bytes
   * @return raw corpus; sessions are field maps so the build pipeline can skip incomplete entries
   * @throws IllegalArgumentException when the document is not a corpus object
   */
  PlainCorpus decodeCorpus(byte[] data);

  /**
   * Plaintext input to the build pipeline.
   *
   * @param sessions raw session field maps in input order
   * @param searchIndex caller-supplied index, or {@code null} when the corpus carries none
   */
  record PlainCorpus(List<Map<String, Object>> sessions, Map<String, List<String>> searchIndex) {}
}
