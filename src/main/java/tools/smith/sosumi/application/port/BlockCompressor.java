package tools.smith.sosumi.application.port;

import java.io.IOException;

/**
 * Lossless block compression for the serialized archive envelope.
 *
 * @since 1.2.0
 */
public interface BlockCompressor {
  /**
   * Compresses a complete buffer.
   *
   * @param data uncompressed bytes
   * @return compressed bytes
   * @throws IOException if the compressor fails
   */
  byte[] compress(byte[] data) throws IOException;

  /**
   * Decompresses a complete buffer.
   *
   * @param data compressed bytes
   * @return original bytes
   * @throws IOException if the data is corrupt, truncated, or not in this compressor's format
   */
  byte[] decompress(byte[] data) throws IOException;
}
