package tools.smith.sosumi.application.bundle;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.smith.sosumi.application.port.ArchiveCodec;
import tools.smith.sosumi.application.port.BlockCompressor;
import tools.smith.sosumi.application.port.ContentCipher;
import tools.smith.sosumi.domain.bundle.Archive;

/**
 * <strong>What:</strong> Reads a bundle artifact from disk and turns it into a {@link LoadedBundle}.
 * <p><strong>Why:</strong> Keeps the read, inflate, and parse stages together so each stage maps to exactly one
 * {@link SearchFailure}.</p>
 * <p><strong>Pipeline:</strong> read bytes ({@link SearchFailure#DATA_NOT_AVAILABLE}), inflate unless the bytes
 * already start with a JSON object ({@link SearchFailure#COMPRESSION_NOT_SUPPORTED}), parse
 * ({@link SearchFailure#INVALID_DATA_FORMAT}). Record content is not touched here.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe to share.</p>
 *
 * @since 1.2.0
 */
public final class ArchiveLoader {
  private static final Logger log = LoggerFactory.getLogger(ArchiveLoader.class);

  private final ArchiveCodec codec;
  private final BlockCompressor compressor;
  private final Optional<ContentCipher> cipher;

  /**
   * Creates a loader.
   *
   * @param codec envelope codec
   * @param compressor block compressor used by the build
   * @param cipher content cipher, or empty when no key is configured
   */
  public ArchiveLoader(ArchiveCodec codec, BlockCompressor compressor, Optional<ContentCipher> cipher) {
    this.codec = Objects.requireNonNull(codec, "codec");
    this.compressor = Objects.requireNonNull(compressor, "compressor");
    this.cipher = Objects.requireNonNull(cipher, "cipher");
  }

  /**
   * Loads and parses the artifact at {@code path}.
   *
   * @param path bundle or plain database file
   * @return loaded bundle with lazy content access
   * @throws BundleException when the file cannot be read, inflated, or parsed
   */
  public LoadedBundle load(Path path) throws BundleException {
    Objects.requireNonNull(path, "path");
    byte[] raw;
    try {
      raw = Files.readAllBytes(path);
    } catch (IOException ex) {
      throw new BundleException(SearchFailure.DATA_NOT_AVAILABLE, "Unable to read bundle " + path, ex);
    }
    if (raw.length == 0) {
      throw new BundleException(SearchFailure.DATA_NOT_AVAILABLE, "Bundle is empty: " + path);
    }
    byte[] json;
    if (looksLikeJson(raw)) {
      log.debug("Bundle {} is stored uncompressed", path);
      json = raw;
    } else {
      try {
        json = compressor.decompress(raw);
      } catch (IOException ex) {
        throw new BundleException(
            SearchFailure.COMPRESSION_NOT_SUPPORTED, "Unable to decompress bundle " + path, ex);
      }
    }
    Archive archive;
    try {
      archive = codec.decode(json);
    } catch (IllegalArgumentException ex) {
      throw new BundleException(
          SearchFailure.INVALID_DATA_FORMAT, "Bundle " + path + " is malformed: " + ex.getMessage(), ex);
    }
    log.debug(
        "Loaded {} records ({} index terms, protection={}) from {}",
        archive.records().size(),
        archive.searchIndex().size(),
        archive.metadata().protection().wireName(),
        path);
    RecordDecryptor decryptor = new RecordDecryptor(archive.metadata().protection(), cipher);
    return new LoadedBundle(path, raw.length, archive, decryptor);
  }

  static boolean looksLikeJson(byte[] data) {
    for (byte b : data) {
      if (b == ' ' || b == '\n' || b == '\r' || b == '\t') {
        continue;
      }
      return b == '{';
    }
    return false;
  }
}
