package tools.smith.sosumi.application.bundle;

import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.smith.sosumi.application.port.ContentCipher;
import tools.smith.sosumi.domain.bundle.ContentChecksums;
import tools.smith.sosumi.domain.bundle.ContentProtection;
import tools.smith.sosumi.domain.bundle.SessionRecord;

/**
 * <strong>What:</strong> Opens a record's content and verifies its checksum.
 * <p><strong>Contract:</strong> never throws for a missing key, failed authentication, or checksum mismatch; the
 * outcome is reported through {@link RecordContent.Status} so callers choose between exclusion and loud failure.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use when the cipher is.</p>
 *
 * @since 1.2.0
 */
public final class RecordDecryptor {
  private static final Logger log = LoggerFactory.getLogger(RecordDecryptor.class);

  private final ContentProtection protection;
  private final ContentCipher cipher;

  /**
   * Creates a decryptor for one archive.
   *
   * @param protection how the archive stores content
   * @param cipher cipher bound to the shared key, or empty when no key is configured
   */
  public RecordDecryptor(ContentProtection protection, Optional<ContentCipher> cipher) {
    this.protection = Objects.requireNonNull(protection, "protection");
    this.cipher = Objects.requireNonNull(cipher, "cipher").orElse(null);
  }

  /**
   * Indicates whether sealed content can be opened at all.
   *
   * @return {@code true} for plain archives or when a key is configured
   */
  public boolean canOpen() {
    return protection == ContentProtection.PLAIN || cipher != null;
  }

  /**
   * Opens and verifies the content of one record.
   *
   * @param record record to open
   * @return content outcome; never {@code null}
   */
  public RecordContent open(SessionRecord record) {
    Objects.requireNonNull(record, "record");
    String plaintext;
    RecordContent.Status success;
    if (protection == ContentProtection.PLAIN) {
      plaintext = record.content();
      success = RecordContent.Status.PLAIN;
    } else {
      if (cipher == null) {
        return RecordContent.unavailable(RecordContent.Status.KEY_UNAVAILABLE);
      }
      Optional<String> opened = cipher.open(record.content());
      if (opened.isEmpty()) {
        log.debug("Content authentication failed for record {}", record.id());
        return RecordContent.unavailable(RecordContent.Status.AUTHENTICATION_FAILED);
      }
      plaintext = opened.get();
      success = RecordContent.Status.DECRYPTED;
    }
    Optional<String> checksum = record.checksumValue();
    if (checksum.isPresent() && !ContentChecksums.matches(plaintext, checksum.get())) {
      log.warn("Checksum mismatch for record {}", record.id());
      return RecordContent.unavailable(RecordContent.Status.CHECKSUM_MISMATCH);
    }
    return new RecordContent(success, plaintext);
  }

  /**
   * Convenience form of {@link #open(SessionRecord)} that returns plaintext or nothing.
   *
   * @param record record to open
   * @return plaintext when available
   */
  public Optional<String> decrypt(SessionRecord record) {
    return open(record).plaintext();
  }
}
