package tools.smith.sosumi.application.bundle;

/**
 * Failure taxonomy for loading, decrypting, and searching a bundle.
 *
 * @since 1.2.0
 */
public enum SearchFailure {
  /** Archive missing or unreadable. */
  DATA_NOT_AVAILABLE("dataNotAvailable"),
  /** Envelope parse failure, invariant violation, or version mismatch. */
  INVALID_DATA_FORMAT("invalidDataFormat"),
  /** Decompression failure. */
  COMPRESSION_NOT_SUPPORTED("compressionNotSupported"),
  /** Key missing or authentication failure where content is required. */
  DECRYPTION_FAILED("decryptionFailed"),
  /** Stored checksum does not match the recovered plaintext where content is required. */
  INTEGRITY_CHECK_FAILED("integrityCheckFailed"),
  /** Archive loaded but produced no results while real data was mandatory. */
  REAL_DATA_FAILED("realDataFailed");

  private final String label;

  SearchFailure(String label) {
    this.label = label;
  }

  /**
   * Returns the stable camel-case label used in logs and JSON output.
   *
   * @return failure label
   */
  public String label() {
    return label;
  }
}
