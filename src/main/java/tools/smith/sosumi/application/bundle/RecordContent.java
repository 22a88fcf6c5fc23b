package tools.smith.sosumi.application.bundle;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of opening one record's content.
 *
 * @param status how the content was obtained or why it is unavailable
 * @param text plaintext when {@link Status#available()}; otherwise {@code null}
 * @since 1.2.0
 */
public record RecordContent(Status status, String text) {

  /** Content access states. */
  public enum Status {
    /** Stored in clear in a plain database. */
    PLAIN(true),
    /** Authenticated, decrypted, and checksum-verified. */
    DECRYPTED(true),
    /** No key is configured for a sealed archive. */
    KEY_UNAVAILABLE(false),
    /** Base64 decoding or GCM authentication failed. */
    AUTHENTICATION_FAILED(false),
    /** Plaintext recovered but the stored checksum disagrees. */
    CHECKSUM_MISMATCH(false);

    private final boolean available;

    Status(boolean available) {
      this.available = available;
    }

    /**
     * Indicates whether plaintext is usable.
     *
     * @return {@code true} for plain or verified content
     */
    public boolean available() {
      return available;
    }
  }

  public RecordContent {
    Objects.requireNonNull(status, "status");
    if (status.available() && text == null) {
      throw new IllegalArgumentException("available content requires text");
    }
    if (!status.available()) {
      text = null;
    }
  }

  static RecordContent unavailable(Status status) {
    return new RecordContent(status, null);
  }

  /**
   * Returns the plaintext when available.
   *
   * @return optional plaintext
   */
  public Optional<String> plaintext() {
    return Optional.ofNullable(text);
  }
}
