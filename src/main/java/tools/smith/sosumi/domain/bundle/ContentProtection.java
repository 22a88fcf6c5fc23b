package tools.smith.sosumi.domain.bundle;

import java.util.Locale;

/**
 * How record content is stored inside an archive.
 *
 * @since 1.2.0
 */
public enum ContentProtection {
  /** Content is AES-GCM sealed and Base64 encoded. */
  SEALED("sealed"),
  /** Content is stored as plaintext (local development database). */
  PLAIN("plain");

  private final String wireName;

  ContentProtection(String wireName) {
    this.wireName = wireName;
  }

  /**
   * Returns the value written to {@code metadata.content_protection}.
   *
   * @return wire representation
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Parses a wire value, treating {@code null} as {@link #SEALED}.
   *
   * @param value wire value; may be {@code null}
   * @return protection mode
   * @throws IllegalArgumentException when the value is not recognized
   */
  public static ContentProtection fromWire(String value) {
    if (value == null || value.isBlank()) {
      return SEALED;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (ContentProtection protection : values()) {
      if (protection.wireName.equals(normalized)) {
        return protection;
      }
    }
    throw new IllegalArgumentException("unknown content_protection: " + value);
  }
}
