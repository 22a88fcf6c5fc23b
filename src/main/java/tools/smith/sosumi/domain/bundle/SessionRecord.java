package tools.smith.sosumi.domain.bundle;

import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> One WWDC session as stored inside the archive envelope.
 * <p><strong>Why:</strong> Keeps the obfuscated title readable for listings while the transcript stays sealed until a
 * search selects the record as a candidate.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent sharing.</p>
 *
 * @param id stable identifier, unique within an archive (wire name {@code hash}); never blank
 * @param title obfuscated title; never {@code null}
 * @param year session year, used for grouping only
 * @param content sealed transcript (Base64 of nonce, ciphertext, and tag) or plaintext for plain databases
 * @param checksum lowercase hex SHA-256 of the plaintext transcript; {@code null} when the producer omitted it
 * @param excerpt optional public preview searched alongside the title; may be {@code null}
 * @param webUrl optional canonical link override; may be {@code null}
 * @since 1.2.0
 */
public record SessionRecord(
    String id,
    String title,
    int year,
    String content,
    String checksum,
    String excerpt,
    String webUrl) {

  public SessionRecord {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(title, "title");
    Objects.requireNonNull(content, "content");
    if (id.isBlank()) {
      throw new IllegalArgumentException("id must not be blank");
    }
  }

  /**
   * Returns the stored checksum when the producer recorded one.
   *
   * @return optional hex checksum
   */
  public Optional<String> checksumValue() {
    return Optional.ofNullable(checksum).filter(value -> !value.isBlank());
  }

  /**
   * Returns the public excerpt when present.
   *
   * @return optional excerpt text
   */
  public Optional<String> excerptValue() {
    return Optional.ofNullable(excerpt).filter(value -> !value.isBlank());
  }

  /**
   * Returns the canonical link override when present.
   *
   * @return optional link
   */
  public Optional<String> webUrlValue() {
    return Optional.ofNullable(webUrl).filter(value -> !value.isBlank());
  }
}
