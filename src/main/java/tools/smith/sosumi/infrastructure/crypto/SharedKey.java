package tools.smith.sosumi.infrastructure.crypto;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

/**
 * The 256-bit content key shared by every install.
 * <p>Key bytes are the UTF-8 encoding of the provisioned value; anything other than 32 bytes is rejected. The key is
 * never rendered by {@link #toString()}.</p>
 *
 * @since 1.2.0
 */
public final class SharedKey {
  /** Required key length in bytes. */
  public static final int LENGTH = 32;

  private final byte[] material;

  private SharedKey(byte[] material) {
    this.material = material;
  }

  /**
   * Builds a key from its UTF-8 text form.
   *
   * @param text provisioned key text
   * @return shared key
   * @throws IllegalArgumentException when the UTF-8 encoding is not exactly 32 bytes
   */
  public static SharedKey fromText(String text) {
    Objects.requireNonNull(text, "text");
    return fromBytes(text.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Builds a key from raw bytes.
   *
   * @param bytes key material; copied
   * @return shared key
   * @throws IllegalArgumentException when not exactly 32 bytes
   */
  public static SharedKey fromBytes(byte[] bytes) {
    Objects.requireNonNull(bytes, "bytes");
    if (bytes.length != LENGTH) {
      throw new IllegalArgumentException(
          "Encryption key must be exactly " + LENGTH + " bytes (was " + bytes.length + ")");
    }
    return new SharedKey(bytes.clone());
  }

  SecretKey secretKey() {
    return new SecretKeySpec(material, "AES");
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof SharedKey that && Arrays.equals(material, that.material);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(material);
  }

  @Override
  public String toString() {
    return "SharedKey[redacted]";
  }
}
