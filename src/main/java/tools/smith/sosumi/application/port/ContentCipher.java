package tools.smith.sosumi.application.port;

import java.security.GeneralSecurityException;
import java.util.Optional;

/**
 * <strong>What:</strong> Authenticated symmetric encryption of transcript text.
 * <p><strong>Role:</strong> Used by the build pipeline to seal content and by the decode pipeline to open it.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent {@link #open(String)} calls from scan
 * workers; the key is immutable after construction.</p>
 *
 * @since 1.2.0
 */
public interface ContentCipher {
  /**
   * Seals UTF-8 plaintext and returns the transport-encoded sealed form.
   *
   * @param plaintext transcript text; must not be {@code null}
   * @return Base64 text of nonce, ciphertext, and tag
   * @throws GeneralSecurityException when the cipher cannot be initialized or fails
   */
  String seal(String plaintext) throws GeneralSecurityException;

  /**
   * Opens a sealed value.
   *
   * @param sealed Base64 text produced by {@link #seal(String)}
   * @return plaintext, or empty when decoding or authentication fails; never garbage plaintext
   */
  Optional<String> open(String sealed);
}
