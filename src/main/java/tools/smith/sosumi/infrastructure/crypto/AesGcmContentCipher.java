package tools.smith.sosumi.infrastructure.crypto;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Objects;
import java.util.Optional;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.smith.sosumi.application.port.ContentCipher;

/**
 * <strong>What:</strong> AES-256-GCM implementation of {@link ContentCipher}.
 * <p><strong>Format:</strong> Base64 of a 12-byte random nonce, the ciphertext, and the 16-byte tag, concatenated.</p>
 * <p><strong>Thread-safety:</strong> A fresh {@link Cipher} is obtained per call; the key is immutable, so instances are
 * safe to share across scan workers.</p>
 *
 * @since 1.2.0
 */
public final class AesGcmContentCipher implements ContentCipher {
  private static final Logger log = LoggerFactory.getLogger(AesGcmContentCipher.class);
  private static final String TRANSFORMATION = "AES/GCM/NoPadding";
  static final int NONCE_BYTES = 12;
  static final int TAG_BITS = 128;

  private final SecretKey key;
  private final SecureRandom random;

  /**
   * Creates a cipher bound to the shared key.
   *
   * @param key shared content key
   */
  public AesGcmContentCipher(SharedKey key) {
    this(key, new SecureRandom());
  }

  AesGcmContentCipher(SharedKey key, SecureRandom random) {
    this.key = Objects.requireNonNull(key, "key").secretKey();
    this.random = Objects.requireNonNull(random, "random");
  }

  @Override
  public String seal(String plaintext) throws GeneralSecurityException {
    Objects.requireNonNull(plaintext, "plaintext");
    byte[] nonce = new byte[NONCE_BYTES];
    random.nextBytes(nonce);
    Cipher cipher = Cipher.getInstance(TRANSFORMATION);
    cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, nonce));
    byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
    ByteBuffer combined = ByteBuffer.allocate(nonce.length + sealed.length);
    combined.put(nonce).put(sealed);
    return Base64.getEncoder().encodeToString(combined.array());
  }

  @Override
  public Optional<String> open(String sealed) {
    if (sealed == null) {
      return Optional.empty();
    }
    byte[] combined;
    try {
      combined = Base64.getDecoder().decode(sealed.trim());
    } catch (IllegalArgumentException ex) {
      log.debug("Sealed content is not valid Base64: {}", ex.getMessage());
      return Optional.empty();
    }
    if (combined.length < NONCE_BYTES + TAG_BITS / 8) {
      log.debug("Sealed content too short ({} bytes)", combined.length);
      return Optional.empty();
    }
    try {
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, combined, 0, NONCE_BYTES));
      byte[] plain = cipher.doFinal(combined, NONCE_BYTES, combined.length - NONCE_BYTES);
      return decodeUtf8(plain);
    } catch (GeneralSecurityException ex) {
      log.debug("Content authentication failed: {}", ex.getClass().getSimpleName());
      return Optional.empty();
    }
  }

  // Authentic bytes that are not UTF-8 are treated like a failed open, never patched with U+FFFD.
  private static Optional<String> decodeUtf8(byte[] plain) {
    try {
      return Optional.of(StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(plain))
          .toString());
    } catch (CharacterCodingException ex) {
      log.debug("Decrypted content is not valid UTF-8: {}", ex.getClass().getSimpleName());
      return Optional.empty();
    }
  }
}
