package tools.smith.sosumi.infrastructure.crypto;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.ByteBuffer;
import java.util.Base64;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import org.junit.jupiter.api.Test;

class AesGcmContentCipherTest {
  private static final SharedKey KEY = SharedKey.fromText("0123456789abcdef0123456789abcdef");
  private static final SharedKey OTHER = SharedKey.fromText("fedcba9876543210fedcba9876543210");

  @Test
  void sealThenOpenReturnsPlaintext() throws Exception {
    AesGcmContentCipher cipher = new AesGcmContentCipher(KEY);

    String sealed = cipher.seal("Welcome to WWDC. Café ☕");

    assertEquals("Welcome to WWDC. Café ☕", cipher.open(sealed).orElseThrow());
  }

  @Test
  void sealedFormIsNoncePlusCiphertextPlusTag() throws Exception {
    String sealed = new AesGcmContentCipher(KEY).seal("abcd");

    byte[] raw = Base64.getDecoder().decode(sealed);
    assertEquals(AesGcmContentCipher.NONCE_BYTES + 4 + AesGcmContentCipher.TAG_BITS / 8, raw.length);
  }

  @Test
  void freshNonceEachTime() throws Exception {
    AesGcmContentCipher cipher = new AesGcmContentCipher(KEY);

    assertNotEquals(cipher.seal("same"), cipher.seal("same"));
  }

  @Test
  void wrongKeyFailsAuthentication() throws Exception {
    String sealed = new AesGcmContentCipher(KEY).seal("secret transcript");

    assertTrue(new AesGcmContentCipher(OTHER).open(sealed).isEmpty());
  }

  @Test
  void tamperedCiphertextFailsAuthentication() throws Exception {
    AesGcmContentCipher cipher = new AesGcmContentCipher(KEY);
    byte[] raw = Base64.getDecoder().decode(cipher.seal("secret transcript"));
    raw[AesGcmContentCipher.NONCE_BYTES] ^= 0x01;

    assertTrue(cipher.open(Base64.getEncoder().encodeToString(raw)).isEmpty());
  }

  @Test
  void malformedInputIsRejectedQuietly() {
    AesGcmContentCipher cipher = new AesGcmContentCipher(KEY);

    assertTrue(cipher.open("not base64 !!").isEmpty());
    assertTrue(cipher.open(Base64.getEncoder().encodeToString(new byte[8])).isEmpty());
    assertTrue(cipher.open(null).isEmpty());
    assertFalse(cipher.open("").isPresent());
  }

  @Test
  void authenticInvalidUtf8IsNotOpened() throws Exception {
    byte[] nonce = new byte[AesGcmContentCipher.NONCE_BYTES];
    Cipher jce = Cipher.getInstance("AES/GCM/NoPadding");
    jce.init(Cipher.ENCRYPT_MODE, KEY.secretKey(), new GCMParameterSpec(AesGcmContentCipher.TAG_BITS, nonce));
    byte[] sealed = jce.doFinal(new byte[] {'o', 'k', (byte) 0xC3, (byte) 0x28});
    String encoded = Base64.getEncoder().encodeToString(
        ByteBuffer.allocate(nonce.length + sealed.length).put(nonce).put(sealed).array());

    assertTrue(new AesGcmContentCipher(KEY).open(encoded).isEmpty());
  }
}
