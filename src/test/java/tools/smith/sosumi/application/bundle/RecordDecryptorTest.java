package tools.smith.sosumi.application.bundle;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;
import tools.smith.sosumi.application.port.ContentCipher;
import tools.smith.sosumi.domain.bundle.ContentChecksums;
import tools.smith.sosumi.domain.bundle.ContentProtection;
import tools.smith.sosumi.domain.bundle.SessionRecord;
import tools.smith.sosumi.infrastructure.crypto.AesGcmContentCipher;
import tools.smith.sosumi.infrastructure.crypto.SharedKey;
import tools.smith.sosumi.testutil.SampleBundles;

class RecordDecryptorTest {
  private static final String TRANSCRIPT = "00:10 Welcome to SharePlay.";

  @Test
  void correctKeyDecryptsAndVerifies() throws Exception {
    SessionRecord record = sealedWith(SampleBundles.cipher(), ContentChecksums.sha256Hex(TRANSCRIPT));

    RecordContent content =
        new RecordDecryptor(ContentProtection.SEALED, Optional.of(SampleBundles.cipher())).open(record);

    assertEquals(RecordContent.Status.DECRYPTED, content.status());
    assertEquals(TRANSCRIPT, content.text());
  }

  @Test
  void wrongKeyIsAuthenticationFailure() throws Exception {
    SessionRecord record = sealedWith(SampleBundles.cipher(), null);
    ContentCipher other = new AesGcmContentCipher(SharedKey.fromText(SampleBundles.OTHER_KEY_TEXT));

    RecordContent content = new RecordDecryptor(ContentProtection.SEALED, Optional.of(other)).open(record);

    assertEquals(RecordContent.Status.AUTHENTICATION_FAILED, content.status());
    assertTrue(content.plaintext().isEmpty());
  }

  @Test
  void checksumMismatchIsReported() throws Exception {
    SessionRecord record = sealedWith(SampleBundles.cipher(), ContentChecksums.sha256Hex("something else"));

    RecordContent content =
        new RecordDecryptor(ContentProtection.SEALED, Optional.of(SampleBundles.cipher())).open(record);

    assertEquals(RecordContent.Status.CHECKSUM_MISMATCH, content.status());
  }

  @Test
  void missingKeyOnlyMattersForSealedArchives() throws Exception {
    RecordDecryptor sealed = new RecordDecryptor(ContentProtection.SEALED, Optional.empty());
    RecordDecryptor plain = new RecordDecryptor(ContentProtection.PLAIN, Optional.empty());
    SessionRecord clear = new SessionRecord("a", "T", 2024, TRANSCRIPT, null, null, null);

    assertFalse(sealed.canOpen());
    assertEquals(RecordContent.Status.KEY_UNAVAILABLE, sealed.open(sealedWith(SampleBundles.cipher(), null)).status());
    assertTrue(plain.canOpen());
    assertEquals(TRANSCRIPT, plain.decrypt(clear).orElseThrow());
  }

  private static SessionRecord sealedWith(ContentCipher cipher, String checksum) throws Exception {
    return new SessionRecord("wwdc2023-10239", "T", 2023, cipher.seal(TRANSCRIPT), checksum, null, null);
  }
}
