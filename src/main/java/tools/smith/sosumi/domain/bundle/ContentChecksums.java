package tools.smith.sosumi.domain.bundle;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * SHA-256 digest of transcript plaintext, encoded as lowercase hex.
 * <p>The digest is computed over the UTF-8 bytes of the plaintext so any reimplementation reproduces it.</p>
 *
 * @since 1.2.0
 */
public final class ContentChecksums {
  private static final String ALGORITHM = "SHA-256";

  private ContentChecksums() {}

  /**
   * Computes the checksum of a transcript.
   *
   * @param plaintext transcript text; must not be {@code null}
   * @return 64 lowercase hex characters
   */
  public static String sha256Hex(String plaintext) {
    try {
      MessageDigest digest = MessageDigest.getInstance(ALGORITHM);
      return HexFormat.of().formatHex(digest.digest(plaintext.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("JDK is missing " + ALGORITHM, ex);
    }
  }

  /**
   * Checks a transcript against a stored checksum, ignoring hex case.
   *
   * @param plaintext recovered transcript
   * @param expected stored checksum
   * @return {@code true} when the digests match
   */
  public static boolean matches(String plaintext, String expected) {
    if (expected == null) {
      return false;
    }
    return sha256Hex(plaintext).equals(expected.trim().toLowerCase(Locale.ROOT));
  }
}
