package tools.smith.sosumi.domain.bundle;

import java.util.Objects;

/**
 * Plaintext session accepted by the build pipeline before obfuscation and sealing.
 *
 * @param id stable identifier
 * @param title readable title
 * @param year session year
 * @param content full transcript
 * @param excerpt optional public preview; may be {@code null}
 * @param webUrl optional canonical link; may be {@code null}
 * @since 1.2.0
 */
public record PlainSession(
    String id, String title, int year, String content, String excerpt, String webUrl) {

  public PlainSession {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(title, "title");
    Objects.requireNonNull(content, "content");
  }
}
