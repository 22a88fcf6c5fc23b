package tools.smith.sosumi.domain.text;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives the public Apple Developer link for a session.
 *
 * @since 1.2.0
 */
public final class CanonicalLinks {
  /** Landing page used when an id does not encode a year and session number. */
  public static final String VIDEOS_HOME = "https://developer.apple.com/videos/";

  private static final Pattern SESSION_ID =
      Pattern.compile("^wwdc(\\d{4})[-_](\\d+)$", Pattern.CASE_INSENSITIVE);

  private CanonicalLinks() {}

  /**
   * Resolves the canonical link for a session.
   *
   * @param id record identifier such as {@code wwdc2021_10195} or {@code wwdc2024-10102}
   * @param override explicit link stored with the record; preferred when non-blank
   * @return absolute https link, never {@code null}
   */
  public static String forSession(String id, String override) {
    if (override != null && !override.isBlank()) {
      return override.trim();
    }
    if (id != null) {
      Matcher matcher = SESSION_ID.matcher(id.trim());
      if (matcher.matches()) {
        return "https://developer.apple.com/videos/play/wwdc" + matcher.group(1) + "/"
            + matcher.group(2) + "/";
      }
    }
    return VIDEOS_HOME;
  }
}
