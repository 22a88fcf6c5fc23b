package tools.smith.sosumi.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for text supplied on the command line or in config files.
 * <p><strong>Why:</strong> Queries, session ids, and environment variable names are checked before the bundle is
 * touched so argument mistakes surface as {@code INVALID_ARGS} instead of empty results.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 *
 * @implNote Control characters are detected via {@link Character#isISOControl(char)}.
 * @since 1.2.0
 * @see Numbers
 */
public final class Strings {
  private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^([A-Za-z0-9._-]+)$");
  private static final Pattern ENV_NAME_PATTERN = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    if (containsControl(trimmed)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    return trimmed;
  }

  /**
   * Validates query text: non-blank, no control characters, at most {@code maxLength} characters.
   *
   * @param value candidate query
   * @param maxLength maximum length after trimming
   * @return trimmed query
   * @throws IllegalArgumentException when the query is blank, too long, or contains control characters
   */
  public static String requireQuery(String value, int maxLength) {
    if (value == null) {
      throw new IllegalArgumentException("query is required");
    }
    String trimmed = requireNonBlank("query", value);
    if (trimmed.length() > maxLength) {
      throw new IllegalArgumentException(message("query", "length must be <= " + maxLength));
    }
    return trimmed;
  }

  /**
   * Validates a session id such as {@code wwdc2024-10101}.
   *
   * @param name logical parameter name
   * @param value candidate id
   * @return trimmed id composed of {@code [A-Za-z0-9._-]}
   * @throws IllegalArgumentException when the id is blank or uses other characters
   */
  public static String requireIdentifier(String name, String value) {
    if (value == null) {
      throw new IllegalArgumentException(message(name, "is required"));
    }
    String sanitized = requireNonBlank(name, value);
    if (!IDENTIFIER_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must only contain letters, digits, dot, underscore, or hyphen"));
    }
    return sanitized;
  }

  /**
   * Validates an environment variable name.
   *
   * @param name logical parameter name
   * @param value candidate variable name
   * @return validated name
   * @throws IllegalArgumentException when the name is not a portable shell identifier
   */
  public static String requireEnvName(String name, String value) {
    String sanitized = requireNonBlank(name, value);
    if (!ENV_NAME_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name, "must be a valid environment variable name"));
    }
    return sanitized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
