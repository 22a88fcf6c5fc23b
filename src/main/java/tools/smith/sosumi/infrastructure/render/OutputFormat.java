package tools.smith.sosumi.infrastructure.render;

import java.util.Locale;

/** Serialization used for rendered output. */
public enum OutputFormat {
  MARKDOWN,
  JSON;

  /**
   * Parses a format option.
   *
   * @param value {@code markdown} or {@code json}, case-insensitive
   * @return format
   * @throws IllegalArgumentException for unknown values
   */
  public static OutputFormat parse(String value) {
    String normalized = value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
    try {
      return OutputFormat.valueOf(normalized);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("format must be markdown or json (was " + value + ")", ex);
    }
  }
}
