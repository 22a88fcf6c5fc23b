package tools.smith.sosumi.domain.text;

import java.util.HashMap;
import java.util.Map;

/**
 * <strong>What:</strong> Reversible vowel-to-Greek substitution applied to session titles.
 * <p><strong>Why:</strong> Keeps titles from being skimmed in a directory listing or raw envelope dump. This is a
 * lookup table, not a security control; anyone can reverse it.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 1.2.0
 */
public final class TitleObfuscator {
  /** Version recorded as {@code metadata.obfuscation_version}. */
  public static final int TABLE_VERSION = 1;

  private static final Map<Character, Character> FORWARD = Map.of(
      'a', 'α', 'e', 'ε', 'i', 'ι', 'o', 'ω', 'u', 'υ',
      'A', 'Α', 'E', 'Ε', 'I', 'Ι', 'O', 'Ω', 'U', 'Υ');
  private static final Map<Character, Character> REVERSE = invert(FORWARD);

  private TitleObfuscator() {
    // Utility
  }

  /**
   * Replaces supported vowels with their visually similar Greek counterparts.
   *
   * @param title readable title; {@code null} returns {@code null}
   * @return obfuscated title
   */
  public static String obfuscate(String title) {
    return substitute(title, FORWARD);
  }

  /**
   * Reverses {@link #obfuscate(String)} by table lookup.
   *
   * @param title obfuscated title; {@code null} returns {@code null}
   * @return readable title
   */
  public static String deobfuscate(String title) {
    return substitute(title, REVERSE);
  }

  private static String substitute(String value, Map<Character, Character> table) {
    if (value == null) {
      return null;
    }
    StringBuilder sb = new StringBuilder(value.length());
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      sb.append(table.getOrDefault(c, c));
    }
    return sb.toString();
  }

  private static Map<Character, Character> invert(Map<Character, Character> source) {
    Map<Character, Character> inverted = new HashMap<>();
    source.forEach((k, v) -> inverted.put(v, k));
    return Map.copyOf(inverted);
  }
}
