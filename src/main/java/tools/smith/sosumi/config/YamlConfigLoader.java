package tools.smith.sosumi.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads {@code sosumi.yaml} and returns the settings that apply to one command.
 *
 * <p>The file holds a {@code common} section plus one section per command. Keys of the command section win over
 * {@code common}; nested mappings become dotted keys. Sequences are rejected because every setting is scalar.</p>
 *
 * <p>Documents are parsed with a safe constructor, duplicate keys rejected, and alias expansion capped.</p>
 */
public final class YamlConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(YamlConfigLoader.class);
  static final String COMMON_SECTION = "common";
  private static final int MAX_ALIASES = 16;
  private static final int MAX_CODE_POINTS = 1 << 20;

  private YamlConfigLoader() {}

  /**
   * Loads the settings for {@code command}.
   *
   * @param path location of the YAML configuration
   * @param command CLI command whose section is applied over {@code common}
   * @return flat settings, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML is malformed or a section is not a mapping of scalars
   */
  public static Optional<Map<String, String>> load(Path path, String command) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(command, "command");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = parseDocument(reader, path.toString());
    }
    if (document == null) {
      return Optional.of(Map.of());
    }

    String wanted = sectionName(command);
    Map<String, Object> common = Map.of();
    Map<String, Object> specific = Map.of();
    for (Map.Entry<String, Object> section : asMap(document, path.toString()).entrySet()) {
      String name = sectionName(section.getKey());
      if (name.equals(COMMON_SECTION)) {
        common = sectionBody(section.getValue(), name);
      } else if (name.equals(wanted)) {
        specific = sectionBody(section.getValue(), name);
      } else if (!DefaultsForMode.COMMANDS.contains(name)) {
        log.warn("Ignoring unknown section '{}' in {}", section.getKey(), path);
      }
    }

    Map<String, String> settings = new LinkedHashMap<>();
    flatten(common, "", settings);
    flatten(specific, "", settings);
    return Optional.of(Map.copyOf(settings));
  }

  /**
   * Parses one YAML document with the hardened loader settings shared by every sosumi YAML file.
   *
   * @param reader document source
   * @param source description used in error messages
   * @return parsed document, or {@code null} for an empty document
   * @throws IllegalArgumentException when the document is not valid YAML
   */
  static Object parseDocument(Reader reader, String source) {
    LoaderOptions options = new LoaderOptions();
    options.setAllowDuplicateKeys(false);
    options.setMaxAliasesForCollections(MAX_ALIASES);
    options.setCodePointLimit(MAX_CODE_POINTS);
    try {
      return new Yaml(new SafeConstructor(options)).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML at " + source + ": " + ex.getMessage(), ex);
    }
  }

  static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    raw.forEach((key, value) -> {
      if (!(key instanceof String text) || text.isBlank()) {
        throw new IllegalArgumentException(context + " contains a blank or non-string key");
      }
      map.put(text, value);
    });
    return map;
  }

  private static Map<String, Object> sectionBody(Object body, String name) {
    return body == null ? Map.of() : asMap(body, "section '" + name + "'");
  }

  // "Bundle_Status" and "bundle-status" name the same section.
  private static String sectionName(String raw) {
    return raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    source.forEach((key, value) -> {
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("setting " + composite + " must be a single value, not a list");
      } else {
        target.put(composite, value == null ? "" : value.toString());
      }
    });
  }
}
