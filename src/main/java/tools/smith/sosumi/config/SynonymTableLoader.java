package tools.smith.sosumi.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import tools.smith.sosumi.application.search.SynonymTable;

/**
 * Loads the query synonym table from YAML: a mapping of term to a list of synonyms.
 *
 * @since 1.2.0
 */
public final class SynonymTableLoader {
  /** Classpath resource holding the packaged table. */
  public static final String DEFAULT_RESOURCE = "/synonyms.yaml";

  private SynonymTableLoader() {}

  /**
   * Loads the packaged table.
   *
   * @return packaged synonym table
   * @throws IOException if the resource is missing or unreadable
   */
  public static SynonymTable loadDefault() throws IOException {
    try (InputStream in = SynonymTableLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
      if (in == null) {
        throw new IOException("Missing classpath resource " + DEFAULT_RESOURCE);
      }
      return parse(new InputStreamReader(in, StandardCharsets.UTF_8), DEFAULT_RESOURCE);
    }
  }

  /**
   * Loads a table from a file.
   *
   * @param path YAML file
   * @return synonym table
   * @throws IOException if the file cannot be read
   * @throws IllegalArgumentException if the file is not a mapping of term to list
   */
  public static SynonymTable load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return parse(reader, path.toString());
    }
  }

  static SynonymTable parse(Reader reader, String source) {
    Object document = YamlConfigLoader.parseDocument(reader, source);
    if (document == null) {
      return SynonymTable.empty();
    }
    Map<String, List<String>> entries = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : YamlConfigLoader.asMap(document, "synonyms").entrySet()) {
      if (!(entry.getValue() instanceof List<?> values)) {
        throw new IllegalArgumentException("Synonyms for '" + entry.getKey() + "' must be a list");
      }
      List<String> synonyms = new ArrayList<>(values.size());
      for (Object value : values) {
        if (value == null) {
          continue;
        }
        synonyms.add(value.toString());
      }
      entries.put(entry.getKey(), synonyms);
    }
    return SynonymTable.of(entries);
  }
}
