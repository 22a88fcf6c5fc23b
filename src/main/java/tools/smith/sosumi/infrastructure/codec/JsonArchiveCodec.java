package tools.smith.sosumi.infrastructure.codec;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import tools.smith.sosumi.application.port.ArchiveCodec;
import tools.smith.sosumi.domain.bundle.Archive;
import tools.smith.sosumi.domain.bundle.ArchiveMetadata;
import tools.smith.sosumi.domain.bundle.ContentProtection;
import tools.smith.sosumi.domain.bundle.SessionRecord;

/**
 * <strong>What:</strong> UTF-8 JSON codec for the archive envelope built on Jackson's streaming API.
 * <p><strong>Wire shape:</strong> {@code version}, {@code sessions}, {@code search_index}, {@code metadata}; each
 * session carries {@code hash}, {@code title}, {@code year}, {@code content}, {@code checksum}, {@code excerpt},
 * {@code web_url}. Unknown fields are ignored on read.</p>
 * <p><strong>Errors:</strong> decoding throws {@link IllegalArgumentException} for malformed JSON, a missing or
 * ill-typed mandatory field, or an unsupported version.</p>
 * <p><strong>Thread-safety:</strong> {@link JsonFactory} is thread-safe; instances may be shared.</p>
 *
 * @since 1.2.0
 */
public final class JsonArchiveCodec implements ArchiveCodec {
  private final JsonFactory factory = new JsonFactory();

  @Override
  public byte[] encode(Archive archive) throws IOException {
    Objects.requireNonNull(archive, "archive");
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (JsonGenerator gen = factory.createGenerator(out, JsonEncoding.UTF8)) {
      gen.writeStartObject();
      gen.writeNumberField("version", archive.formatVersion());
      gen.writeArrayFieldStart("sessions");
      for (SessionRecord record : archive.records()) {
        writeRecord(gen, record);
      }
      gen.writeEndArray();
      gen.writeObjectFieldStart("search_index");
      // sorted so identical archives encode to identical bytes
      Map<String, Set<String>> sorted = new TreeMap<>(archive.searchIndex());
      for (Map.Entry<String, Set<String>> entry : sorted.entrySet()) {
        gen.writeArrayFieldStart(entry.getKey());
        for (String id : new TreeSet<>(entry.getValue())) {
          gen.writeString(id);
        }
        gen.writeEndArray();
      }
      gen.writeEndObject();
      writeMetadata(gen, archive.metadata());
      gen.writeEndObject();
    }
    return out.toByteArray();
  }

  @Override
  public Archive decode(byte[] data) {
    Map<String, Object> root = parseObject(data);
    int version = requireInt(root, "version", "archive");
    if (version != Archive.FORMAT_VERSION) {
      throw new IllegalArgumentException("unsupported archive version " + version);
    }
    List<Object> sessions = requireList(root, "sessions", "archive");
    List<SessionRecord> records = new ArrayList<>(sessions.size());
    for (int i = 0; i < sessions.size(); i++) {
      records.add(toRecord(asObject(sessions.get(i), "sessions[" + i + "]")));
    }
    Map<String, Set<String>> index = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : requireObject(root, "search_index", "archive").entrySet()) {
      Set<String> ids = new LinkedHashSet<>();
      for (Object id : asList(entry.getValue(), "search_index." + entry.getKey())) {
        ids.add(asString(id, "search_index." + entry.getKey()));
      }
      index.put(entry.getKey(), ids);
    }
    ArchiveMetadata metadata = toMetadata(root.get("metadata"), records);
    return new Archive(version, records, index, metadata);
  }

  @Override
  public PlainCorpus decodeCorpus(byte[] data) {
    Object parsed = parse(data);
    List<Object> sessions;
    Map<String, List<String>> index = null;
    if (parsed instanceof List<?>) {
      sessions = asList(parsed, "corpus");
    } else {
      Map<String, Object> root = asObject(parsed, "corpus");
      sessions = requireList(root, "sessions", "corpus");
      Object rawIndex = root.get("search_index");
      if (rawIndex != null) {
        index = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : asObject(rawIndex, "search_index").entrySet()) {
          List<String> ids = new ArrayList<>();
          for (Object id : asList(entry.getValue(), "search_index." + entry.getKey())) {
            ids.add(asString(id, "search_index." + entry.getKey()));
          }
          index.put(entry.getKey(), ids);
        }
      }
    }
    List<Map<String, Object>> rows = new ArrayList<>(sessions.size());
    for (int i = 0; i < sessions.size(); i++) {
      rows.add(asObject(sessions.get(i), "sessions[" + i + "]"));
    }
    return new PlainCorpus(rows, index);
  }

  private static void writeRecord(JsonGenerator gen, SessionRecord record) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("hash", record.id());
    gen.writeStringField("title", record.title());
    gen.writeNumberField("year", record.year());
    gen.writeStringField("content", record.content());
    if (record.checksum() != null) {
      gen.writeStringField("checksum", record.checksum());
    }
    if (record.excerpt() != null) {
      gen.writeStringField("excerpt", record.excerpt());
    }
    if (record.webUrl() != null) {
      gen.writeStringField("web_url", record.webUrl());
    }
    gen.writeEndObject();
  }

  private static void writeMetadata(JsonGenerator gen, ArchiveMetadata metadata) throws IOException {
    gen.writeObjectFieldStart("metadata");
    gen.writeNumberField("total_sessions", metadata.totalSessions());
    gen.writeArrayFieldStart("years_range");
    gen.writeNumber(metadata.firstYear());
    gen.writeNumber(metadata.lastYear());
    gen.writeEndArray();
    if (metadata.createdAt() != null) {
      gen.writeStringField("created_at", metadata.createdAt());
    }
    gen.writeNumberField("obfuscation_version", metadata.obfuscationVersion());
    gen.writeStringField("content_protection", metadata.protection().wireName());
    gen.writeEndObject();
  }

  private static SessionRecord toRecord(Map<String, Object> row) {
    String where = "session";
    String id = requireString(row, "hash", where);
    where = "session " + id;
    return new SessionRecord(
        id,
        requireString(row, "title", where),
        requireInt(row, "year", where),
        requireString(row, "content", where),
        optionalString(row, "checksum", where),
        optionalString(row, "excerpt", where),
        optionalString(row, "web_url", where));
  }

  private static ArchiveMetadata toMetadata(Object raw, List<SessionRecord> records) {
    int first = records.stream().mapToInt(SessionRecord::year).min().orElse(0);
    int last = records.stream().mapToInt(SessionRecord::year).max().orElse(0);
    if (raw == null) {
      return new ArchiveMetadata(records.size(), first, last, null, 1, ContentProtection.SEALED);
    }
    Map<String, Object> meta = asObject(raw, "metadata");
    int total = meta.containsKey("total_sessions") ? requireInt(meta, "total_sessions", "metadata") : records.size();
    Object range = meta.get("years_range");
    if (range != null) {
      List<Object> bounds = asList(range, "metadata.years_range");
      if (bounds.size() == 2) {
        first = asInt(bounds.get(0), "metadata.years_range");
        last = asInt(bounds.get(1), "metadata.years_range");
      }
    }
    int obfuscation =
        meta.containsKey("obfuscation_version") ? requireInt(meta, "obfuscation_version", "metadata") : 1;
    ContentProtection protection;
    try {
      protection = ContentProtection.fromWire(optionalString(meta, "content_protection", "metadata"));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("metadata: " + ex.getMessage(), ex);
    }
    return new ArchiveMetadata(
        total, first, last, optionalString(meta, "created_at", "metadata"), obfuscation, protection);
  }

  private Map<String, Object> parseObject(byte[] data) {
    return asObject(parse(data), "archive");
  }

  private Object parse(byte[] data) {
    Objects.requireNonNull(data, "data");
    try (JsonParser parser = factory.createParser(data)) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        throw new IllegalArgumentException("empty document");
      }
      Object value = readValue(parser, token);
      JsonToken trailing = parser.nextToken();
      if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
        throw new IllegalArgumentException("JSON document contains trailing content");
      }
      return value;
    } catch (IOException ex) {
      throw new IllegalArgumentException("invalid JSON: " + ex.getMessage(), ex);
    }
  }

  private static Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IllegalArgumentException("Unsupported JSON token: " + token);
    };
  }

  private static Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        break;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new IllegalArgumentException("Expected field name but found " + token);
      }
      String fieldName = parser.currentName();
      map.put(fieldName, readValue(parser, parser.nextToken()));
    }
    return map;
  }

  private static List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        break;
      }
      list.add(readValue(parser, token));
    }
    return list;
  }

  private static String requireString(Map<String, Object> map, String key, String where) {
    if (!map.containsKey(key) || map.get(key) == null) {
      throw new IllegalArgumentException(where + ": missing field '" + key + "'");
    }
    return asString(map.get(key), where + "." + key);
  }

  private static String optionalString(Map<String, Object> map, String key, String where) {
    Object value = map.get(key);
    return value == null ? null : asString(value, where + "." + key);
  }

  private static int requireInt(Map<String, Object> map, String key, String where) {
    if (!map.containsKey(key) || map.get(key) == null) {
      throw new IllegalArgumentException(where + ": missing field '" + key + "'");
    }
    return asInt(map.get(key), where + "." + key);
  }

  private static List<Object> requireList(Map<String, Object> map, String key, String where) {
    if (!map.containsKey(key) || map.get(key) == null) {
      throw new IllegalArgumentException(where + ": missing field '" + key + "'");
    }
    return asList(map.get(key), where + "." + key);
  }

  private static String asString(Object value, String where) {
    if (value instanceof String s) {
      return s;
    }
    throw new IllegalArgumentException(where + ": expected string but found " + describe(value));
  }

  private static int asInt(Object value, String where) {
    if (value instanceof Integer || value instanceof Long || value instanceof Short) {
      long v = ((Number) value).longValue();
      if (v >= Integer.MIN_VALUE && v <= Integer.MAX_VALUE) {
        return (int) v;
      }
    }
    if (value instanceof BigInteger || value instanceof BigDecimal || value instanceof Double) {
      throw new IllegalArgumentException(where + ": expected integer but found " + value);
    }
    throw new IllegalArgumentException(where + ": expected integer but found " + describe(value));
  }

  private static Map<String, Object> requireObject(Map<String, Object> map, String key, String where) {
    if (!map.containsKey(key) || map.get(key) == null) {
      throw new IllegalArgumentException(where + ": missing field '" + key + "'");
    }
    return asObject(map.get(key), where + "." + key);
  }

  private static Map<String, Object> asObject(Object value, String where) {
    if (!(value instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(where + ": expected object but found " + describe(value));
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(where + ": contains a non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static List<Object> asList(Object value, String where) {
    if (!(value instanceof List<?> raw)) {
      throw new IllegalArgumentException(where + ": expected array but found " + describe(value));
    }
    return new ArrayList<>(raw);
  }

  private static String describe(Object value) {
    return value == null ? "null" : value.getClass().getSimpleName();
  }
}
