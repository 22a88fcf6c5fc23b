package tools.smith.sosumi.infrastructure.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import tools.smith.sosumi.application.port.ArchiveCodec.PlainCorpus;
import tools.smith.sosumi.domain.bundle.Archive;
import tools.smith.sosumi.domain.bundle.ArchiveMetadata;
import tools.smith.sosumi.domain.bundle.ContentProtection;
import tools.smith.sosumi.domain.bundle.SessionRecord;

class JsonArchiveCodecTest {
  private final JsonArchiveCodec codec = new JsonArchiveCodec();

  @Test
  void encodedArchiveDecodesToSameRecords() throws IOException {
    SessionRecord record = new SessionRecord(
        "wwdc2024-10102", "Mεεt SwιftUΙ", 2024, "c2VhbGVk", "abc123", "Preview", "https://example.com/s");
    ArchiveMetadata metadata =
        new ArchiveMetadata(1, 2024, 2024, "2025-06-09T17:00:00Z", 1, ContentProtection.SEALED);
    Archive archive = new Archive(1, List.of(record), Map.of("swiftui", Set.of("wwdc2024-10102")), metadata);

    Archive decoded = codec.decode(codec.encode(archive));

    assertEquals(List.of(record), decoded.records());
    assertEquals(Set.of("wwdc2024-10102"), decoded.searchIndex().get("swiftui"));
    assertEquals(metadata, decoded.metadata());
  }

  @Test
  void encodingUsesWireFieldNamesInFixedOrder() throws IOException {
    SessionRecord record = new SessionRecord("a", "T", 2020, "c", null, null, null);
    Archive archive = new Archive(1, List.of(record), Map.of(), ArchiveMetadata.empty());

    String json = new String(codec.encode(archive), StandardCharsets.UTF_8);

    assertTrue(json.startsWith("{\"version\":1,\"sessions\":[{\"hash\":\"a\",\"title\":\"T\",\"year\":2020"));
    assertTrue(json.contains("\"content_protection\":\"sealed\""));
    assertTrue(json.indexOf("\"sessions\"") < json.indexOf("\"search_index\""));
    assertTrue(json.indexOf("\"search_index\"") < json.indexOf("\"metadata\""));
  }

  @Test
  void unknownFieldsAreIgnored() {
    String json = """
        {"version": 1, "producer": "legacy", "sessions": [
          {"hash": "a", "title": "T", "year": 2021, "content": "x", "speaker": "Someone"}
        ], "search_index": {}}
        """;

    Archive archive = codec.decode(bytes(json));

    assertEquals("a", archive.records().get(0).id());
    assertNull(archive.records().get(0).checksum());
    assertEquals(ContentProtection.SEALED, archive.metadata().protection());
    assertEquals(2021, archive.metadata().firstYear());
  }

  @Test
  void missingRequiredFieldIsRejected() {
    String json = "{\"version\": 1, \"sessions\": [{\"hash\": \"a\", \"year\": 2021, \"content\": \"x\"}]}";

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> codec.decode(bytes(json)));

    assertTrue(ex.getMessage().contains("title"));

    String noIndex = """
        {"version": 1, "sessions": [{"hash": "a", "title": "T", "year": 2021, "content": "x"}],
         "metadata": {"total_sessions": 1}}
        """;
    IllegalArgumentException missingIndex =
        assertThrows(IllegalArgumentException.class, () -> codec.decode(bytes(noIndex)));
    assertTrue(missingIndex.getMessage().contains("search_index"));

    String listIndex = "{\"version\": 1, \"sessions\": [], \"search_index\": []}";
    assertThrows(IllegalArgumentException.class, () -> codec.decode(bytes(listIndex)));
  }

  @Test
  void wrongTypeIsRejected() {
    String json = "{\"version\": 1, \"sessions\": [{\"hash\": \"a\", \"title\": \"T\", \"year\": \"2021\", "
        + "\"content\": \"x\"}]}";

    assertThrows(IllegalArgumentException.class, () -> codec.decode(bytes(json)));
  }

  @Test
  void unsupportedVersionIsRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> codec.decode(bytes("{\"version\": 2, \"sessions\": []}")));

    assertTrue(ex.getMessage().contains("version"));
  }

  @Test
  void danglingIndexEntryIsRejected() {
    String json = "{\"version\": 1, \"sessions\": [], \"search_index\": {\"swift\": [\"ghost\"]}}";

    assertThrows(IllegalArgumentException.class, () -> codec.decode(bytes(json)));
  }

  @Test
  void brokenJsonIsRejected() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> codec.decode(bytes("{\"version\": 1,")));

    assertTrue(ex.getMessage().startsWith("invalid JSON"));
  }

  @Test
  void plainMetadataIsRead() {
    String json = """
        {"version": 1, "sessions": [], "search_index": {},
         "metadata": {"total_sessions": 0, "years_range": [2019, 2024],
         "obfuscation_version": 1, "content_protection": "plain"}}
        """;

    ArchiveMetadata metadata = codec.decode(bytes(json)).metadata();

    assertEquals(ContentProtection.PLAIN, metadata.protection());
    assertEquals(2019, metadata.firstYear());
    assertEquals(2024, metadata.lastYear());
  }

  @Test
  void corpusAcceptsObjectOrBareArray() {
    PlainCorpus wrapped = codec.decodeCorpus(bytes(
        "{\"sessions\": [{\"hash\": \"a\"}], \"search_index\": {\"Swift\": [\"a\"]}}"));
    PlainCorpus bare = codec.decodeCorpus(bytes("[{\"id\": \"b\"}]"));

    assertEquals("a", wrapped.sessions().get(0).get("hash"));
    assertEquals(List.of("a"), wrapped.searchIndex().get("Swift"));
    assertEquals("b", bare.sessions().get(0).get("id"));
    assertNull(bare.searchIndex());
  }

  private static byte[] bytes(String json) {
    return json.getBytes(StandardCharsets.UTF_8);
  }
}
