package tools.smith.sosumi.domain.bundle;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ArchiveTest {
  private static final ArchiveMetadata METADATA = ArchiveMetadata.empty();

  @Test
  void rejectsDuplicateIds() {
    List<SessionRecord> records = List.of(record("a", 2023), record("a", 2024));

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> new Archive(Archive.FORMAT_VERSION, records, Map.of(), METADATA));

    assertTrue(ex.getMessage().contains("duplicate"));
  }

  @Test
  void rejectsIndexPointingAtUnknownRecord() {
    List<SessionRecord> records = List.of(record("a", 2023));

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> new Archive(Archive.FORMAT_VERSION, records, Map.of("swift", Set.of("ghost")), METADATA));

    assertTrue(ex.getMessage().contains("ghost"));
  }

  @Test
  void rejectsUnknownVersion() {
    assertThrows(IllegalArgumentException.class, () -> new Archive(2, List.of(), Map.of(), METADATA));
  }

  @Test
  void findsRecordsAndYearBounds() {
    Archive archive = new Archive(
        Archive.FORMAT_VERSION, List.of(record("a", 2021), record("b", 2024)), Map.of(), METADATA);

    assertEquals("b", archive.find("b").orElseThrow().id());
    assertTrue(archive.find("zzz").isEmpty());
    assertTrue(archive.find(null).isEmpty());
    assertEquals(2024, archive.latestYear().getAsInt());
    assertEquals(2021, archive.earliestYear().getAsInt());
  }

  private static SessionRecord record(String id, int year) {
    return new SessionRecord(id, "Title " + id, year, "content", null, null, null);
  }
}
