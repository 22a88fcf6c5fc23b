package tools.smith.sosumi.domain.bundle;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * <strong>What:</strong> The distributed bundle: versioned envelope of session records and a precomputed inverted
 * index.
 * <p><strong>Invariants:</strong> record ids are unique and every id referenced by {@link #searchIndex()} exists in
 * {@link #records()}.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction; collections are defensively copied.</p>
 *
 * @param formatVersion envelope version; always {@link #FORMAT_VERSION}
 * @param records session records in envelope order (order carries no meaning)
 * @param searchIndex normalized term to record ids
 * @param metadata informational metadata
 * @since 1.2.0
 */
public record Archive(
    int formatVersion,
    List<SessionRecord> records,
    Map<String, Set<String>> searchIndex,
    ArchiveMetadata metadata) {

  /** The single supported envelope version. */
  public static final int FORMAT_VERSION = 1;

  public Archive {
    if (formatVersion != FORMAT_VERSION) {
      throw new IllegalArgumentException("unsupported archive version " + formatVersion);
    }
    records = List.copyOf(Objects.requireNonNull(records, "records"));
    Objects.requireNonNull(searchIndex, "searchIndex");
    Objects.requireNonNull(metadata, "metadata");
    Map<String, Set<String>> index = new LinkedHashMap<>();
    searchIndex.forEach((term, ids) -> index.put(term, Set.copyOf(ids)));
    searchIndex = Collections.unmodifiableMap(index);

    Map<String, SessionRecord> seen = new HashMap<>();
    for (SessionRecord record : records) {
      if (seen.put(record.id(), record) != null) {
        throw new IllegalArgumentException("duplicate record id " + record.id());
      }
    }
    for (Map.Entry<String, Set<String>> entry : searchIndex.entrySet()) {
      for (String id : entry.getValue()) {
        if (!seen.containsKey(id)) {
          throw new IllegalArgumentException(
              "search index term '" + entry.getKey() + "' references unknown record " + id);
        }
      }
    }
  }

  /**
   * Finds a record by identifier.
   *
   * @param id record identifier
   * @return matching record, if any
   */
  public Optional<SessionRecord> find(String id) {
    if (id == null) {
      return Optional.empty();
    }
    for (SessionRecord record : records) {
      if (record.id().equals(id)) {
        return Optional.of(record);
      }
    }
    return Optional.empty();
  }

  /**
   * Returns the most recent session year present in the records, independent of metadata.
   *
   * @return latest year or empty for an archive without records
   */
  public OptionalInt latestYear() {
    return records.stream().mapToInt(SessionRecord::year).max();
  }

  /**
   * Returns the earliest session year present in the records.
   *
   * @return earliest year or empty for an archive without records
   */
  public OptionalInt earliestYear() {
    return records.stream().mapToInt(SessionRecord::year).min();
  }
}
