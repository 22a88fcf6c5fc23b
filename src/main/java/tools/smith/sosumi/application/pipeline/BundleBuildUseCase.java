package tools.smith.sosumi.application.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.smith.sosumi.application.port.ArchiveCodec;
import tools.smith.sosumi.application.port.ArchiveCodec.PlainCorpus;
import tools.smith.sosumi.application.port.BlockCompressor;
import tools.smith.sosumi.application.port.ClockPort;
import tools.smith.sosumi.application.port.ContentCipher;
import tools.smith.sosumi.application.search.SearchIndexBuilder;
import tools.smith.sosumi.domain.bundle.Archive;
import tools.smith.sosumi.domain.bundle.ArchiveMetadata;
import tools.smith.sosumi.domain.bundle.ContentChecksums;
import tools.smith.sosumi.domain.bundle.ContentProtection;
import tools.smith.sosumi.domain.bundle.PlainSession;
import tools.smith.sosumi.domain.bundle.SessionRecord;
import tools.smith.sosumi.domain.text.TitleObfuscator;
import tools.smith.sosumi.infrastructure.persistence.BundleFiles;

/**
 * <strong>What:</strong> Offline pipeline that turns a plaintext session corpus into a bundle artifact.
 * <p><strong>Per record:</strong> obfuscate the title, seal the transcript, and record the plaintext checksum.</p>
 * <p><strong>Per archive:</strong> prune or generate the search index, stamp metadata, serialize, compress, and write
 * atomically.</p>
 * <p><strong>Failures:</strong> incomplete or duplicate sessions are skipped with a warning; a sealing failure aborts
 * the whole build and nothing is written.</p>
 * <p>In plain mode the artifact is the uncompressed envelope with transcripts in clear; no key is needed.</p>
 *
 * @since 1.2.0
 */
public final class BundleBuildUseCase {
  private static final Logger log = LoggerFactory.getLogger(BundleBuildUseCase.class);

  private final ArchiveCodec codec;
  private final BlockCompressor compressor;
  private final ClockPort clock;

  /**
   * Creates the use case.
   *
   * @param codec envelope codec
   * @param compressor block compressor
   * @param clock clock used for the build timestamp
   */
  public BundleBuildUseCase(ArchiveCodec codec, BlockCompressor compressor, ClockPort clock) {
    this.codec = Objects.requireNonNull(codec, "codec");
    this.compressor = Objects.requireNonNull(compressor, "compressor");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Builds a bundle from a plaintext corpus file.
   *
   * @param input JSON corpus ({@code {"sessions": [...], "search_index": {...}}} or a bare session array)
   * @param output artifact path
   * @param cipher content cipher; required unless {@code plain}
   * @param plain write the uncompressed development database instead of a sealed bundle
   * @return size report
   * @throws IOException if the input cannot be read or the artifact cannot be written
   * @throws BundleBuildException if the input is malformed or a transcript cannot be sealed
   */
  public BuildReport build(Path input, Path output, Optional<ContentCipher> cipher, boolean plain)
      throws IOException, BundleBuildException {
    Objects.requireNonNull(input, "input");
    Objects.requireNonNull(output, "output");
    Objects.requireNonNull(cipher, "cipher");
    if (!plain && cipher.isEmpty()) {
      throw new IllegalArgumentException("An encryption key is required to build a sealed bundle");
    }
    PlainCorpus corpus;
    try {
      corpus = codec.decodeCorpus(Files.readAllBytes(input));
    } catch (IllegalArgumentException ex) {
      throw new BundleBuildException("Input corpus " + input + " is malformed: " + ex.getMessage(), ex);
    }
    List<PlainSession> sessions = new ArrayList<>();
    Set<String> ids = new LinkedHashSet<>();
    int skipped = 0;
    for (Map<String, Object> row : corpus.sessions()) {
      Optional<PlainSession> session = toSession(row);
      if (session.isEmpty()) {
        skipped++;
        continue;
      }
      if (!ids.add(session.get().id())) {
        log.warn("Skipping duplicate session {}", session.get().id());
        skipped++;
        continue;
      }
      sessions.add(session.get());
    }
    ContentProtection protection = plain ? ContentProtection.PLAIN : ContentProtection.SEALED;
    Archive archive = assemble(sessions, corpus.searchIndex(), cipher, protection);

    byte[] envelope = codec.encode(archive);
    byte[] artifact = plain ? envelope : compressor.compress(envelope);
    BundleFiles.writeAtomically(output, artifact);
    BuildReport report = new BuildReport(
        output,
        archive.records().size(),
        skipped,
        archive.searchIndex().size(),
        envelope.length,
        artifact.length,
        protection);
    log.info("Wrote {} sessions ({} skipped) to {}", report.recordCount(), skipped, output);
    return report;
  }

  Archive assemble(
      List<PlainSession> sessions,
      Map<String, List<String>> suppliedIndex,
      Optional<ContentCipher> cipher,
      ContentProtection protection) throws BundleBuildException {
    List<SessionRecord> records = new ArrayList<>(sessions.size());
    for (PlainSession session : sessions) {
      String content = session.content();
      if (protection == ContentProtection.SEALED) {
        try {
          content = cipher.orElseThrow().seal(session.content());
        } catch (GeneralSecurityException ex) {
          throw new BundleBuildException("Failed to seal session " + session.id(), ex);
        }
      }
      records.add(new SessionRecord(
          session.id(),
          TitleObfuscator.obfuscate(session.title()),
          session.year(),
          content,
          ContentChecksums.sha256Hex(session.content()),
          session.excerpt(),
          session.webUrl()));
    }
    Set<String> ids = new LinkedHashSet<>();
    records.forEach(record -> ids.add(record.id()));
    Map<String, Set<String>> index = suppliedIndex == null
        ? SearchIndexBuilder.fromTokens(sessions)
        : SearchIndexBuilder.prune(suppliedIndex, ids);
    int first = sessions.stream().mapToInt(PlainSession::year).min().orElse(0);
    int last = sessions.stream().mapToInt(PlainSession::year).max().orElse(0);
    ArchiveMetadata metadata = new ArchiveMetadata(
        records.size(), first, last, clock.now().toString(), TitleObfuscator.TABLE_VERSION, protection);
    return new Archive(Archive.FORMAT_VERSION, records, index, metadata);
  }

  static Optional<PlainSession> toSession(Map<String, Object> row) {
    Object id = row.get("hash") != null ? row.get("hash") : row.get("id");
    Object title = row.get("title");
    Object year = row.get("year");
    Object content = row.get("content");
    if (!(id instanceof String idText) || idText.isBlank()
        || !(title instanceof String titleText)
        || !(content instanceof String contentText)) {
      log.warn("Skipping incomplete session {}", id instanceof String ? id : "<no id>");
      return Optional.empty();
    }
    Optional<Integer> yearValue = wholeYear(year);
    if (yearValue.isEmpty()) {
      log.warn("Skipping session {} with invalid year {}", idText.trim(), year);
      return Optional.empty();
    }
    return Optional.of(new PlainSession(
        idText.trim(),
        titleText,
        yearValue.get(),
        contentText,
        row.get("excerpt") instanceof String excerpt ? excerpt : null,
        row.get("web_url") instanceof String url ? url : null));
  }

  // Only integral JSON numbers that fit an int; 2021.7 or 1e20 are rejected rather than truncated.
  private static Optional<Integer> wholeYear(Object year) {
    if (year instanceof Integer value) {
      return Optional.of(value);
    }
    if (year instanceof Long value && value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
      return Optional.of(value.intValue());
    }
    return Optional.empty();
  }
}
