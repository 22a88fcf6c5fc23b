package tools.smith.sosumi.infrastructure.compression;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.zip.Deflater;
import org.junit.jupiter.api.Test;

class DeflateBlockCompressorTest {
  private final DeflateBlockCompressor compressor = new DeflateBlockCompressor();

  @Test
  void repetitiveEnvelopeShrinksAndInflatesBack() throws IOException {
    byte[] envelope = "{\"sessions\":[]} ".repeat(500).getBytes(StandardCharsets.UTF_8);

    byte[] compressed = compressor.compress(envelope);

    assertTrue(compressed.length < envelope.length / 10);
    assertEquals(0x78, compressed[0] & 0xFF);
    assertArrayEquals(envelope, compressor.decompress(compressed));
  }

  @Test
  void garbageIsRejected() {
    byte[] garbage = "definitely not deflate".getBytes(StandardCharsets.UTF_8);

    assertThrows(IOException.class, () -> compressor.decompress(garbage));
  }

  @Test
  void truncatedStreamIsRejected() throws IOException {
    byte[] compressed = compressor.compress("x".repeat(4096).getBytes(StandardCharsets.UTF_8));

    assertThrows(IOException.class, () -> compressor.decompress(Arrays.copyOf(compressed, compressed.length / 2)));
  }

  @Test
  void levelIsValidated() {
    assertThrows(IllegalArgumentException.class, () -> new DeflateBlockCompressor(Deflater.BEST_COMPRESSION + 1));
  }
}
