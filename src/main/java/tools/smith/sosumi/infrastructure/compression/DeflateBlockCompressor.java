package tools.smith.sosumi.infrastructure.compression;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.zip.Deflater;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.InflaterInputStream;
import java.util.zip.ZipException;
import tools.smith.sosumi.application.port.BlockCompressor;

/**
 * DEFLATE (zlib stream) block compressor at best compression.
 * <p>Decompression rejects truncated streams and input that is not zlib framed.</p>
 *
 * @since 1.2.0
 */
public final class DeflateBlockCompressor implements BlockCompressor {
  private static final int BUFFER_SIZE = 16 * 1024;

  private final int level;

  /** Creates a compressor at {@link Deflater#BEST_COMPRESSION}. */
  public DeflateBlockCompressor() {
    this(Deflater.BEST_COMPRESSION);
  }

  DeflateBlockCompressor(int level) {
    if (level < Deflater.DEFAULT_COMPRESSION || level > Deflater.BEST_COMPRESSION) {
      throw new IllegalArgumentException("level must be between -1 and 9");
    }
    this.level = level;
  }

  @Override
  public byte[] compress(byte[] data) throws IOException {
    Objects.requireNonNull(data, "data");
    Deflater deflater = new Deflater(level);
    ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, data.length / 4));
    try (DeflaterOutputStream deflate = new DeflaterOutputStream(out, deflater, BUFFER_SIZE)) {
      deflate.write(data);
    } finally {
      deflater.end();
    }
    return out.toByteArray();
  }

  @Override
  public byte[] decompress(byte[] data) throws IOException {
    Objects.requireNonNull(data, "data");
    ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, data.length * 4));
    try (InputStream in = new InflaterInputStream(new ByteArrayInputStream(data))) {
      in.transferTo(out);
    } catch (EOFException ex) {
      throw new ZipException("Truncated DEFLATE stream");
    }
    return out.toByteArray();
  }
}
