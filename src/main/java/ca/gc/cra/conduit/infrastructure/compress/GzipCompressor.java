package ca.gc.cra.conduit.infrastructure.compress;

import ca.gc.cra.conduit.application.port.PayloadCompressor;
import ca.gc.cra.conduit.domain.sink.CompressionType;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Objects;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * <strong>What:</strong> GZIP codec backed by {@link java.util.zip}.
 * <p><strong>Thread-safety:</strong> Stateless; streams are created per call.</p>
 *
 * @since 0.1.0
 */
public final class GzipCompressor implements PayloadCompressor {
  static final GzipCompressor INSTANCE = new GzipCompressor();

  @Override
  public CompressionType type() {
    return CompressionType.GZIP;
  }

  @Override
  public byte[] compress(byte[] raw) throws IOException {
    Objects.requireNonNull(raw, "raw");
    ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, raw.length / 4));
    try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
      gzip.write(raw);
    }
    return out.toByteArray();
  }

  @Override
  public byte[] decompress(byte[] compressed) throws IOException {
    Objects.requireNonNull(compressed, "compressed");
    try (GZIPInputStream in = new GZIPInputStream(new ByteArrayInputStream(compressed));
         ByteArrayOutputStream out = new ByteArrayOutputStream(compressed.length * 4)) {
      in.transferTo(out);
      return out.toByteArray();
    }
  }
}
