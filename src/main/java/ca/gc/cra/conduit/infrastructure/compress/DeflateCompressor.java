package ca.gc.cra.conduit.infrastructure.compress;

import ca.gc.cra.conduit.application.port.PayloadCompressor;
import ca.gc.cra.conduit.domain.sink.CompressionType;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Objects;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.InflaterInputStream;

/**
 * <strong>What:</strong> zlib-wrapped DEFLATE codec backed by {@link java.util.zip}.
 * <p><strong>Thread-safety:</strong> Stateless; streams are created per call.</p>
 *
 * @since 0.1.0
 */
public final class DeflateCompressor implements PayloadCompressor {
  static final DeflateCompressor INSTANCE = new DeflateCompressor();

  @Override
  public CompressionType type() {
    return CompressionType.DEFLATE;
  }

  @Override
  public byte[] compress(byte[] raw) throws IOException {
    Objects.requireNonNull(raw, "raw");
    ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, raw.length / 4));
    try (DeflaterOutputStream deflater = new DeflaterOutputStream(out)) {
      deflater.write(raw);
    }
    return out.toByteArray();
  }

  @Override
  public byte[] decompress(byte[] compressed) throws IOException {
    Objects.requireNonNull(compressed, "compressed");
    try (InflaterInputStream in = new InflaterInputStream(new ByteArrayInputStream(compressed));
         ByteArrayOutputStream out = new ByteArrayOutputStream(compressed.length * 4)) {
      in.transferTo(out);
      return out.toByteArray();
    }
  }
}
