package ca.gc.cra.conduit.infrastructure.compress;

import ca.gc.cra.conduit.application.port.PayloadCompressor;
import ca.gc.cra.conduit.domain.sink.CompressionType;
import java.util.Objects;

/** Pass-through codec; returns its input unchanged. */
public final class NoneCompressor implements PayloadCompressor {
  static final NoneCompressor INSTANCE = new NoneCompressor();

  @Override
  public CompressionType type() {
    return CompressionType.NONE;
  }

  @Override
  public byte[] compress(byte[] raw) {
    return Objects.requireNonNull(raw, "raw");
  }

  @Override
  public byte[] decompress(byte[] compressed) {
    return Objects.requireNonNull(compressed, "compressed");
  }
}
