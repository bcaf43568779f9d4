package ca.gc.cra.conduit.infrastructure.compress;

import ca.gc.cra.conduit.application.port.PayloadCompressor;
import ca.gc.cra.conduit.domain.sink.CompressionType;
import java.util.Objects;

/** Resolves the shared codec instance for a {@link CompressionType}. */
public final class Compressors {
  private Compressors() {
    // Utility class
  }

  /**
   * Returns the codec for {@code type}.
   *
   * @param type compression type
   * @return stateless compressor
   */
  public static PayloadCompressor forType(CompressionType type) {
    return switch (Objects.requireNonNull(type, "type")) {
      case NONE -> NoneCompressor.INSTANCE;
      case GZIP -> GzipCompressor.INSTANCE;
      case DEFLATE -> DeflateCompressor.INSTANCE;
    };
  }
}
