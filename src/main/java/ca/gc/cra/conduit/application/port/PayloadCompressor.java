package ca.gc.cra.conduit.application.port;

import ca.gc.cra.conduit.domain.sink.CompressionType;
import java.io.IOException;

/**
 * Port compressing serialized payloads.
 * <p>Implementations are stateless and safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public interface PayloadCompressor {
  /**
   * Returns the compression this implementation applies.
   *
   * @return compression type
   */
  CompressionType type();

  /**
   * Compresses a payload.
   *
   * @param raw serialized bytes
   * @return compressed bytes
   * @throws IOException when the codec fails
   */
  byte[] compress(byte[] raw) throws IOException;

  /**
   * Reverses {@link #compress(byte[])}.
   *
   * @param compressed compressed bytes
   * @return original bytes
   * @throws IOException when the input is not valid for this codec
   */
  byte[] decompress(byte[] compressed) throws IOException;
}
