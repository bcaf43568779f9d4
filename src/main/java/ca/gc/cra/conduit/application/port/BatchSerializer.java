package ca.gc.cra.conduit.application.port;

import ca.gc.cra.conduit.domain.event.Batch;
import ca.gc.cra.conduit.domain.event.EventGroup;
import ca.gc.cra.conduit.domain.sink.PayloadFormat;
import java.util.List;

/**
 * <strong>What:</strong> Port encoding a closed {@link Batch} into bytes.
 * <p><strong>Role:</strong> Serializer stage between the router and the compressor.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be stateless or thread-safe; the dispatcher calls them
 * from the process runner and the batch sweep timer.</p>
 *
 * @since 0.1.0
 */
public interface BatchSerializer {
  /**
   * Returns the format this serializer produces.
   *
   * @return payload format
   */
  PayloadFormat format();

  /**
   * Encodes a batch.
   *
   * @param batch closed batch
   * @return encoded bytes
   * @throws SerializationException when the batch cannot be encoded or exceeds the payload limit
   */
  byte[] serialize(Batch batch) throws SerializationException;

  /**
   * Decodes bytes produced by {@link #serialize(Batch)} back into event groups.
   *
   * @param payload uncompressed payload
   * @return event groups in their original order
   * @throws SerializationException when the payload is malformed
   */
  List<EventGroup> deserialize(byte[] payload) throws SerializationException;
}
