package ca.gc.cra.conduit.domain.sink;

import ca.gc.cra.conduit.domain.queue.QueueElement;
import ca.gc.cra.conduit.domain.queue.QueueKey;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * <strong>What:</strong> Serialized, optionally compressed batch ready for delivery.
 * <p><strong>Why:</strong> Keeps the original event/byte counts with the payload so discards and successes are
 * reported in event terms, and carries the retry counters the flusher runner consults.</p>
 * <p><strong>Role:</strong> Element of the sender queue.</p>
 * <p><strong>Thread-safety:</strong> Payload and metadata are immutable; attempt counters are atomic because a
 * retry timer and a worker may touch the item on different threads.</p>
 *
 * @since 0.1.0
 */
public final class SenderItem implements QueueElement {
  private final QueueKey key;
  private final byte[] payload;
  private final long rawSize;
  private final PayloadFormat format;
  private final CompressionType compression;
  private final int eventCount;
  private final int groupCount;
  private final long createdAtMillis;
  private final AtomicInteger sendAttempts = new AtomicInteger();
  private final AtomicInteger retries = new AtomicInteger();
  private final AtomicInteger otherErrorRetries = new AtomicInteger();

  /**
   * Creates an item. The payload array is owned by the item from now on.
   *
   * @param key destination stream
   * @param payload encoded bytes as they go on the wire
   * @param rawSize serialized size before compression
   * @param format serialization format of the payload
   * @param compression compression applied to the payload
   * @param eventCount number of events encoded
   * @param groupCount number of event groups encoded
   * @param createdAtMillis creation time used for delay metrics
   */
  public SenderItem(
      QueueKey key,
      byte[] payload,
      long rawSize,
      PayloadFormat format,
      CompressionType compression,
      int eventCount,
      int groupCount,
      long createdAtMillis) {
    this.key = Objects.requireNonNull(key, "key");
    this.payload = Objects.requireNonNull(payload, "payload");
    this.format = Objects.requireNonNull(format, "format");
    this.compression = Objects.requireNonNull(compression, "compression");
    if (rawSize < 0 || eventCount < 0 || groupCount < 0) {
      throw new IllegalArgumentException("sizes and counts must not be negative");
    }
    this.rawSize = rawSize;
    this.eventCount = eventCount;
    this.groupCount = groupCount;
    this.createdAtMillis = createdAtMillis;
  }

  public QueueKey key() {
    return key;
  }

  /**
   * Returns the wire payload. Callers must not modify the array.
   *
   * @return payload bytes
   */
  public byte[] payload() {
    return payload;
  }

  public long rawSize() {
    return rawSize;
  }

  public PayloadFormat format() {
    return format;
  }

  public CompressionType compression() {
    return compression;
  }

  public int groupCount() {
    return groupCount;
  }

  public long createdAtMillis() {
    return createdAtMillis;
  }

  @Override
  public long byteSize() {
    return payload.length;
  }

  @Override
  public int eventCount() {
    return eventCount;
  }

  /** Records that a delivery attempt is about to start and returns the attempt number (1-based). */
  public int beginAttempt() {
    return sendAttempts.incrementAndGet();
  }

  public int sendAttempts() {
    return sendAttempts.get();
  }

  /** Records a scheduled retry and returns the retry number (1-based). */
  public int recordRetry() {
    return retries.incrementAndGet();
  }

  public int retries() {
    return retries.get();
  }

  /** Records a retry granted to an unclassified error and returns how many were granted so far. */
  public int recordOtherErrorRetry() {
    return otherErrorRetries.incrementAndGet();
  }

  public int otherErrorRetries() {
    return otherErrorRetries.get();
  }

  @Override
  public String toString() {
    return "SenderItem{key=" + key + ", bytes=" + payload.length + ", events=" + eventCount
        + ", attempts=" + sendAttempts.get() + "}";
  }
}
