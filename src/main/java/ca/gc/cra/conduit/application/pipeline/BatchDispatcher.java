package ca.gc.cra.conduit.application.pipeline;

import ca.gc.cra.conduit.application.metrics.MetricNames;
import ca.gc.cra.conduit.application.metrics.MetricsRecord;
import ca.gc.cra.conduit.application.port.BatchSerializer;
import ca.gc.cra.conduit.application.port.ClockPort;
import ca.gc.cra.conduit.application.port.PayloadCompressor;
import ca.gc.cra.conduit.application.port.SerializationException;
import ca.gc.cra.conduit.domain.event.Batch;
import ca.gc.cra.conduit.domain.sink.CompressionType;
import ca.gc.cra.conduit.domain.sink.SenderItem;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Turns closed batches into sender items: route, serialize, compress, enqueue.
 * <p><strong>Why:</strong> Failure handling differs per stage: an unrouted or unserializable batch is discarded
 * because retrying cannot help, while a compression failure only costs bandwidth, so the uncompressed payload is
 * sent instead.</p>
 * <p><strong>Role:</strong> Handler installed on the {@link Batcher}; runs under the batcher's per-key lock, which
 * keeps sender queue appends in per-key close order.</p>
 * <p><strong>Observability:</strong> Updates the {@code serializer} and {@code compressor} records; the
 * {@link Router} updates its own.</p>
 *
 * @since 0.1.0
 */
public final class BatchDispatcher implements Consumer<Batch> {
  private static final Logger log = LoggerFactory.getLogger(BatchDispatcher.class);
  private static final int FAILURE_LOG_INTERVAL = 100;

  private final Router router;
  private final BatchSerializer serializer;
  private final PayloadCompressor compressor;
  private final MetricsRecord serializerRecord;
  private final MetricsRecord compressorRecord;
  private final ClockPort clock;
  private final AtomicInteger serializeFailures = new AtomicInteger();
  private final AtomicInteger compressFailures = new AtomicInteger();

  /**
   * Creates a dispatcher.
   *
   * @param router route table
   * @param serializer batch encoder
   * @param compressor payload compressor; use the pass-through compressor for {@link CompressionType#NONE}
   * @param serializerRecord {@code serializer} metrics record
   * @param compressorRecord {@code compressor} metrics record
   * @param clock time source for item creation stamps
   */
  public BatchDispatcher(
      Router router,
      BatchSerializer serializer,
      PayloadCompressor compressor,
      MetricsRecord serializerRecord,
      MetricsRecord compressorRecord,
      ClockPort clock) {
    this.router = Objects.requireNonNull(router, "router");
    this.serializer = Objects.requireNonNull(serializer, "serializer");
    this.compressor = Objects.requireNonNull(compressor, "compressor");
    this.serializerRecord = Objects.requireNonNull(serializerRecord, "serializerRecord");
    this.compressorRecord = Objects.requireNonNull(compressorRecord, "compressorRecord");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public void accept(Batch batch) {
    Optional<Router.Route> route = router.route(batch);
    if (route.isEmpty()) {
      return;
    }
    Optional<SenderItem> item = toItem(batch);
    if (item.isEmpty()) {
      return;
    }
    // a full lane counts its own discard
    route.get().lane().push(item.get());
  }

  /**
   * Serializes and compresses a batch.
   *
   * @param batch closed batch
   * @return item ready for a sender queue, or empty when serialization failed
   */
  Optional<SenderItem> toItem(Batch batch) {
    serializerRecord.counter(MetricNames.IN_ITEMS_TOTAL).increment();
    serializerRecord.counter(MetricNames.IN_EVENTS_TOTAL).add(batch.eventCount());
    serializerRecord.counter(MetricNames.IN_SIZE_BYTES).add(batch.byteSize());
    byte[] raw;
    try {
      raw = serializer.serialize(batch);
    } catch (SerializationException ex) {
      serializerRecord.counter(MetricNames.DISCARDED_ITEMS_TOTAL).increment();
      serializerRecord.counter(MetricNames.DISCARDED_EVENTS_TOTAL).add(batch.eventCount());
      serializerRecord.counter(MetricNames.DISCARDED_SIZE_BYTES).add(batch.byteSize());
      int count = serializeFailures.incrementAndGet();
      if (count == 1 || count % FAILURE_LOG_INTERVAL == 0) {
        log.warn("Failed to serialize batch for {}; discarded {} events ({} failures so far)",
            batch.key(), batch.eventCount(), count, ex);
      }
      return Optional.empty();
    }
    serializerRecord.counter(MetricNames.OUT_ITEMS_TOTAL).increment();
    serializerRecord.counter(MetricNames.OUT_EVENTS_TOTAL).add(batch.eventCount());
    serializerRecord.counter(MetricNames.OUT_SIZE_BYTES).add(raw.length);

    compressorRecord.counter(MetricNames.IN_ITEMS_TOTAL).increment();
    compressorRecord.counter(MetricNames.IN_SIZE_BYTES).add(raw.length);
    byte[] payload = raw;
    CompressionType applied = compressor.type();
    if (applied != CompressionType.NONE) {
      try {
        payload = compressor.compress(raw);
      } catch (IOException | RuntimeException ex) {
        payload = raw;
        applied = CompressionType.NONE;
        compressorRecord.counter(MetricNames.COMPRESS_FAIL_TOTAL).increment();
        int count = compressFailures.incrementAndGet();
        if (count == 1 || count % FAILURE_LOG_INTERVAL == 0) {
          log.warn("Compression {} failed for {}; sending uncompressed ({} failures so far)",
              compressor.type(), batch.key(), count, ex);
        }
      }
    }
    compressorRecord.counter(MetricNames.OUT_ITEMS_TOTAL).increment();
    compressorRecord.counter(MetricNames.OUT_SIZE_BYTES).add(payload.length);

    return Optional.of(new SenderItem(
        batch.key(),
        payload,
        raw.length,
        serializer.format(),
        applied,
        batch.eventCount(),
        batch.groups().size(),
        clock.nowMillis()));
  }
}
