package ca.gc.cra.conduit.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.conduit.application.limiter.RateLimiterScope;
import ca.gc.cra.conduit.application.queue.OverflowPolicy;
import ca.gc.cra.conduit.domain.queue.QueueKey;
import ca.gc.cra.conduit.domain.sink.CompressionType;
import ca.gc.cra.conduit.domain.sink.PayloadFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class PipelineConfigTest {

  @Test
  void defaultsApplyWhenOnlyNameIsGiven() {
    PipelineConfig config = PipelineConfig.fromMap(Map.of("pipeline.name", "agent"));

    assertEquals("agent", config.name());
    assertEquals(PipelineConfig.DEFAULT_PROCESS_CAPACITY, config.processQueue().capacity());
    assertEquals(PipelineConfig.DEFAULT_PROCESS_CAPACITY, config.processQueue().highWatermark());
    assertEquals(OverflowPolicy.DISCARD, config.processQueue().overflowPolicy());
    assertEquals(10, config.senderQueue().highWatermark());
    assertEquals(PipelineConfig.DEFAULT_BATCH_MAX_BYTES, config.batch().maxBytes());
    assertEquals(PipelineConfig.DEFAULT_SWEEP_INTERVAL_MILLIS, config.batch().sweepIntervalMillis());
    assertEquals(PayloadFormat.JSON, config.format());
    assertEquals(CompressionType.GZIP, config.compression());
    assertEquals(PipelineConfig.DEFAULT_CONCURRENCY, config.flusher().concurrency());
    assertTrue(config.rateLimits().quotas().isEmpty());
    assertEquals(DestinationType.LOG, config.destination().type());
    assertEquals("agent-log", config.destination().id());
    assertEquals(PipelineConfig.DEFAULT_KAFKA_TOPIC, config.destination().kafkaTopic());
    assertTrue(config.destination().routes().isEmpty());
  }

  @Test
  void parsesEverySection() {
    PipelineConfig config = PipelineConfig.fromMap(Map.ofEntries(
        Map.entry("pipeline.name", "agent"),
        Map.entry("processQueue.capacity", "100"),
        Map.entry("processQueue.overflowPolicy", "block"),
        Map.entry("processQueue.blockTimeoutMillis", "25"),
        Map.entry("batch.maxEvents", "500"),
        Map.entry("batch.timeoutMillis", "100"),
        Map.entry("serializer.format", "ndjson"),
        Map.entry("compression", "deflate"),
        Map.entry("flusher.maxRetries", "3"),
        Map.entry("flusher.sendTimeoutMillis", "1500"),
        Map.entry("rateLimit.project", "50"),
        Map.entry("destination.type", "kafka"),
        Map.entry("destination.kafka.bootstrap", "broker:9092"),
        Map.entry("destination.kafka.topic", "logs.out"),
        Map.entry("destination.routes", "ca-central-1/agent/app-logs, ca-central-1/agent/audit#2")));

    assertEquals(100, config.processQueue().capacity());
    assertEquals(OverflowPolicy.BLOCK, config.processQueue().overflowPolicy());
    assertEquals(25, config.processQueue().blockTimeoutMillis());
    assertEquals(500, config.batch().maxEvents());
    assertEquals(100, config.batch().sweepIntervalMillis());
    assertEquals(PayloadFormat.NDJSON, config.format());
    assertEquals(CompressionType.DEFLATE, config.compression());
    assertEquals(3, config.flusher().maxRetries());
    assertEquals(50, config.rateLimits().quota(RateLimiterScope.PROJECT));
    assertEquals(DestinationType.KAFKA, config.destination().type());
    assertEquals(Optional.of("broker:9092"), config.destination().kafkaBootstrap());
    assertEquals("logs.out", config.destination().kafkaTopic());
    assertEquals(1_500, config.destination().maxBlockMillis());
    assertEquals(List.of(QueueKey.of("ca-central-1", "agent", "app-logs"),
        QueueKey.parse("ca-central-1/agent/audit#2")), config.destination().routes());
  }

  @Test
  void missingNameIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> PipelineConfig.fromMap(Map.of()));
    assertThrows(IllegalArgumentException.class, () -> PipelineConfig.fromMap(Map.of("pipeline.name", "bad name")));
  }

  @Test
  void outOfRangeValuesAreRejectedWithKeyName() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> PipelineConfig.fromMap(Map.of("pipeline.name", "agent", "flusher.concurrency", "0")));
    assertTrue(ex.getMessage().startsWith("flusher.concurrency"), ex.getMessage());

    ex = assertThrows(IllegalArgumentException.class,
        () -> PipelineConfig.fromMap(Map.of("pipeline.name", "agent", "batch.maxBytes", "lots")));
    assertTrue(ex.getMessage().startsWith("batch.maxBytes"), ex.getMessage());

    assertThrows(IllegalArgumentException.class, () -> PipelineConfig.fromMap(Map.of(
        "pipeline.name", "agent", "senderQueue.capacity", "5", "senderQueue.highWatermark", "50")));
    assertThrows(IllegalArgumentException.class, () -> PipelineConfig.fromMap(Map.of(
        "pipeline.name", "agent", "batch.timeoutMillis", "100", "batch.sweepIntervalMillis", "500")));
  }

  @Test
  void kafkaDestinationRequiresBootstrap() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> PipelineConfig.fromMap(Map.of("pipeline.name", "agent", "destination.type", "kafka")));
    assertTrue(ex.getMessage().contains("destination.kafka.bootstrap"), ex.getMessage());
  }

  @Test
  void malformedRouteNamesTheKey() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> PipelineConfig.fromMap(
        Map.of("pipeline.name", "agent", "destination.routes", "agent/app-logs")));
    assertTrue(ex.getMessage().startsWith("destination.routes: "), ex.getMessage());
  }

  @Test
  void unknownEnumValuesAreRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> PipelineConfig.fromMap(Map.of("pipeline.name", "agent", "compression", "brotli")));
    assertThrows(IllegalArgumentException.class,
        () -> PipelineConfig.fromMap(Map.of("pipeline.name", "agent", "destination.type", "http")));
    assertThrows(IllegalArgumentException.class,
        () -> PipelineConfig.fromMap(Map.of("pipeline.name", "agent", "processQueue.overflowPolicy", "spill")));
  }
}
