package ca.gc.cra.conduit.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.conduit.application.metrics.MetricNames;
import ca.gc.cra.conduit.application.metrics.MetricsRegistry;
import ca.gc.cra.conduit.application.port.ClockPort;
import ca.gc.cra.conduit.config.PipelineConfig;
import ca.gc.cra.conduit.domain.event.EventGroup;
import ca.gc.cra.conduit.domain.queue.QueueKey;
import ca.gc.cra.conduit.domain.sink.CompressionType;
import ca.gc.cra.conduit.domain.sink.DeliveryOutcome;
import ca.gc.cra.conduit.domain.sink.PayloadFormat;
import ca.gc.cra.conduit.domain.sink.RegistrationResult;
import ca.gc.cra.conduit.domain.sink.RegistrationState;
import ca.gc.cra.conduit.domain.sink.SenderItem;
import ca.gc.cra.conduit.infrastructure.compress.Compressors;
import ca.gc.cra.conduit.infrastructure.serialize.JsonBatchSerializer;
import ca.gc.cra.conduit.testutil.Groups;
import ca.gc.cra.conduit.testutil.RecordingMetricsPort;
import ca.gc.cra.conduit.testutil.ScriptedDestination;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class PipelineTest {
  private final MetricsRegistry registry = new MetricsRegistry();
  private Pipeline pipeline;

  @AfterEach
  void tearDown() {
    if (pipeline != null) {
      pipeline.close();
    }
  }

  private Pipeline pipeline(Map<String, String> overrides) {
    Map<String, String> kv = new HashMap<>();
    kv.put("pipeline.name", "p1");
    kv.put("destination.id", "dest-a");
    kv.put("processQueue.capacity", "200");
    kv.put("batch.maxEvents", "10");
    kv.put("batch.timeoutMillis", "200");
    kv.put("flusher.concurrency", "2");
    kv.put("flusher.backoffInitialMillis", "10");
    kv.put("flusher.backoffMaxMillis", "50");
    kv.put("serializer.format", "ndjson");
    kv.putAll(overrides);
    PipelineConfig config = PipelineConfig.fromMap(kv);
    pipeline = new Pipeline(config,
        new JsonBatchSerializer(config.format(), config.maxPayloadBytes()),
        Compressors.forType(config.compression()),
        registry, new RecordingMetricsPort(), ClockPort.SYSTEM);
    return pipeline;
  }

  private static void await(BooleanSupplier condition, long timeoutMillis) throws InterruptedException {
    long deadline = System.currentTimeMillis() + timeoutMillis;
    while (!condition.getAsBoolean()) {
      if (System.currentTimeMillis() >= deadline) {
        throw new AssertionError("condition not met within " + timeoutMillis + " ms");
      }
      Thread.sleep(5);
    }
  }

  @Test
  void deliversEverySubmittedEventInSizedBatches() throws Exception {
    ScriptedDestination destination = new ScriptedDestination("dest-a");
    Pipeline pipeline = pipeline(Map.of("batch.timeoutMillis", "5000"));
    pipeline.bind(Groups.KEY, destination);
    pipeline.start();

    for (int i = 0; i < 50; i++) {
      assertTrue(pipeline.submit(Groups.KEY, Groups.withEvents(2)));
    }
    await(() -> destination.deliveredEvents() == 100, 5_000);

    ShutdownReport report = pipeline.stop();
    assertTrue(report.lossless());
    assertTrue(report.drained());
    assertEquals(10, report.deliveredItems());

    SenderItem first = destination.delivered().get(0);
    assertEquals(CompressionType.GZIP, first.compression());
    assertEquals(PayloadFormat.NDJSON, first.format());
    byte[] raw = Compressors.forType(CompressionType.GZIP).decompress(first.payload());
    assertEquals(first.rawSize(), raw.length);
    List<EventGroup> groups = new JsonBatchSerializer(PayloadFormat.NDJSON, 1 << 20).deserialize(raw);
    assertEquals(5, groups.size());
    assertEquals("/var/log/app.log", groups.get(0).source());
  }

  @Test
  void idleBatchIsFlushedBySweepTimer() throws Exception {
    ScriptedDestination destination = new ScriptedDestination("dest-a");
    Pipeline pipeline = pipeline(Map.of("batch.maxEvents", "1000"));
    pipeline.bind(Groups.KEY, destination);
    pipeline.start();

    pipeline.submit(Groups.KEY, Groups.withEvents(3));

    await(() -> destination.deliveredEvents() == 3, 5_000);
    assertEquals(1, destination.delivered().size());
  }

  @Test
  void retriesTransientFailuresBeforeDelivering() throws Exception {
    ScriptedDestination destination = new ScriptedDestination("dest-a")
        .thenFail(DeliveryOutcome.SERVER_ERROR, 2);
    Pipeline pipeline = pipeline(Map.of("batch.maxEvents", "2"));
    pipeline.bind(Groups.KEY, destination);
    pipeline.start();

    pipeline.submit(Groups.KEY, Groups.withEvents(2));

    await(() -> destination.delivered().size() == 1, 5_000);
    assertEquals(3, destination.sends());
    assertEquals(2, registry.sum(Map.of(
        MetricNames.LABEL_PIPELINE_NAME, "p1", MetricNames.LABEL_FLUSHER_PLUGIN_ID, "dest-a",
        MetricNames.LABEL_RUNNER_NAME, MetricNames.RUNNER_FLUSHER), MetricNames.RUNNER_RETRY_TIMES_TOTAL));
  }

  @Test
  void shutdownDiscardsWhatCannotBeDeliveredWithinGrace() {
    ScriptedDestination destination = new ScriptedDestination("dest-a").hang();
    Pipeline pipeline = pipeline(Map.of(
        "batch.maxEvents", "1000", "batch.timeoutMillis", "5000", "flusher.sendTimeoutMillis", "60000"));
    pipeline.bind(Groups.KEY, destination);
    pipeline.start();
    for (int i = 0; i < 3; i++) {
      pipeline.submit(Groups.KEY, Groups.withEvents(2));
    }

    long started = System.currentTimeMillis();
    ShutdownReport report = pipeline.stop(300);

    assertFalse(report.lossless());
    assertFalse(report.drained());
    assertEquals(0, report.deliveredItems());
    assertEquals(0, report.discardedGroups());
    assertEquals(1, report.discardedItems());
    assertEquals(6, report.discardedEvents());
    assertTrue(System.currentTimeMillis() - started < 10_000);
    assertSame(report, pipeline.stop(300));
  }

  @Test
  void stoppedPipelineRejectsSubmissions() {
    Pipeline pipeline = pipeline(Map.of());
    pipeline.stop(0);

    assertFalse(pipeline.isAccepting());
    assertFalse(pipeline.submit(Groups.KEY, Groups.withEvents(1)));
    assertEquals(1, registry.sum(Map.of(MetricNames.LABEL_PIPELINE_NAME, "p1"),
        MetricNames.PIPELINE_REJECTED_SUBMITS));
    assertThrows(IllegalStateException.class, pipeline::start);
  }

  @Test
  void unbindDiscardsQueuedItems() {
    Pipeline pipeline = pipeline(Map.of());
    pipeline.bind(Groups.KEY, new ScriptedDestination("dest-a"));
    pipeline.senderQueues().push(
        new SenderItem(Groups.KEY, new byte[4], 4, PayloadFormat.JSON, CompressionType.NONE, 1, 1, 0));

    assertEquals(1, pipeline.unbind(Groups.KEY));
    assertEquals(0, pipeline.unbind(Groups.KEY));

    pipeline.submit(Groups.KEY, Groups.withEvents(1));
    pipeline.batcher().add(Groups.KEY, pipeline.processQueues().pop(Groups.KEY).orElseThrow());
    pipeline.flush();
    assertEquals(1, registry.sum(Map.of(
        MetricNames.LABEL_PIPELINE_NAME, "p1", MetricNames.LABEL_COMPONENT_NAME, MetricNames.COMPONENT_ROUTER),
        MetricNames.DISCARDED_ITEMS_TOTAL));
  }

  @Test
  void failedRegistrationCanBeReset() {
    ScriptedDestination destination = new ScriptedDestination("dest-a")
        .registrations(RegistrationResult.failed("denied"));
    Pipeline pipeline = pipeline(Map.of("flusher.maxRegisterAttempts", "1"));
    pipeline.bind(Groups.KEY, destination);
    pipeline.senderQueues().push(
        new SenderItem(Groups.KEY, new byte[4], 4, PayloadFormat.JSON, CompressionType.NONE, 1, 1, 0));

    pipeline.flusherRunner().process(pipeline.senderQueues().fetch().orElseThrow());

    assertEquals(RegistrationState.FAILED,
        pipeline.flusherRunner().registrationState("dest-a").orElseThrow());
    assertTrue(pipeline.resetRegistration("dest-a"));
    assertFalse(pipeline.resetRegistration("dest-a"));
    assertFalse(pipeline.resetRegistration("unknown"));
  }

  @Test
  void exportsLabelledRecordsAndUnregistersOnClose() {
    ScriptedDestination destination = new ScriptedDestination("dest-a");
    Pipeline pipeline = pipeline(Map.of());
    pipeline.bind(Groups.KEY, destination);

    List<Map<String, String>> exported = pipeline.exportMetrics();

    assertFalse(exported.isEmpty());
    assertTrue(exported.stream().allMatch(m -> "p1".equals(m.get("label.pipeline_name"))));
    assertTrue(exported.stream().anyMatch(m -> "sender_queue".equals(m.get("label.component_name"))
        && "dest-a".equals(m.get("label.flusher_plugin_id"))));

    pipeline.close();
    this.pipeline = null;
    assertTrue(destination.isClosed());
    assertTrue(registry.find(Map.of(MetricNames.LABEL_PIPELINE_NAME, "p1")).isEmpty());
  }

  @Test
  void interruptedStopStillCountsOpenBatchesAndQueuedGroups() throws Exception {
    QueueKey audit = QueueKey.of("ca-central-1", "agent", "audit");
    ScriptedDestination destination = new ScriptedDestination("dest-a").hang();
    Pipeline pipeline = pipeline(Map.of(
        "senderQueue.capacity", "1", "senderQueue.highWatermark", "1",
        "batch.timeoutMillis", "5000", "flusher.sendTimeoutMillis", "60000"));
    pipeline.bind(Groups.KEY, destination);
    pipeline.bind(audit, destination);
    pipeline.start();

    pipeline.submit(Groups.KEY, Groups.withEvents(10));
    await(() -> destination.sends() == 1, 5_000);
    pipeline.submit(Groups.KEY, Groups.withEvents(1));
    pipeline.submit(audit, Groups.withEvents(3));
    await(() -> pipeline.batcher().bufferedGroups() == 1 && pipeline.processQueues().size() == 1, 5_000);

    Thread.currentThread().interrupt();
    ShutdownReport report = pipeline.stop(2_000);

    assertTrue(Thread.interrupted());
    assertFalse(report.lossless());
    assertEquals(2, report.discardedGroups());
    assertEquals(1, report.discardedItems());
    assertEquals(14, report.discardedEvents());
    assertEquals(0, pipeline.batcher().bufferedGroups());
    assertEquals(3, registry.sum(Map.of(
        MetricNames.LABEL_PIPELINE_NAME, "p1", MetricNames.LABEL_COMPONENT_NAME, MetricNames.COMPONENT_BATCHER),
        MetricNames.DISCARDED_EVENTS_TOTAL));
  }

  @Test
  void stopRefusesProducerParkedOnFullProcessLane() throws Exception {
    Pipeline pipeline = pipeline(Map.of(
        "processQueue.capacity", "1", "processQueue.extraBuffer", "0", "processQueue.highWatermark", "1",
        "processQueue.overflowPolicy", "block", "processQueue.blockTimeoutMillis", "10000"));
    assertTrue(pipeline.submit(Groups.KEY, Groups.withEvents(2)));
    AtomicBoolean accepted = new AtomicBoolean(true);
    Thread producer = new Thread(() -> accepted.set(pipeline.submit(Groups.KEY, Groups.withEvents(5))));
    producer.start();
    await(() -> producer.getState() == Thread.State.TIMED_WAITING, 5_000);

    ShutdownReport report = pipeline.stop(0);
    producer.join(5_000);

    assertFalse(producer.isAlive());
    assertFalse(accepted.get());
    assertEquals(1, report.discardedGroups());
    assertEquals(2, report.discardedEvents());
    assertEquals(0, pipeline.processQueues().size());
    assertEquals(7, registry.sum(Map.of(
        MetricNames.LABEL_PIPELINE_NAME, "p1", MetricNames.LABEL_COMPONENT_NAME, MetricNames.COMPONENT_PROCESS_QUEUE),
        MetricNames.DISCARDED_EVENTS_TOTAL));
  }
}
