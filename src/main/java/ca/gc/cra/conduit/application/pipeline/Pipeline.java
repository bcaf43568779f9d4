package ca.gc.cra.conduit.application.pipeline;

import ca.gc.cra.conduit.application.limiter.RateLimiters;
import ca.gc.cra.conduit.application.metrics.MetricNames;
import ca.gc.cra.conduit.application.metrics.MetricsRecord;
import ca.gc.cra.conduit.application.metrics.MetricsRegistry;
import ca.gc.cra.conduit.application.port.BatchSerializer;
import ca.gc.cra.conduit.application.port.ClockPort;
import ca.gc.cra.conduit.application.port.DestinationPort;
import ca.gc.cra.conduit.application.port.MetricsPort;
import ca.gc.cra.conduit.application.port.PayloadCompressor;
import ca.gc.cra.conduit.application.queue.BoundedQueue;
import ca.gc.cra.conduit.application.queue.ProcessQueueManager;
import ca.gc.cra.conduit.application.queue.SenderQueueManager;
import ca.gc.cra.conduit.config.PipelineConfig;
import ca.gc.cra.conduit.domain.event.EventGroup;
import ca.gc.cra.conduit.domain.queue.QueueKey;
import ca.gc.cra.conduit.domain.sink.SenderItem;
import ca.gc.cra.conduit.infrastructure.exec.ExecutorFactories;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> One running instance of the output path: process queue, batcher, router, serializer,
 * compressor, sender queues, and flusher runner wired together for a single {@link PipelineConfig}.
 * <p><strong>Why:</strong> Configuration is immutable per instance; a reload builds a new {@code Pipeline} and
 * retires this one through {@link #stop()}, which accounts for every group and item it still holds.</p>
 * <p><strong>Role:</strong> Application use case; the producer-facing entry point is {@link #submit}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Accept event groups without blocking beyond the configured overflow wait.</li>
 *   <li>Run the process runner, the batch sweep timer, and the flusher pool.</li>
 *   <li>Bind and unbind stream keys to destinations.</li>
 *   <li>Drain on stop within the grace period, then discard and count the remainder.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #submit} is safe from any number of producer threads. Lifecycle methods
 * may be called from any thread; {@link #start()} and {@link #stop()} are idempotent.</p>
 * <p><strong>Observability:</strong> Registers records for every component under {@code pipeline_name}; see
 * {@link #exportMetrics()}.</p>
 *
 * @since 0.1.0
 */
public final class Pipeline implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(Pipeline.class);
  private static final long DRAIN_POLL_MILLIS = 10L;
  private static final long WORKER_STOP_MILLIS = 1_000L;
  private static final int REJECT_LOG_INTERVAL = 1_000;

  private final PipelineConfig config;
  private final MetricsRegistry registry;
  private final ClockPort clock;
  private final MetricsRecord pipelineRecord;
  private final List<MetricsRecord> componentRecords = new ArrayList<>();
  private final ProcessQueueManager processQueues;
  private final SenderQueueManager senderQueues;
  private final Batcher batcher;
  private final Router router;
  private final ProcessRunner processRunner;
  private final FlusherRunner flusherRunner;
  private final AtomicBoolean accepting = new AtomicBoolean(true);
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean stopped = new AtomicBoolean();
  private final AtomicInteger rejectLogLimiter = new AtomicInteger();
  private volatile ScheduledExecutorService sweepTimer;
  private volatile ShutdownReport report;

  /**
   * Wires a pipeline instance. Nothing runs until {@link #start()}.
   *
   * @param config immutable configuration snapshot
   * @param serializer batch encoder matching {@link PipelineConfig#format()}
   * @param compressor payload compressor matching {@link PipelineConfig#compression()}
   * @param registry registry receiving the component records
   * @param metrics histogram and crash counter sink
   * @param clock time source
   */
  public Pipeline(
      PipelineConfig config,
      BatchSerializer serializer,
      PayloadCompressor compressor,
      MetricsRegistry registry,
      MetricsPort metrics,
      ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    Objects.requireNonNull(serializer, "serializer");
    Objects.requireNonNull(compressor, "compressor");
    this.registry = Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    String name = config.name();

    this.pipelineRecord = register(Map.of(MetricNames.LABEL_PIPELINE_NAME, name));
    this.processQueues = new ProcessQueueManager(name, config.processQueue(), registry, clock);
    this.senderQueues = new SenderQueueManager(
        name, config.senderQueue(), new RateLimiters(config.rateLimits(), clock), registry, clock);
    this.router = new Router(register(component(MetricNames.COMPONENT_ROUTER)));
    BatchDispatcher dispatcher = new BatchDispatcher(
        router,
        serializer,
        compressor,
        register(component(MetricNames.COMPONENT_SERIALIZER)),
        register(component(MetricNames.COMPONENT_COMPRESSOR)),
        clock);
    this.batcher = new Batcher(
        config.batch(), register(component(MetricNames.COMPONENT_BATCHER)), metrics, clock, dispatcher);
    Map<String, String> runnerLabels = new LinkedHashMap<>();
    runnerLabels.put(MetricNames.LABEL_PIPELINE_NAME, name);
    runnerLabels.put(MetricNames.LABEL_RUNNER_NAME, MetricNames.RUNNER_PROCESSOR);
    this.processRunner = new ProcessRunner(
        name, processQueues, senderQueues, batcher, register(runnerLabels), metrics);
    this.flusherRunner = new FlusherRunner(name, config.flusher(), senderQueues, registry, metrics, clock);
  }

  public String name() {
    return config.name();
  }

  public PipelineConfig config() {
    return config;
  }

  /**
   * Starts the process runner, the sweep timer, and the flusher pool.
   *
   * @throws IllegalStateException if the pipeline was already stopped
   */
  public void start() {
    if (stopped.get()) {
      throw new IllegalStateException("Pipeline " + name() + " already stopped");
    }
    if (!started.compareAndSet(false, true)) {
      return;
    }
    pipelineRecord.gauge(MetricNames.PIPELINE_START_TIME).set(clock.nowMillis());
    flusherRunner.start();
    processRunner.start();
    long interval = config.batch().sweepIntervalMillis();
    sweepTimer = ExecutorFactories.newScheduler(name() + "-sweep",
        (thread, throwable) -> log.error("Sweep thread {} failed", thread.getName(), throwable));
    sweepTimer.scheduleAtFixedRate(this::sweep, interval, interval, TimeUnit.MILLISECONDS);
    log.info("Pipeline {} started (destination {}, {} flusher workers)",
        name(), config.destination().id(), config.flusher().concurrency());
  }

  /**
   * Accepts an event group from a producer. Never blocks longer than the process queue's overflow wait.
   *
   * @param key destination stream
   * @param group event group; ownership moves to the pipeline
   * @return {@code false} if the pipeline is stopping or the process queue discarded the group
   */
  public boolean submit(QueueKey key, EventGroup group) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(group, "group");
    if (!accepting.get()) {
      pipelineRecord.counter(MetricNames.PIPELINE_REJECTED_SUBMITS).increment();
      int count = rejectLogLimiter.incrementAndGet();
      if (count == 1 || count % REJECT_LOG_INTERVAL == 0) {
        log.warn("Pipeline {} is stopping; rejected {} submissions so far", name(), count);
      }
      return false;
    }
    return processQueues.push(key, group);
  }

  /**
   * Routes {@code key} to {@code destination}, opening its sender queue.
   *
   * @param key destination stream
   * @param destination destination serving the stream
   */
  public void bind(QueueKey key, DestinationPort destination) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(destination, "destination");
    flusherRunner.attach(key, destination);
    BoundedQueue<SenderItem> lane = senderQueues.open(key, destination.id());
    router.bind(key, destination.id(), lane);
    log.info("Pipeline {} bound {} to destination {}", name(), key, destination.id());
  }

  /**
   * Removes the route of {@code key}. Items already queued for it are discarded and counted; later batches for
   * the key are discarded by the router.
   *
   * @param key destination stream
   * @return number of sender items discarded
   */
  public int unbind(QueueKey key) {
    if (router.unbind(key).isEmpty()) {
      return 0;
    }
    List<SenderItem> discarded = senderQueues.close(key);
    flusherRunner.detach(key);
    log.info("Pipeline {} unbound {}; discarded {} queued items", name(), key, discarded.size());
    return discarded.size();
  }

  /**
   * Moves a destination marked failed back to unregistered so the next send registers again.
   *
   * @param destinationId destination id
   * @return {@code true} if the destination was failed
   */
  public boolean resetRegistration(String destinationId) {
    return flusherRunner.session(destinationId).map(ClientSession::reset).orElse(false);
  }

  /**
   * Closes every open batch now, regardless of thresholds.
   *
   * @return number of batches closed
   */
  public int flush() {
    return batcher.flushAll();
  }

  /**
   * Stops the pipeline using the configured grace period.
   *
   * @return shutdown accounting
   */
  public ShutdownReport stop() {
    return stop(config.shutdownGraceMillis());
  }

  /**
   * Stops accepting groups, drains what can be delivered within {@code graceMillis}, then discards and counts
   * the rest. Returns the same report when called again.
   *
   * @param graceMillis drain budget
   * @return shutdown accounting
   */
  public synchronized ShutdownReport stop(long graceMillis) {
    if (!stopped.compareAndSet(false, true)) {
      return report;
    }
    long startedAt = clock.nowMillis();
    long deadline = startedAt + graceMillis;
    accepting.set(false);
    log.info("Stopping pipeline {} (grace {} ms)", name(), graceMillis);

    boolean interrupted = false;
    boolean drained = false;
    int discardedGroups = 0;
    long discardedEvents = 0;
    try {
      if (started.get()) {
        while (!processQueues.isEmpty() && clock.nowMillis() < deadline) {
          TimeUnit.MILLISECONDS.sleep(DRAIN_POLL_MILLIS);
        }
      }
      processRunner.stop(WORKER_STOP_MILLIS);
      stopSweepTimer();

      for (EventGroup group : processQueues.closeAll()) {
        discardedGroups++;
        discardedEvents += group.eventCount();
      }
      batcher.flushAll();

      if (started.get()) {
        drained = flusherRunner.awaitDrained(Math.max(0L, deadline - clock.nowMillis()));
      } else {
        drained = senderQueues.isEmpty();
      }
    } catch (InterruptedException ie) {
      interrupted = true;
      processRunner.stop(WORKER_STOP_MILLIS);
      stopSweepTimer();
      List<EventGroup> dropped = new ArrayList<>(processQueues.closeAll());
      dropped.addAll(batcher.discardAll());
      for (EventGroup group : dropped) {
        discardedGroups++;
        discardedEvents += group.eventCount();
      }
    }
    flusherRunner.stop(interrupted ? 0L : WORKER_STOP_MILLIS);
    List<SenderItem> leftovers = senderQueues.discardAll();
    for (SenderItem item : leftovers) {
      discardedEvents += item.eventCount();
    }
    long delivered = registry.sum(Map.of(
        MetricNames.LABEL_PIPELINE_NAME, name(),
        MetricNames.LABEL_RUNNER_NAME, MetricNames.RUNNER_FLUSHER),
        MetricNames.RUNNER_SINK_OUT_SUCCESSFUL_ITEMS);
    report = new ShutdownReport(drained && !interrupted && discardedGroups == 0, delivered, discardedGroups,
        leftovers.size(), discardedEvents, clock.nowMillis() - startedAt);
    if (report.lossless()) {
      log.info("Pipeline {} stopped: delivered {} items, nothing discarded", name(), report.deliveredItems());
    } else {
      log.warn("Pipeline {} stopped: delivered {} items, discarded {} groups and {} items ({} events)",
          name(), report.deliveredItems(), report.discardedGroups(), report.discardedItems(),
          report.discardedEvents());
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
    return report;
  }

  /**
   * Stops the pipeline if needed, closes its destinations, and removes its metrics records.
   */
  @Override
  public void close() {
    stop();
    flusherRunner.close();
    processQueues.unregisterMetrics();
    senderQueues.unregisterMetrics();
    for (MetricsRecord record : componentRecords) {
      registry.unregister(record);
    }
  }

  /**
   * Exports every metrics record of this pipeline as a flat label/value map.
   *
   * @return one map per component instance
   */
  public List<Map<String, String>> exportMetrics() {
    List<Map<String, String>> out = new ArrayList<>();
    for (MetricsRecord record : registry.find(Map.of(MetricNames.LABEL_PIPELINE_NAME, name()))) {
      out.add(record.export());
    }
    return out;
  }

  public boolean isAccepting() {
    return accepting.get();
  }

  ProcessQueueManager processQueues() {
    return processQueues;
  }

  SenderQueueManager senderQueues() {
    return senderQueues;
  }

  Batcher batcher() {
    return batcher;
  }

  FlusherRunner flusherRunner() {
    return flusherRunner;
  }

  private void sweep() {
    MDC.put("pipeline", name());
    try {
      batcher.sweep();
    } catch (RuntimeException ex) {
      log.error("Batch sweep failed for pipeline {}", name(), ex);
    } finally {
      MDC.remove("pipeline");
    }
  }

  private void stopSweepTimer() {
    ScheduledExecutorService timer = sweepTimer;
    if (timer != null) {
      timer.shutdownNow();
    }
  }

  private MetricsRecord register(Map<String, String> labels) {
    MetricsRecord record = registry.register(labels);
    componentRecords.add(record);
    return record;
  }

  private Map<String, String> component(String componentName) {
    Map<String, String> labels = new LinkedHashMap<>();
    labels.put(MetricNames.LABEL_PIPELINE_NAME, config.name());
    labels.put(MetricNames.LABEL_COMPONENT_NAME, componentName);
    return labels;
  }
}
