package ca.gc.cra.conduit.application.pipeline;

import ca.gc.cra.conduit.application.metrics.MetricNames;
import ca.gc.cra.conduit.application.metrics.MetricsRecord;
import ca.gc.cra.conduit.application.metrics.MetricsRegistry;
import ca.gc.cra.conduit.application.port.ClockPort;
import ca.gc.cra.conduit.application.port.DestinationPort;
import ca.gc.cra.conduit.application.port.MetricsPort;
import ca.gc.cra.conduit.application.queue.BoundedQueue;
import ca.gc.cra.conduit.application.queue.SenderQueueManager;
import ca.gc.cra.conduit.domain.queue.QueueKey;
import ca.gc.cra.conduit.domain.sink.DeliveryOutcome;
import ca.gc.cra.conduit.domain.sink.DeliveryResult;
import ca.gc.cra.conduit.domain.sink.RegistrationState;
import ca.gc.cra.conduit.domain.sink.SenderItem;
import ca.gc.cra.conduit.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.conduit.logging.Logs;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Bounded pool of send workers draining the sender queues into destinations.
 * <p><strong>Why:</strong> Delivery is the only stage that blocks on the network; a fixed pool caps concurrent
 * requests while retry delays run on a timer instead of a sleeping worker, so back-off never starves the pool.</p>
 * <p><strong>Role:</strong> Last stage of the output path.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Fetch items through the rate limiters, register sessions, send with a timeout.</li>
 *   <li>Apply the per-outcome policy: drop on success, back-off retry on network and server errors,
 *       re-register on unauthorized, discard on params errors, one bounded retry on other errors.</li>
 *   <li>Count every discarded item and its events on the destination's runner record.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Workers share only the sender queues, limiters, and sessions, each of which is
 * thread-safe. Targets may be attached and detached while running.</p>
 * <p><strong>Observability:</strong> One {@code flusher_runner} record per destination plus one for the pool
 * ({@code send_concurrency}); histogram {@code flusher.send.latencyMillis}.</p>
 *
 * @since 0.1.0
 */
public final class FlusherRunner {
  private static final Logger log = LoggerFactory.getLogger(FlusherRunner.class);
  private static final long IDLE_WAIT_MILLIS = 50L;
  private static final long DRAIN_POLL_MILLIS = 10L;
  private static final int FAILURE_LOG_INTERVAL = 100;
  private static final int MAX_LOGGED_MESSAGE_BYTES = 512;

  private final String pipelineName;
  private final FlusherSettings settings;
  private final SenderQueueManager queues;
  private final MetricsRegistry registry;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final MetricsRecord poolRecord;
  private final ConcurrentMap<String, Target> targetsById = new ConcurrentHashMap<>();
  private final ConcurrentMap<QueueKey, Target> targetsByKey = new ConcurrentHashMap<>();
  private final AtomicBoolean running = new AtomicBoolean();
  private final AtomicInteger failureLogLimiter = new AtomicInteger();
  private volatile ExecutorService workers;
  private volatile ScheduledExecutorService retryTimer;

  /**
   * Creates a runner; call {@link #start()} to launch the workers.
   *
   * @param pipelineName owning pipeline, used for thread names, MDC, and labels
   * @param settings pool and retry limits
   * @param queues sender queues to drain
   * @param registry registry receiving runner records
   * @param metrics histogram sink
   * @param clock time source for latency measurement
   */
  public FlusherRunner(
      String pipelineName,
      FlusherSettings settings,
      SenderQueueManager queues,
      MetricsRegistry registry,
      MetricsPort metrics,
      ClockPort clock) {
    this.pipelineName = Objects.requireNonNull(pipelineName, "pipelineName");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.queues = Objects.requireNonNull(queues, "queues");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.poolRecord = registry.register(labels(null));
  }

  /**
   * Routes items of {@code key} to {@code destination}, creating the destination's session on first use.
   *
   * @param key stream identity
   * @param destination destination serving the stream
   */
  public void attach(QueueKey key, DestinationPort destination) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(destination, "destination");
    Target target = targetsById.computeIfAbsent(destination.id(), id -> {
      MetricsRecord record = registry.register(labels(id));
      return new Target(destination, record, new ClientSession(destination, settings.maxRegisterAttempts(), record));
    });
    if (target.destination != destination) {
      throw new IllegalArgumentException("Destination id " + destination.id() + " already bound to another instance");
    }
    targetsByKey.put(key, target);
  }

  /**
   * Stops routing items of {@code key}.
   *
   * @param key stream identity
   */
  public void detach(QueueKey key) {
    targetsByKey.remove(key);
  }

  /**
   * Returns the session of a destination.
   *
   * @param destinationId destination id
   * @return session, or empty if the destination was never attached
   */
  public Optional<ClientSession> session(String destinationId) {
    return Optional.ofNullable(targetsById.get(destinationId)).map(t -> t.session);
  }

  /**
   * Returns the registration state of a destination, for diagnostics.
   *
   * @param destinationId destination id
   * @return state, or empty if the destination was never attached
   */
  public Optional<RegistrationState> registrationState(String destinationId) {
    return session(destinationId).map(ClientSession::state);
  }

  /**
   * Launches the worker pool and retry timer.
   *
   * @throws IllegalStateException if already running
   */
  public void start() {
    if (!running.compareAndSet(false, true)) {
      throw new IllegalStateException("Flusher runner already started");
    }
    retryTimer = ExecutorFactories.newScheduler(pipelineName + "-retry", this::handleWorkerCrash);
    workers = ExecutorFactories.newWorkerPool(
        settings.concurrency(), pipelineName + "-flusher", this::handleWorkerCrash);
    for (int i = 0; i < settings.concurrency(); i++) {
      workers.execute(new SendWorker());
    }
    poolRecord.gauge(MetricNames.RUNNER_SINK_SEND_CONCURRENCY).set(settings.concurrency());
    log.info("Started {} flusher workers for pipeline {}", settings.concurrency(), pipelineName);
  }

  public boolean isRunning() {
    return running.get();
  }

  /**
   * Waits until every sender queue is empty or the timeout elapses.
   *
   * @param timeoutMillis maximum wait
   * @return {@code true} if the queues drained
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitDrained(long timeoutMillis) throws InterruptedException {
    long deadline = clock.nowMillis() + timeoutMillis;
    while (!queues.isEmpty()) {
      if (clock.nowMillis() >= deadline) {
        return false;
      }
      TimeUnit.MILLISECONDS.sleep(DRAIN_POLL_MILLIS);
    }
    return true;
  }

  /**
   * Stops the workers, interrupting in-flight sends that do not finish within {@code awaitMillis}. Items still
   * queued are left for the caller to discard.
   *
   * @param awaitMillis how long to wait for workers to finish their current item
   */
  public void stop(long awaitMillis) {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    queues.wakeUp();
    ScheduledExecutorService timer = retryTimer;
    if (timer != null) {
      timer.shutdownNow();
    }
    ExecutorService executor = workers;
    if (executor != null) {
      executor.shutdown();
      boolean terminated = false;
      try {
        terminated = executor.awaitTermination(awaitMillis, TimeUnit.MILLISECONDS);
        if (!terminated) {
          log.warn("Flusher workers active after {} ms; interrupting in-flight sends", awaitMillis);
          executor.shutdownNow();
          terminated = executor.awaitTermination(awaitMillis, TimeUnit.MILLISECONDS);
        }
      } catch (InterruptedException ie) {
        executor.shutdownNow();
        Thread.currentThread().interrupt();
      }
      if (!terminated) {
        log.error("Flusher workers for pipeline {} failed to terminate cleanly", pipelineName);
      }
    }
    poolRecord.gauge(MetricNames.RUNNER_SINK_SEND_CONCURRENCY).set(0);
    log.info("Stopped flusher workers for pipeline {}", pipelineName);
  }

  /**
   * Closes every attached destination and removes runner records from the registry.
   */
  public void close() {
    for (Target target : targetsById.values()) {
      try {
        target.destination.close();
      } catch (Exception ex) {
        log.warn("Failed to close destination {}", target.destination.id(), ex);
      }
      registry.unregister(target.record);
    }
    registry.unregister(poolRecord);
  }

  /**
   * Handles one leased item. Visible for tests driving the runner without worker threads.
   *
   * @param lease leased item
   * @return {@code false} if the calling worker was interrupted and should exit
   */
  boolean process(SenderQueueManager.Lease lease) {
    BoundedQueue<SenderItem> lane = lease.lane();
    SenderItem item = lease.item();
    Target target = targetsByKey.get(item.key());
    if (target == null) {
      lane.drop(item);
      logFailure("No destination attached for {}; discarded item of {} events", item.key(), item.eventCount());
      return true;
    }
    MetricsRecord record = target.record;
    if (item.sendAttempts() == 0) {
      record.counter(MetricNames.IN_ITEMS_TOTAL).increment();
      record.counter(MetricNames.RUNNER_IN_EVENT_GROUPS_TOTAL).add(item.groupCount());
      record.counter(MetricNames.IN_SIZE_BYTES).add(item.byteSize());
    }
    if (!target.session.ensureRegistered()) {
      discard(lane, item, record, "destination " + target.destination.id() + " registration failed");
      return true;
    }

    item.beginAttempt();
    record.gauge(MetricNames.RUNNER_SINK_SENDING_ITEMS).incrementAndGet();
    long startMillis = clock.nowMillis();
    DeliveryResult result;
    try {
      result = deliver(target.destination, item);
    } finally {
      record.gauge(MetricNames.RUNNER_SINK_SENDING_ITEMS).decrementAndGet();
    }
    if (result == null) {
      lane.release(item);
      return false;
    }
    metrics.observe(MetricNames.HISTOGRAM_SEND_LATENCY, Math.max(0L, clock.nowMillis() - startMillis));
    record.counter(MetricNames.RUNNER_SEND_DONE_TOTAL).increment();
    record.counter(result.outcome().metricName()).increment();
    result.errorCode()
        .flatMap(ErrorClassifier::errorCodeCounter)
        .ifPresent(counter -> record.counter(counter).increment());

    switch (result.outcome()) {
      case SUCCESS -> {
        if (lane.complete(item)) {
          record.counter(MetricNames.RUNNER_SINK_OUT_SUCCESSFUL_ITEMS).increment();
          record.counter(MetricNames.OUT_ITEMS_TOTAL).increment();
          record.counter(MetricNames.OUT_EVENTS_TOTAL).add(item.eventCount());
          record.counter(MetricNames.OUT_SIZE_BYTES).add(item.byteSize());
          record.counter(MetricNames.TOTAL_DELAY_MS)
              .add(Math.max(0L, clock.nowMillis() - item.createdAtMillis()));
        }
      }
      case NETWORK_ERROR, SERVER_ERROR -> retryLater(lane, item, record, result);
      case UNAUTHORIZED_ERROR -> {
        target.session.invalidate();
        if (item.retries() >= settings.maxRetries()) {
          discard(lane, item, record, describe(result));
        } else {
          item.recordRetry();
          record.counter(MetricNames.RUNNER_RETRY_TIMES_TOTAL).increment();
          lane.release(item);
        }
      }
      case PARAMS_ERROR -> discard(lane, item, record, describe(result));
      case OTHER_ERROR -> {
        if (item.otherErrorRetries() < settings.otherErrorRetries()) {
          item.recordOtherErrorRetry();
          retryLater(lane, item, record, result);
        } else {
          discard(lane, item, record, describe(result));
        }
      }
      default -> throw new IllegalStateException("Unhandled outcome " + result.outcome());
    }
    return true;
  }

  /**
   * Sends one item and waits for the outcome.
   *
   * @return classified result, or {@code null} when interrupted
   */
  private DeliveryResult deliver(DestinationPort destination, SenderItem item) {
    CompletableFuture<DeliveryResult> future;
    try {
      future = destination.send(item);
    } catch (RuntimeException ex) {
      return ErrorClassifier.fromThrowable(ex);
    }
    if (future == null) {
      return DeliveryResult.failure(DeliveryOutcome.OTHER_ERROR, "destination returned no future");
    }
    try {
      DeliveryResult result = future.get(settings.sendTimeoutMillis(), TimeUnit.MILLISECONDS);
      return result == null ? DeliveryResult.failure(DeliveryOutcome.OTHER_ERROR, "empty delivery result") : result;
    } catch (TimeoutException ex) {
      future.cancel(true);
      return DeliveryResult.failure(
          DeliveryOutcome.NETWORK_ERROR, "send timed out after " + settings.sendTimeoutMillis() + " ms");
    } catch (ExecutionException ex) {
      return ErrorClassifier.fromThrowable(ex);
    } catch (InterruptedException ex) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      return null;
    }
  }

  private void retryLater(
      BoundedQueue<SenderItem> lane, SenderItem item, MetricsRecord record, DeliveryResult result) {
    if (item.retries() >= settings.maxRetries()) {
      discard(lane, item, record, describe(result));
      return;
    }
    int retry = item.recordRetry();
    record.counter(MetricNames.RUNNER_RETRY_TIMES_TOTAL).increment();
    long delay = settings.backoffMillis(retry);
    if (log.isDebugEnabled()) {
      log.debug("Retry {} of {} for {} in {} ms: {}", retry, settings.maxRetries(), item.key(), delay,
          Logs.truncate(describe(result), MAX_LOGGED_MESSAGE_BYTES));
    }
    ScheduledExecutorService timer = retryTimer;
    if (delay <= 0 || timer == null || !running.get()) {
      lane.release(item);
      return;
    }
    lane.park(item);
    try {
      timer.schedule(() -> lane.release(item), delay, TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException ex) {
      lane.release(item);
    }
  }

  private void discard(BoundedQueue<SenderItem> lane, SenderItem item, MetricsRecord record, String reason) {
    if (!lane.drop(item)) {
      return;
    }
    record.counter(MetricNames.RUNNER_SINK_OUT_FAILED_ITEMS).increment();
    record.counter(MetricNames.RUNNER_SINK_OUT_FAILED_EVENTS).add(item.eventCount());
    logFailure("Discarded item for {} after {} attempt(s): {}", item.key(), item.sendAttempts(),
        Logs.truncate(reason, MAX_LOGGED_MESSAGE_BYTES));
  }

  private void logFailure(String format, Object... args) {
    int count = failureLogLimiter.incrementAndGet();
    if (count == 1 || count % FAILURE_LOG_INTERVAL == 0) {
      log.warn(format, args);
    }
  }

  private void handleWorkerCrash(Thread thread, Throwable throwable) {
    metrics.increment("flusher.worker.uncaught");
    log.error("Flusher thread {} threw an uncaught exception", thread.getName(), throwable);
  }

  private Map<String, String> labels(String destinationId) {
    Map<String, String> labels = new LinkedHashMap<>();
    labels.put(MetricNames.LABEL_PIPELINE_NAME, pipelineName);
    labels.put(MetricNames.LABEL_RUNNER_NAME, MetricNames.RUNNER_FLUSHER);
    if (destinationId != null) {
      labels.put(MetricNames.LABEL_FLUSHER_PLUGIN_ID, destinationId);
    }
    return labels;
  }

  private static String describe(DeliveryResult result) {
    return result.outcome() + result.errorCode().map(code -> " [" + code + "]").orElse("")
        + (result.message().isEmpty() ? "" : " " + result.message());
  }

  private final class SendWorker implements Runnable {
    @Override
    public void run() {
      MDC.put("pipeline", pipelineName);
      try {
        while (running.get() && !Thread.currentThread().isInterrupted()) {
          Optional<SenderQueueManager.Lease> lease = queues.fetch();
          if (lease.isEmpty()) {
            queues.awaitWork(IDLE_WAIT_MILLIS);
            continue;
          }
          try {
            if (!process(lease.get())) {
              return;
            }
          } catch (RuntimeException ex) {
            metrics.increment("flusher.worker.error");
            lease.get().lane().release(lease.get().item());
            log.error("Flusher worker failed on {}", lease.get().item(), ex);
          }
        }
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
      } finally {
        MDC.remove("pipeline");
      }
    }
  }

  private static final class Target {
    private final DestinationPort destination;
    private final MetricsRecord record;
    private final ClientSession session;

    private Target(DestinationPort destination, MetricsRecord record, ClientSession session) {
      this.destination = destination;
      this.record = record;
      this.session = session;
    }
  }
}
