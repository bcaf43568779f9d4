package ca.gc.cra.conduit.application.pipeline;

import ca.gc.cra.conduit.application.metrics.MetricNames;
import ca.gc.cra.conduit.application.metrics.MetricsRecord;
import ca.gc.cra.conduit.application.port.MetricsPort;
import ca.gc.cra.conduit.application.queue.BoundedQueue;
import ca.gc.cra.conduit.application.queue.ProcessQueueManager;
import ca.gc.cra.conduit.application.queue.SenderQueueManager;
import ca.gc.cra.conduit.domain.event.EventGroup;
import ca.gc.cra.conduit.infrastructure.exec.ExecutorFactories;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Single consumer thread moving event groups from the process queue into the batcher.
 * <p><strong>Why:</strong> A lane is only drained while the matching sender queue is below its high watermark,
 * which is how sender congestion propagates back to producers.</p>
 * <p><strong>Thread-safety:</strong> One worker thread; {@link #start()} and {@link #stop(long)} may be called from
 * any thread.</p>
 *
 * @since 0.1.0
 */
public final class ProcessRunner {
  private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);
  private static final long IDLE_WAIT_MILLIS = 20L;

  private final String pipelineName;
  private final ProcessQueueManager processQueues;
  private final SenderQueueManager senderQueues;
  private final Batcher batcher;
  private final MetricsRecord record;
  private final MetricsPort metrics;
  private final AtomicBoolean running = new AtomicBoolean();
  private volatile ExecutorService worker;

  /**
   * Creates a runner.
   *
   * @param pipelineName owning pipeline, used for the thread name and MDC
   * @param processQueues source lanes
   * @param senderQueues consulted for backpressure
   * @param batcher destination of popped groups
   * @param record {@code processor_runner} metrics record
   * @param metrics crash counter sink
   */
  public ProcessRunner(
      String pipelineName,
      ProcessQueueManager processQueues,
      SenderQueueManager senderQueues,
      Batcher batcher,
      MetricsRecord record,
      MetricsPort metrics) {
    this.pipelineName = Objects.requireNonNull(pipelineName, "pipelineName");
    this.processQueues = Objects.requireNonNull(processQueues, "processQueues");
    this.senderQueues = Objects.requireNonNull(senderQueues, "senderQueues");
    this.batcher = Objects.requireNonNull(batcher, "batcher");
    this.record = Objects.requireNonNull(record, "record");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Launches the consumer thread.
   *
   * @throws IllegalStateException if already running
   */
  public void start() {
    if (!running.compareAndSet(false, true)) {
      throw new IllegalStateException("Process runner already started");
    }
    worker = ExecutorFactories.newWorkerPool(1, pipelineName + "-process", (thread, throwable) -> {
      metrics.increment("process.worker.uncaught");
      log.error("Process thread {} threw an uncaught exception", thread.getName(), throwable);
    });
    worker.execute(this::runLoop);
  }

  /**
   * Performs one round-robin pass over the process lanes, moving at most one group per lane.
   *
   * @return number of groups moved
   */
  int drainOnce() {
    int moved = 0;
    List<BoundedQueue<EventGroup>> lanes = processQueues.lanes();
    for (BoundedQueue<EventGroup> lane : lanes) {
      if (!senderQueues.validToPush(lane.key())) {
        continue;
      }
      Optional<EventGroup> group = lane.poll();
      if (group.isEmpty()) {
        continue;
      }
      record.counter(MetricNames.RUNNER_IN_EVENT_GROUPS_TOTAL).increment();
      record.counter(MetricNames.IN_EVENTS_TOTAL).add(group.get().eventCount());
      record.counter(MetricNames.IN_SIZE_BYTES).add(group.get().byteSize());
      batcher.add(lane.key(), group.get());
      moved++;
    }
    return moved;
  }

  /**
   * Stops the consumer thread. Groups left in the process queue stay there for the caller.
   *
   * @param awaitMillis how long to wait for the thread to exit
   */
  public void stop(long awaitMillis) {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    processQueues.wakeUp();
    ExecutorService executor = worker;
    if (executor == null) {
      return;
    }
    executor.shutdown();
    try {
      if (!executor.awaitTermination(awaitMillis, TimeUnit.MILLISECONDS)) {
        executor.shutdownNow();
        if (!executor.awaitTermination(awaitMillis, TimeUnit.MILLISECONDS)) {
          log.error("Process runner for pipeline {} failed to terminate cleanly", pipelineName);
        }
      }
    } catch (InterruptedException ie) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  public boolean isRunning() {
    return running.get();
  }

  private void runLoop() {
    MDC.put("pipeline", pipelineName);
    try {
      while (running.get() && !Thread.currentThread().isInterrupted()) {
        int moved;
        try {
          moved = drainOnce();
        } catch (RuntimeException ex) {
          metrics.increment("process.worker.error");
          log.error("Process runner pass failed for pipeline {}", pipelineName, ex);
          moved = 0;
        }
        if (moved == 0) {
          // sender-side relief is picked up on the next timeout
          processQueues.awaitWork(IDLE_WAIT_MILLIS);
        }
      }
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
    } finally {
      MDC.remove("pipeline");
    }
  }
}
