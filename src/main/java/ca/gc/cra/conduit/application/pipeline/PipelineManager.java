package ca.gc.cra.conduit.application.pipeline;

import ca.gc.cra.conduit.application.metrics.MetricsRegistry;
import ca.gc.cra.conduit.config.PipelineConfig;
import ca.gc.cra.conduit.domain.event.EventGroup;
import ca.gc.cra.conduit.domain.queue.QueueKey;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Owns the running pipeline instances by name and swaps them on configuration changes.
 * <p><strong>Why:</strong> A configuration change never mutates a running pipeline; the manager starts a fresh
 * instance under the same name, then retires the previous one, which drains within its grace period.</p>
 * <p><strong>Role:</strong> Entry point for the external configuration watcher and for producers looking up a
 * pipeline by name.</p>
 * <p><strong>Thread-safety:</strong> {@link #apply} and {@link #remove} are serialized; lookups and submits are
 * lock-free.</p>
 *
 * @since 0.1.0
 */
public final class PipelineManager implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(PipelineManager.class);

  private final Factory factory;
  private final MetricsRegistry registry;
  private final ConcurrentMap<String, Pipeline> pipelines = new ConcurrentHashMap<>();

  /**
   * Builds a wired, not yet started pipeline for a configuration snapshot.
   */
  @FunctionalInterface
  public interface Factory {
    /**
     * Creates a pipeline with its destinations bound.
     *
     * @param config configuration snapshot
     * @return new pipeline instance
     */
    Pipeline create(PipelineConfig config);
  }

  /**
   * Creates an empty manager.
   *
   * @param factory builds pipelines from configuration snapshots
   * @param registry registry shared by every pipeline the factory builds
   */
  public PipelineManager(Factory factory, MetricsRegistry registry) {
    this.factory = Objects.requireNonNull(factory, "factory");
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  /**
   * Starts a pipeline for {@code config}; a pipeline already running under the same name is retired once the
   * new one accepts submissions.
   *
   * @param config configuration snapshot
   * @return report of the retired instance, or empty when none was running
   */
  public synchronized Optional<ShutdownReport> apply(PipelineConfig config) {
    Objects.requireNonNull(config, "config");
    Pipeline next = factory.create(config);
    next.start();
    Pipeline previous = pipelines.put(config.name(), next);
    if (previous == null) {
      log.info("Pipeline {} added", config.name());
      return Optional.empty();
    }
    log.info("Pipeline {} reloaded; retiring previous instance", config.name());
    return Optional.of(retire(previous));
  }

  /**
   * Stops and removes a pipeline.
   *
   * @param name pipeline name
   * @return report of the removed instance, or empty when none was running
   */
  public synchronized Optional<ShutdownReport> remove(String name) {
    Pipeline previous = pipelines.remove(name);
    if (previous == null) {
      return Optional.empty();
    }
    log.info("Pipeline {} removed", name);
    return Optional.of(retire(previous));
  }

  public Optional<Pipeline> get(String name) {
    return Optional.ofNullable(pipelines.get(name));
  }

  /**
   * Submits a group to the named pipeline.
   *
   * @param name pipeline name
   * @param key destination stream
   * @param group event group
   * @return {@code false} if no such pipeline runs or it refused the group
   */
  public boolean submit(String name, QueueKey key, EventGroup group) {
    Pipeline pipeline = pipelines.get(name);
    return pipeline != null && pipeline.submit(key, group);
  }

  /**
   * Exports the metrics of every registered component, live and retiring pipelines alike.
   *
   * @return one map per component instance
   */
  public List<Map<String, String>> exportMetrics() {
    return registry.export();
  }

  /** Stops every pipeline. */
  @Override
  public synchronized void close() {
    for (String name : new ArrayList<>(pipelines.keySet())) {
      remove(name);
    }
  }

  private ShutdownReport retire(Pipeline pipeline) {
    ShutdownReport report = pipeline.stop();
    pipeline.close();
    return report;
  }
}
