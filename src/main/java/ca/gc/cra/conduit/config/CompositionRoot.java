package ca.gc.cra.conduit.config;

import ca.gc.cra.conduit.adapter.kafka.KafkaDestination;
import ca.gc.cra.conduit.application.metrics.MetricsRegistry;
import ca.gc.cra.conduit.application.pipeline.Pipeline;
import ca.gc.cra.conduit.application.pipeline.PipelineManager;
import ca.gc.cra.conduit.application.port.BatchSerializer;
import ca.gc.cra.conduit.application.port.ClockPort;
import ca.gc.cra.conduit.application.port.DestinationPort;
import ca.gc.cra.conduit.application.port.MetricsPort;
import ca.gc.cra.conduit.application.port.PayloadCompressor;
import ca.gc.cra.conduit.domain.queue.QueueKey;
import ca.gc.cra.conduit.infrastructure.compress.Compressors;
import ca.gc.cra.conduit.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.conduit.infrastructure.serialize.JsonBatchSerializer;
import ca.gc.cra.conduit.infrastructure.sink.LoggingDestination;
import ca.gc.cra.conduit.infrastructure.time.SystemClockAdapter;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Composition root that turns a {@link PipelineConfig} into a wired {@link Pipeline}.
 * <p><strong>Why:</strong> Keeps adapter selection (serializer, codec, destination) in one place so the pipeline
 * core only sees ports.</p>
 * <p><strong>Role:</strong> Adapter composition root; supplies the {@link PipelineManager.Factory} used for
 * reloads.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Pick the serializer and compressor matching the snapshot.</li>
 *   <li>Build the configured destination and bind the configured routes to it.</li>
 *   <li>Share one {@link MetricsRegistry}, metrics port and clock across every pipeline it builds.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Holds immutable references; {@link #createPipeline} may be called from the
 * reload thread while other pipelines run.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final MetricsRegistry registry;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final Function<DestinationConfig, DestinationPort> destinations;

  /**
   * Creates a composition root exporting through the environment-configured OpenTelemetry adapter.
   */
  public CompositionRoot() {
    this(new MetricsRegistry(), new OpenTelemetryMetricsAdapter(), new SystemClockAdapter());
  }

  /**
   * Creates a composition root with explicit metrics and clock collaborators.
   *
   * @param registry component registry shared by every pipeline
   * @param metrics histogram sink
   * @param clock time source
   */
  public CompositionRoot(MetricsRegistry registry, MetricsPort metrics, ClockPort clock) {
    this(registry, metrics, clock, CompositionRoot::createDestination);
  }

  CompositionRoot(
      MetricsRegistry registry,
      MetricsPort metrics,
      ClockPort clock,
      Function<DestinationConfig, DestinationPort> destinations) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.destinations = Objects.requireNonNull(destinations, "destinations");
    if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
      otel.bind(registry);
    }
  }

  public MetricsRegistry registry() {
    return registry;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Builds a pipeline for {@code config} with its destination bound to every configured route. The pipeline is
   * not started.
   *
   * @param config configuration snapshot
   * @return wired pipeline
   */
  public Pipeline createPipeline(PipelineConfig config) {
    Objects.requireNonNull(config, "config");
    Pipeline pipeline = new Pipeline(
        config, serializerFor(config), compressorFor(config), registry, metrics, clock);
    DestinationConfig destinationConfig = config.destination();
    DestinationPort destination = destinations.apply(destinationConfig);
    if (destinationConfig.routes().isEmpty()) {
      log.warn("Pipeline {} has no destination.routes; destination {} left unused",
          config.name(), destination.id());
      closeQuietly(destination);
      return pipeline;
    }
    for (QueueKey key : destinationConfig.routes()) {
      pipeline.bind(key, destination);
    }
    return pipeline;
  }

  /**
   * Creates a manager whose reloads go through {@link #createPipeline}.
   *
   * @return new pipeline manager sharing this root's registry
   */
  public PipelineManager newPipelineManager() {
    return new PipelineManager(this::createPipeline, registry);
  }

  static BatchSerializer serializerFor(PipelineConfig config) {
    return new JsonBatchSerializer(config.format(), config.maxPayloadBytes());
  }

  static PayloadCompressor compressorFor(PipelineConfig config) {
    return Compressors.forType(config.compression());
  }

  static DestinationPort createDestination(DestinationConfig config) {
    return switch (config.type()) {
      case LOG -> new LoggingDestination(config.id());
      case KAFKA -> new KafkaDestination(
          config.id(), config.kafkaBootstrap().orElseThrow(), config.kafkaTopic(), config.maxBlockMillis());
    };
  }

  private static void closeQuietly(DestinationPort destination) {
    try {
      destination.close();
    } catch (Exception ex) {
      log.warn("Failed to close unused destination {}", destination.id(), ex);
    }
  }
}
