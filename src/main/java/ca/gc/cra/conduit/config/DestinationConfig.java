package ca.gc.cra.conduit.config;

import ca.gc.cra.conduit.domain.queue.QueueKey;
import ca.gc.cra.conduit.validation.Strings;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Destination section of a pipeline configuration.
 *
 * @param type adapter to build
 * @param id destination id used as {@code flusher_plugin_id} label
 * @param kafkaBootstrap bootstrap servers; required for {@link DestinationType#KAFKA}
 * @param kafkaTopic topic receiving payloads in Kafka mode
 * @param routes streams bound to this destination when the pipeline starts
 * @param maxBlockMillis longest a send may hold the calling flusher thread before returning its future
 * @since 0.1.0
 */
public record DestinationConfig(
    DestinationType type, String id, Optional<String> kafkaBootstrap, String kafkaTopic,
    List<QueueKey> routes, long maxBlockMillis) {

  /**
   * Validates the destination section.
   *
   * @throws IllegalArgumentException if the id or topic is malformed, or Kafka mode lacks bootstrap servers
   */
  public DestinationConfig {
    type = Objects.requireNonNullElse(type, DestinationType.LOG);
    id = Strings.sanitizeTopic("destination.id", id);
    kafkaBootstrap = Objects.requireNonNullElse(kafkaBootstrap, Optional.<String>empty())
        .map(value -> Strings.requireNonBlank("destination.kafka.bootstrap", value));
    kafkaTopic = Strings.sanitizeTopic("destination.kafka.topic", kafkaTopic);
    routes = List.copyOf(Objects.requireNonNullElse(routes, List.<QueueKey>of()));
    if (maxBlockMillis <= 0) {
      throw new IllegalArgumentException("destination maxBlockMillis must be positive");
    }
    if (type == DestinationType.KAFKA && kafkaBootstrap.isEmpty()) {
      throw new IllegalArgumentException("destination.kafka.bootstrap is required when destination.type=kafka");
    }
  }
}
