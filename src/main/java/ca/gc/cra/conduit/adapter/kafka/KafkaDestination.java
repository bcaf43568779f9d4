package ca.gc.cra.conduit.adapter.kafka;

import ca.gc.cra.conduit.application.pipeline.ErrorClassifier;
import ca.gc.cra.conduit.application.port.DestinationPort;
import ca.gc.cra.conduit.domain.sink.DeliveryOutcome;
import ca.gc.cra.conduit.domain.sink.DeliveryResult;
import ca.gc.cra.conduit.domain.sink.RegistrationResult;
import ca.gc.cra.conduit.domain.sink.SenderItem;
import ca.gc.cra.conduit.validation.Strings;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.errors.AuthenticationException;
import org.apache.kafka.common.errors.AuthorizationException;
import org.apache.kafka.common.errors.InvalidTopicException;
import org.apache.kafka.common.errors.RecordTooLargeException;
import org.apache.kafka.common.errors.RetriableException;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Kafka-backed {@link DestinationPort} that publishes each sender item as one record.
 * <p><strong>Why:</strong> Lets collectors on other hosts consume the agent's output without a bespoke endpoint.</p>
 * <p><strong>Role:</strong> Outbound adapter on the flusher side.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Key records by the stream key so one stream keeps partition order.</li>
 *   <li>Carry format, compression and event count as record headers.</li>
 *   <li>Translate producer callback exceptions into delivery outcomes.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Mirrors the provided {@link Producer}; the default {@link KafkaProducer} is
 * thread-safe.</p>
 * <p><strong>Observability:</strong> Producer exposes standard Kafka client metrics; failures are reported through
 * the returned {@link DeliveryResult}.</p>
 *
 * @since 0.1.0
 */
public final class KafkaDestination implements DestinationPort {
  private static final Logger log = LoggerFactory.getLogger(KafkaDestination.class);
  static final String HEADER_FORMAT = "conduit-format";
  static final String HEADER_COMPRESSION = "conduit-compression";
  static final String HEADER_EVENTS = "conduit-events";

  private final String id;
  private final Producer<String, byte[]> producer;
  private final String topic;

  /**
   * Creates a Kafka destination.
   *
   * @param id destination id; non-blank
   * @param bootstrapServers comma-separated Kafka bootstrap servers; must not be blank
   * @param topic topic receiving payloads; must not be blank
   * @param maxBlockMillis upper bound for metadata and buffer waits inside {@code send}; must be positive
   * @throws IllegalArgumentException if any parameter is blank
   */
  public KafkaDestination(String id, String bootstrapServers, String topic, long maxBlockMillis) {
    this(id, new KafkaProducer<>(producerProperties(bootstrapServers, maxBlockMillis)), topic);
  }

  KafkaDestination(String id, Producer<String, byte[]> producer, String topic) {
    this.id = Strings.requireNonBlank("id", id);
    this.producer = Objects.requireNonNull(producer, "producer");
    this.topic = Strings.sanitizeTopic("topic", topic);
  }

  @Override
  public String id() {
    return id;
  }

  /**
   * Fetches topic metadata; a broker that rejects the client or does not know the topic fails registration.
   *
   * @return registration outcome
   */
  @Override
  public RegistrationResult register() {
    try {
      producer.partitionsFor(topic);
      return RegistrationResult.ok();
    } catch (KafkaException ex) {
      log.warn("{} could not fetch metadata for topic {}: {}", id, topic, ex.getMessage());
      return RegistrationResult.failed(ex.getClass().getSimpleName() + ": " + ex.getMessage());
    }
  }

  @Override
  public CompletableFuture<DeliveryResult> send(SenderItem item) {
    Objects.requireNonNull(item, "item");
    ProducerRecord<String, byte[]> record = new ProducerRecord<>(topic, item.key().toString(), item.payload());
    record.headers()
        .add(HEADER_FORMAT, bytes(item.format().name().toLowerCase(Locale.ROOT)))
        .add(HEADER_COMPRESSION, bytes(item.compression().name().toLowerCase(Locale.ROOT)))
        .add(HEADER_EVENTS, bytes(Integer.toString(item.eventCount())));
    CompletableFuture<DeliveryResult> result = new CompletableFuture<>();
    try {
      producer.send(record, (metadata, exception) -> {
        if (exception == null) {
          result.complete(DeliveryResult.success());
        } else {
          result.complete(classify(exception));
        }
      });
    } catch (KafkaException ex) {
      result.complete(classify(ex));
    }
    return result;
  }

  /**
   * Flushes pending records and closes the producer, waiting up to five seconds for in-flight sends.
   */
  @Override
  public void close() {
    producer.flush();
    producer.close(Duration.ofSeconds(5));
  }

  static DeliveryResult classify(Exception exception) {
    String message = exception.getClass().getSimpleName()
        + (exception.getMessage() == null ? "" : ": " + exception.getMessage());
    if (exception instanceof RetriableException) {
      return DeliveryResult.failure(DeliveryOutcome.NETWORK_ERROR, message);
    }
    if (exception instanceof AuthenticationException || exception instanceof AuthorizationException) {
      return DeliveryResult.failure(DeliveryOutcome.UNAUTHORIZED_ERROR, message);
    }
    if (exception instanceof RecordTooLargeException || exception instanceof InvalidTopicException) {
      return DeliveryResult.failure(DeliveryOutcome.PARAMS_ERROR, message);
    }
    return ErrorClassifier.fromThrowable(exception);
  }

  private static byte[] bytes(String value) {
    return value.getBytes(StandardCharsets.UTF_8);
  }

  static Properties producerProperties(String bootstrapServers, long maxBlockMillis) {
    String trimmed = Strings.requireNonBlank("bootstrapServers", bootstrapServers);
    if (maxBlockMillis <= 0) {
      throw new IllegalArgumentException("maxBlockMillis must be positive");
    }
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, trimmed);
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.LINGER_MS_CONFIG, 5);
    props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, maxBlockMillis);
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
    return props;
  }
}
