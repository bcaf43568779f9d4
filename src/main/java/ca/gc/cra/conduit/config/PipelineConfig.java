package ca.gc.cra.conduit.config;

import ca.gc.cra.conduit.application.limiter.RateLimitSettings;
import ca.gc.cra.conduit.application.limiter.RateLimiterScope;
import ca.gc.cra.conduit.application.pipeline.BatchSettings;
import ca.gc.cra.conduit.application.pipeline.FlusherSettings;
import ca.gc.cra.conduit.application.queue.OverflowPolicy;
import ca.gc.cra.conduit.application.queue.QueueSettings;
import ca.gc.cra.conduit.domain.queue.QueueKey;
import ca.gc.cra.conduit.domain.sink.CompressionType;
import ca.gc.cra.conduit.domain.sink.PayloadFormat;
import ca.gc.cra.conduit.validation.Numbers;
import ca.gc.cra.conduit.validation.Strings;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable configuration snapshot of one pipeline instance.
 * <p><strong>Why:</strong> A running pipeline never changes its configuration; a reload builds a new snapshot and
 * a new pipeline instance, so every threshold is validated once, here, before any thread starts.</p>
 * <p><strong>Role:</strong> Adapter configuration aggregate consumed by {@link CompositionRoot} and
 * {@code PipelineManager}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Parse flat {@code key=value} maps (CLI or flattened YAML) with documented defaults.</li>
 *   <li>Reject malformed thresholds with a message naming the offending key.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for concurrent reads.</p>
 *
 * @param name pipeline name, used in metric labels, thread names, and MDC
 * @param processQueue process queue sizing
 * @param senderQueue sender queue sizing
 * @param batch batch close thresholds
 * @param format serialization format
 * @param maxPayloadBytes largest serialized batch accepted by the serializer
 * @param compression payload compression
 * @param flusher worker pool and retry settings
 * @param rateLimits limiter quotas
 * @param shutdownGraceMillis time granted to drain sender queues on stop
 * @param destination destination adapter settings
 * @since 0.1.0
 */
public record PipelineConfig(
    String name,
    QueueSettings processQueue,
    QueueSettings senderQueue,
    BatchSettings batch,
    PayloadFormat format,
    long maxPayloadBytes,
    CompressionType compression,
    FlusherSettings flusher,
    RateLimitSettings rateLimits,
    long shutdownGraceMillis,
    DestinationConfig destination) {

  static final int DEFAULT_PROCESS_CAPACITY = 20;
  static final int DEFAULT_PROCESS_EXTRA_BUFFER = 10;
  static final long DEFAULT_BLOCK_TIMEOUT_MILLIS = 50L;
  static final int DEFAULT_SENDER_CAPACITY = 15;
  static final int DEFAULT_SENDER_EXTRA_BUFFER = 10;
  static final long DEFAULT_BATCH_MAX_BYTES = 512L * 1024;
  static final int DEFAULT_BATCH_MAX_EVENTS = 4_096;
  static final long DEFAULT_BATCH_TIMEOUT_MILLIS = 3_000L;
  static final long DEFAULT_SWEEP_INTERVAL_MILLIS = 200L;
  static final long DEFAULT_MAX_PAYLOAD_BYTES = 5L * 1024 * 1024;
  static final int DEFAULT_CONCURRENCY = 4;
  static final int DEFAULT_MAX_RETRIES = 10;
  static final long DEFAULT_BACKOFF_INITIAL_MILLIS = 100L;
  static final long DEFAULT_BACKOFF_MAX_MILLIS = 10_000L;
  static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0d;
  static final long DEFAULT_SEND_TIMEOUT_MILLIS = 15_000L;
  static final int DEFAULT_MAX_REGISTER_ATTEMPTS = 3;
  static final int DEFAULT_OTHER_ERROR_RETRIES = 1;
  static final long DEFAULT_REFILL_INTERVAL_MILLIS = 1_000L;
  static final long DEFAULT_SHUTDOWN_GRACE_MILLIS = 5_000L;
  static final String DEFAULT_KAFKA_TOPIC = "conduit.events";

  private static final int MAX_QUEUE_CAPACITY = 1_000_000;

  /**
   * Validates the snapshot.
   *
   * @throws IllegalArgumentException if the name is malformed or a bound is out of range
   */
  public PipelineConfig {
    name = Strings.sanitizeTopic("pipeline.name", name);
    Objects.requireNonNull(processQueue, "processQueue");
    Objects.requireNonNull(senderQueue, "senderQueue");
    Objects.requireNonNull(batch, "batch");
    format = Objects.requireNonNullElse(format, PayloadFormat.JSON);
    Numbers.requireRange("serializer.maxPayloadBytes", maxPayloadBytes, 1, 256L * 1024 * 1024);
    compression = Objects.requireNonNullElse(compression, CompressionType.GZIP);
    Objects.requireNonNull(flusher, "flusher");
    rateLimits = Objects.requireNonNullElse(rateLimits, RateLimitSettings.unlimited());
    Numbers.requireRange("shutdown.graceMillis", shutdownGraceMillis, 0, 600_000);
    Objects.requireNonNull(destination, "destination");
  }

  /**
   * Creates a configuration from flat key/value pairs.
   *
   * @param kv keys such as {@code pipeline.name}, {@code batch.maxBytes}, {@code flusher.concurrency}
   * @return validated snapshot
   * @throws IllegalArgumentException when a value is malformed or a required key is missing
   */
  public static PipelineConfig fromMap(Map<String, String> kv) {
    Objects.requireNonNull(kv, "kv");
    String rawName = kv.get("pipeline.name");
    if (rawName == null || rawName.isBlank()) {
      throw new IllegalArgumentException("pipeline.name is required");
    }

    QueueSettings processQueue = parseQueue(kv, "processQueue",
        DEFAULT_PROCESS_CAPACITY, DEFAULT_PROCESS_EXTRA_BUFFER, false);
    QueueSettings senderQueue = parseQueue(kv, "senderQueue",
        DEFAULT_SENDER_CAPACITY, DEFAULT_SENDER_EXTRA_BUFFER, true);

    long timeoutMillis = parseBoundedLong(kv, "batch.timeoutMillis", DEFAULT_BATCH_TIMEOUT_MILLIS, 1, 3_600_000);
    BatchSettings batch = new BatchSettings(
        parseBoundedLong(kv, "batch.maxBytes", DEFAULT_BATCH_MAX_BYTES, 1, 64L * 1024 * 1024),
        parseBoundedInt(kv, "batch.maxEvents", DEFAULT_BATCH_MAX_EVENTS, 1, 1_000_000),
        timeoutMillis,
        parseBoundedLong(kv, "batch.sweepIntervalMillis",
            Math.min(DEFAULT_SWEEP_INTERVAL_MILLIS, timeoutMillis), 1, timeoutMillis));

    PayloadFormat format = PayloadFormat.fromString(kv.get("serializer.format"));
    long maxPayloadBytes = parseBoundedLong(
        kv, "serializer.maxPayloadBytes", DEFAULT_MAX_PAYLOAD_BYTES, 1, 256L * 1024 * 1024);
    String rawCompression = kv.get("compression");
    CompressionType compression = rawCompression == null || rawCompression.isBlank()
        ? CompressionType.GZIP
        : CompressionType.fromString(rawCompression);

    FlusherSettings flusher = new FlusherSettings(
        parseBoundedInt(kv, "flusher.concurrency", DEFAULT_CONCURRENCY, 1, 256),
        parseBoundedInt(kv, "flusher.maxRetries", DEFAULT_MAX_RETRIES, 0, 1_000),
        parseBoundedLong(kv, "flusher.backoffInitialMillis", DEFAULT_BACKOFF_INITIAL_MILLIS, 0, 600_000),
        parseBoundedLong(kv, "flusher.backoffMaxMillis", DEFAULT_BACKOFF_MAX_MILLIS, 0, 3_600_000),
        parseDouble(kv, "flusher.backoffMultiplier", DEFAULT_BACKOFF_MULTIPLIER),
        parseBoundedLong(kv, "flusher.sendTimeoutMillis", DEFAULT_SEND_TIMEOUT_MILLIS, 1, 600_000),
        parseBoundedInt(kv, "flusher.maxRegisterAttempts", DEFAULT_MAX_REGISTER_ATTEMPTS, 1, 100),
        parseBoundedInt(kv, "flusher.otherErrorRetries", DEFAULT_OTHER_ERROR_RETRIES, 0, 100));

    Map<RateLimiterScope, Long> quotas = new EnumMap<>(RateLimiterScope.class);
    for (RateLimiterScope scope : RateLimiterScope.values()) {
      String key = "rateLimit." + scope.name().toLowerCase(Locale.ROOT);
      long quota = parseBoundedLong(kv, key, 0, 0, Long.MAX_VALUE);
      if (quota > 0) {
        quotas.put(scope, quota);
      }
    }
    RateLimitSettings rateLimits = new RateLimitSettings(quotas,
        parseBoundedLong(kv, "rateLimit.refillIntervalMillis", DEFAULT_REFILL_INTERVAL_MILLIS, 1, 3_600_000));

    long grace = parseBoundedLong(kv, "shutdown.graceMillis", DEFAULT_SHUTDOWN_GRACE_MILLIS, 0, 600_000);

    String name = rawName.trim();
    DestinationType destinationType = DestinationType.fromString(kv.get("destination.type"));
    DestinationConfig destination = new DestinationConfig(
        destinationType,
        firstNonBlank(kv.get("destination.id"), name + "-" + destinationType.name().toLowerCase(Locale.ROOT)),
        optionalString(kv.get("destination.kafka.bootstrap")),
        firstNonBlank(kv.get("destination.kafka.topic"), DEFAULT_KAFKA_TOPIC),
        parseRoutes(kv.get("destination.routes")),
        flusher.sendTimeoutMillis());

    return new PipelineConfig(name, processQueue, senderQueue, batch, format, maxPayloadBytes, compression,
        flusher, rateLimits, grace, destination);
  }

  private static QueueSettings parseQueue(
      Map<String, String> kv, String prefix, int defaultCapacity, int defaultExtra, boolean sender) {
    int capacity = parseBoundedInt(kv, prefix + ".capacity", defaultCapacity, 1, MAX_QUEUE_CAPACITY);
    int extra = parseBoundedInt(kv, prefix + ".extraBuffer", defaultExtra, 0, MAX_QUEUE_CAPACITY);
    int defaultWatermark = sender ? Math.max(1, capacity * 2 / 3) : capacity;
    int highWatermark = parseBoundedInt(kv, prefix + ".highWatermark", defaultWatermark, 1, capacity + extra);
    OverflowPolicy policy = OverflowPolicy.fromString(kv.get(prefix + ".overflowPolicy"));
    long blockTimeout = parseBoundedLong(
        kv, prefix + ".blockTimeoutMillis", DEFAULT_BLOCK_TIMEOUT_MILLIS, 0, 60_000);
    return new QueueSettings(capacity, extra, highWatermark, policy, blockTimeout);
  }

  private static int parseBoundedInt(Map<String, String> kv, String key, int defaultValue, int min, int max) {
    return (int) parseBoundedLong(kv, key, defaultValue, min, max);
  }

  private static long parseBoundedLong(
      Map<String, String> kv, String key, long defaultValue, long min, long max) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return Numbers.requireRange(key, defaultValue, min, max);
    }
    try {
      return Numbers.requireRange(key, Long.parseLong(raw.trim()), min, max);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer between " + min + " and " + max, ex);
    }
  }

  private static double parseDouble(Map<String, String> kv, String key, double defaultValue) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be a number", ex);
    }
  }

  private static List<QueueKey> parseRoutes(String raw) {
    if (raw == null || raw.isBlank()) {
      return List.of();
    }
    List<QueueKey> routes = new ArrayList<>();
    for (String token : raw.split(",")) {
      if (!token.isBlank()) {
        try {
          routes.add(QueueKey.parse(token));
        } catch (IllegalArgumentException ex) {
          throw new IllegalArgumentException("destination.routes: " + ex.getMessage(), ex);
        }
      }
    }
    return routes;
  }

  private static Optional<String> optionalString(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(value.trim());
  }

  private static String firstNonBlank(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value.trim();
  }
}
