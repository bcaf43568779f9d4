package ca.gc.cra.conduit.infrastructure.metrics;

import ca.gc.cra.conduit.application.metrics.MetricsRecord;
import ca.gc.cra.conduit.application.metrics.MetricsRegistry;
import ca.gc.cra.conduit.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.ObservableLongGauge;
import io.opentelemetry.api.metrics.ObservableLongMeasurement;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Forwards {@link MetricsPort} counters and histograms to OpenTelemetry and publishes
 * {@link MetricsRegistry} records as an observable gauge.
 * <p><strong>Why:</strong> The flat registry export serves the local collector; the same numbers are pushed to an
 * OTLP backend without each component knowing about OpenTelemetry.</p>
 * <p><strong>Thread-safety:</strong> Instruments are created lazily through concurrent maps; gauge callbacks read
 * registry snapshots.</p>
 * <p><strong>Observability:</strong> Registry values are exported as {@code conduit.component.value} with the
 * record labels plus {@code metric} as attributes.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("conduit.metric.key");
  private static final String METRIC_ATTRIBUTE = "metric";
  private static final String FALLBACK_METRIC_NAME = "conduit.metric";
  static final String COMPONENT_GAUGE_NAME = "conduit.component.value";

  private final MetricsDelegate delegate;
  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final List<ObservableLongGauge> gauges = new CopyOnWriteArrayList<>();

  /**
   * Creates an adapter wired to the environment-configured OpenTelemetry exporter.
   */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    if (bootstrap.isNoop()) {
      log.info("OpenTelemetry metrics adapter running in noop mode");
      this.delegate = NoopDelegate.INSTANCE;
    } else {
      this.delegate = new OtelDelegate(bootstrap.meter());
    }
  }

  @Override
  public void increment(String key) {
    delegate.increment(key);
  }

  @Override
  public void observe(String key, long value) {
    delegate.observe(key, value);
  }

  /**
   * Publishes every value of every record in {@code registry} on each collection.
   *
   * @param registry component registry to observe
   */
  public void bind(MetricsRegistry registry) {
    Objects.requireNonNull(registry, "registry");
    if (bootstrap.isNoop()) {
      return;
    }
    ObservableLongGauge gauge = bootstrap.meter()
        .gaugeBuilder(COMPONENT_GAUGE_NAME)
        .ofLongs()
        .setDescription("Pipeline component counters and gauges")
        .buildWithCallback(measurement -> observeRegistry(registry, measurement));
    gauges.add(gauge);
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    for (ObservableLongGauge gauge : gauges) {
      gauge.close();
    }
    gauges.clear();
    bootstrap.close();
  }

  private static void observeRegistry(MetricsRegistry registry, ObservableLongMeasurement measurement) {
    for (MetricsRecord record : registry.records()) {
      AttributesBuilder labels = Attributes.builder();
      record.labels().forEach((key, value) -> labels.put(AttributeKey.stringKey(key), value));
      Attributes base = labels.build();
      for (Map.Entry<String, Long> value : record.values().entrySet()) {
        measurement.record(value.getValue(), base.toBuilder().put(METRIC_ATTRIBUTE, value.getKey()).build());
      }
    }
  }

  private interface MetricsDelegate {
    void increment(String key);

    void observe(String key, long value);
  }

  private static final class NoopDelegate implements MetricsDelegate {
    private static final NoopDelegate INSTANCE = new NoopDelegate();

    @Override
    public void increment(String key) {
      // no-op
    }

    @Override
    public void observe(String key, long value) {
      // no-op
    }
  }

  private static final class OtelDelegate implements MetricsDelegate {
    private final Meter meter;
    private final ConcurrentMap<String, CounterInstrument> counters = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, HistogramInstrument> histograms = new ConcurrentHashMap<>();

    private OtelDelegate(Meter meter) {
      this.meter = Objects.requireNonNull(meter, "meter");
    }

    @Override
    public void increment(String key) {
      CounterInstrument instrument =
          counters.computeIfAbsent(Objects.requireNonNull(key, "key"), this::createCounter);
      instrument.counter().add(1, instrument.attributes());
    }

    @Override
    public void observe(String key, long value) {
      HistogramInstrument instrument =
          histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), this::createHistogram);
      instrument.histogram().record(value, instrument.attributes());
    }

    private CounterInstrument createCounter(String key) {
      LongCounter counter = meter
          .counterBuilder(sanitizeName(key))
          .setUnit("1")
          .setDescription("Counter for " + key)
          .build();
      return new CounterInstrument(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
    }

    private HistogramInstrument createHistogram(String key) {
      LongHistogram histogram = meter
          .histogramBuilder(sanitizeName(key))
          .ofLongs()
          .setDescription("Observation for " + key)
          .build();
      return new HistogramInstrument(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
    }
  }

  static String sanitizeName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      result.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    String sanitized = result.toString();
    if (!sanitized.equals(key)) {
      log.debug("Sanitized metric name '{}' -> '{}'", key, sanitized);
    }
    return sanitized;
  }

  private record CounterInstrument(LongCounter counter, Attributes attributes) {}

  private record HistogramInstrument(LongHistogram histogram, Attributes attributes) {}
}
