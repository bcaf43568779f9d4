package ca.gc.cra.conduit.application.metrics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * <strong>What:</strong> Counters and gauges of one component instance, tagged with a fixed label set.
 * <p><strong>Role:</strong> Unit of the flat metrics export; one record per queue lane, batcher, runner, etc.</p>
 * <p><strong>Thread-safety:</strong> Counters use {@link LongAdder}, gauges {@link AtomicLong}; instruments are
 * created lazily through concurrent maps so any thread may update any metric.</p>
 *
 * @since 0.1.0
 */
public final class MetricsRecord {
  static final String LABEL_PREFIX = "label.";
  static final String VALUE_PREFIX = "value.";

  private final Map<String, String> labels;
  private final ConcurrentMap<String, LongAdder> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, AtomicLong> gauges = new ConcurrentHashMap<>();

  MetricsRecord(Map<String, String> labels) {
    this.labels = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(labels, "labels")));
  }

  public Map<String, String> labels() {
    return labels;
  }

  /**
   * Returns (creating on first use) the named counter.
   *
   * @param name metric name, see {@link MetricNames}
   * @return live counter
   */
  public LongAdder counter(String name) {
    return counters.computeIfAbsent(Objects.requireNonNull(name, "name"), k -> new LongAdder());
  }

  /**
   * Returns (creating on first use) the named gauge.
   *
   * @param name metric name, see {@link MetricNames}
   * @return live gauge
   */
  public AtomicLong gauge(String name) {
    return gauges.computeIfAbsent(Objects.requireNonNull(name, "name"), k -> new AtomicLong());
  }

  /**
   * Reads a counter or gauge value without creating it.
   *
   * @param name metric name
   * @return current value, or {@code 0} when the metric was never touched
   */
  public long value(String name) {
    LongAdder counter = counters.get(name);
    if (counter != null) {
      return counter.sum();
    }
    AtomicLong gauge = gauges.get(name);
    return gauge == null ? 0L : gauge.get();
  }

  /**
   * Snapshots current values.
   *
   * @return metric name to value, counters and gauges combined
   */
  public Map<String, Long> values() {
    Map<String, Long> snapshot = new LinkedHashMap<>();
    counters.forEach((name, counter) -> snapshot.put(name, counter.sum()));
    gauges.forEach((name, gauge) -> snapshot.put(name, gauge.get()));
    return snapshot;
  }

  /**
   * Renders this record as a flat string map with {@code label.} and {@code value.} prefixed keys.
   *
   * @return export map suitable for an external scraper
   */
  public Map<String, String> export() {
    Map<String, String> out = new LinkedHashMap<>();
    labels.forEach((key, value) -> out.put(LABEL_PREFIX + key, value));
    values().forEach((name, value) -> out.put(VALUE_PREFIX + name, Long.toString(value)));
    return out;
  }
}
