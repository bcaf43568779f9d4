package ca.gc.cra.conduit.application.metrics;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * <strong>What:</strong> Process-wide collection of {@link MetricsRecord}s.
 * <p><strong>Why:</strong> Gives the external collector one place to scrape a flat list of label/value maps, one
 * per component instance.</p>
 * <p><strong>Thread-safety:</strong> Registration and export may run concurrently; the record list is
 * copy-on-write because records are created rarely and exported often.</p>
 *
 * @since 0.1.0
 */
public final class MetricsRegistry {
  private final List<MetricsRecord> records = new CopyOnWriteArrayList<>();

  /**
   * Creates and registers a record with the given labels.
   *
   * @param labels label set identifying the component instance
   * @return registered record
   */
  public MetricsRecord register(Map<String, String> labels) {
    MetricsRecord record = new MetricsRecord(labels);
    records.add(record);
    return record;
  }

  /**
   * Removes a record so it no longer appears in exports.
   *
   * @param record record previously returned by {@link #register(Map)}; {@code null} is ignored
   */
  public void unregister(MetricsRecord record) {
    if (record != null) {
      records.remove(record);
    }
  }

  /**
   * Returns the live records.
   *
   * @return unmodifiable snapshot of the registered records
   */
  public List<MetricsRecord> records() {
    return List.copyOf(records);
  }

  /**
   * Finds records whose labels contain every entry of {@code selector}.
   *
   * @param selector label subset to match
   * @return matching records in registration order
   */
  public List<MetricsRecord> find(Map<String, String> selector) {
    Objects.requireNonNull(selector, "selector");
    List<MetricsRecord> matches = new ArrayList<>();
    for (MetricsRecord record : records) {
      if (record.labels().entrySet().containsAll(selector.entrySet())) {
        matches.add(record);
      }
    }
    return matches;
  }

  /**
   * Sums one metric over every record matching {@code selector}.
   *
   * @param selector label subset to match
   * @param metric metric name
   * @return summed value
   */
  public long sum(Map<String, String> selector, String metric) {
    long total = 0;
    for (MetricsRecord record : find(selector)) {
      total += record.value(metric);
    }
    return total;
  }

  /**
   * Exports every record as a flat string map.
   *
   * @return one map per record
   */
  public List<Map<String, String>> export() {
    List<Map<String, String>> out = new ArrayList<>(records.size());
    for (MetricsRecord record : records) {
      out.add(record.export());
    }
    return out;
  }
}
