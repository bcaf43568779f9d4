package ca.gc.cra.conduit.application.pipeline;

import ca.gc.cra.conduit.application.metrics.MetricNames;
import ca.gc.cra.conduit.application.metrics.MetricsRecord;
import ca.gc.cra.conduit.application.queue.BoundedQueue;
import ca.gc.cra.conduit.domain.event.Batch;
import ca.gc.cra.conduit.domain.queue.QueueKey;
import ca.gc.cra.conduit.domain.sink.SenderItem;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Maps a closed batch to the sender queue lane of its {@link QueueKey}.
 * <p><strong>Why:</strong> Routes can disappear while batches are in flight; a batch without a route has nowhere
 * to go and is discarded, never retried.</p>
 * <p><strong>Thread-safety:</strong> Route table is a concurrent map; {@link #route(Batch)} holds no lock.</p>
 *
 * @since 0.1.0
 */
public final class Router {
  private static final Logger log = LoggerFactory.getLogger(Router.class);
  private static final int UNROUTED_LOG_INTERVAL = 100;

  private final MetricsRecord record;
  private final ConcurrentMap<QueueKey, Route> routes = new ConcurrentHashMap<>();
  private final AtomicInteger unroutedLogLimiter = new AtomicInteger();

  public Router(MetricsRecord record) {
    this.record = Objects.requireNonNull(record, "record");
  }

  /**
   * Installs or replaces the route of {@code key}.
   *
   * @param key stream identity
   * @param destinationId destination serving the stream
   * @param lane sender queue lane of the stream
   */
  public void bind(QueueKey key, String destinationId, BoundedQueue<SenderItem> lane) {
    routes.put(Objects.requireNonNull(key, "key"), new Route(destinationId, lane));
  }

  /**
   * Removes the route of {@code key}.
   *
   * @param key stream identity
   * @return removed route, if any
   */
  public Optional<Route> unbind(QueueKey key) {
    return Optional.ofNullable(routes.remove(key));
  }

  public Optional<Route> routeFor(QueueKey key) {
    return Optional.ofNullable(routes.get(key));
  }

  public Map<QueueKey, Route> routes() {
    return Map.copyOf(routes);
  }

  /**
   * Resolves the lane for a batch. Unresolvable batches are counted as discarded here.
   *
   * @param batch closed batch
   * @return target route, or empty when no route exists
   */
  public Optional<Route> route(Batch batch) {
    record.counter(MetricNames.IN_ITEMS_TOTAL).increment();
    record.counter(MetricNames.IN_EVENTS_TOTAL).add(batch.eventCount());
    Route route = routes.get(batch.key());
    if (route == null) {
      record.counter(MetricNames.DISCARDED_ITEMS_TOTAL).increment();
      record.counter(MetricNames.DISCARDED_EVENTS_TOTAL).add(batch.eventCount());
      record.counter(MetricNames.DISCARDED_SIZE_BYTES).add(batch.byteSize());
      int count = unroutedLogLimiter.incrementAndGet();
      if (count == 1 || count % UNROUTED_LOG_INTERVAL == 0) {
        log.warn("No route for {}; discarded batch of {} events ({} unrouted so far)",
            batch.key(), batch.eventCount(), count);
      }
      return Optional.empty();
    }
    record.counter(MetricNames.OUT_ITEMS_TOTAL).increment();
    record.counter(MetricNames.OUT_EVENTS_TOTAL).add(batch.eventCount());
    return Optional.of(route);
  }

  /**
   * Resolved target of a stream.
   *
   * @param destinationId destination serving the stream
   * @param lane sender queue lane
   */
  public record Route(String destinationId, BoundedQueue<SenderItem> lane) {
    public Route {
      Objects.requireNonNull(destinationId, "destinationId");
      Objects.requireNonNull(lane, "lane");
    }
  }
}
