package ca.gc.cra.conduit.infrastructure.sink;

import ca.gc.cra.conduit.application.port.DestinationPort;
import ca.gc.cra.conduit.domain.sink.DeliveryResult;
import ca.gc.cra.conduit.domain.sink.SenderItem;
import ca.gc.cra.conduit.validation.Strings;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Destination that acknowledges every item and writes a summary line to the log.
 * <p><strong>Why:</strong> Lets a pipeline run end to end on a workstation or in a smoke test without a remote
 * endpoint.</p>
 * <p><strong>Thread-safety:</strong> Counters are atomic; safe for concurrent sends.</p>
 * <p><strong>Observability:</strong> One {@code DEBUG} line per item and an {@code INFO} line every
 * {@value #SUMMARY_EVERY} items.</p>
 *
 * @since 0.1.0
 */
public final class LoggingDestination implements DestinationPort {
  private static final Logger log = LoggerFactory.getLogger(LoggingDestination.class);
  private static final long SUMMARY_EVERY = 1_000L;

  private final String id;
  private final AtomicLong items = new AtomicLong();
  private final AtomicLong events = new AtomicLong();
  private final AtomicLong bytes = new AtomicLong();

  /**
   * Creates a logging destination.
   *
   * @param id destination id; non-blank
   */
  public LoggingDestination(String id) {
    this.id = Strings.requireNonBlank("id", id);
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public CompletableFuture<DeliveryResult> send(SenderItem item) {
    long count = items.incrementAndGet();
    long totalEvents = events.addAndGet(item.eventCount());
    long totalBytes = bytes.addAndGet(item.byteSize());
    if (log.isDebugEnabled()) {
      log.debug("{} accepted {} ({} events, {} bytes {} {})", id, item.key(), item.eventCount(),
          item.byteSize(), item.format(), item.compression());
    }
    if (count % SUMMARY_EVERY == 0) {
      log.info("{} accepted {} items, {} events, {} bytes so far", id, count, totalEvents, totalBytes);
    }
    return CompletableFuture.completedFuture(DeliveryResult.success());
  }

  public long deliveredItems() {
    return items.get();
  }

  public long deliveredEvents() {
    return events.get();
  }

  @Override
  public void close() {
    log.info("{} closed after {} items, {} events, {} bytes", id, items.get(), events.get(), bytes.get());
  }
}
