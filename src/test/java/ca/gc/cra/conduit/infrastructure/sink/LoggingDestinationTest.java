package ca.gc.cra.conduit.infrastructure.sink;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.conduit.domain.sink.CompressionType;
import ca.gc.cra.conduit.domain.sink.DeliveryResult;
import ca.gc.cra.conduit.domain.sink.PayloadFormat;
import ca.gc.cra.conduit.domain.sink.SenderItem;
import ca.gc.cra.conduit.testutil.Groups;
import org.junit.jupiter.api.Test;

class LoggingDestinationTest {

  private static SenderItem item(int events) {
    return new SenderItem(Groups.KEY, new byte[32], 64, PayloadFormat.JSON, CompressionType.GZIP, events, 1, 0);
  }

  @Test
  void acknowledgesEveryItemAndCountsEvents() throws Exception {
    LoggingDestination destination = new LoggingDestination("local-log");

    DeliveryResult first = destination.send(item(3)).get();
    DeliveryResult second = destination.send(item(4)).get();

    assertTrue(first.isSuccess());
    assertTrue(second.isSuccess());
    assertEquals(2, destination.deliveredItems());
    assertEquals(7, destination.deliveredEvents());
    assertTrue(destination.register().registered());
    assertDoesNotThrow(destination::close);
  }

  @Test
  void requiresId() {
    assertThrows(IllegalArgumentException.class, () -> new LoggingDestination("  "));
    assertEquals("local-log", new LoggingDestination("local-log").id());
  }
}
