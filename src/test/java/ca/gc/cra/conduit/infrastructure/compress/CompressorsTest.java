package ca.gc.cra.conduit.infrastructure.compress;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.conduit.application.port.PayloadCompressor;
import ca.gc.cra.conduit.domain.sink.CompressionType;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class CompressorsTest {
  private static final byte[] PAYLOAD =
      "{\"source\":\"/var/log/app.log\",\"events\":[]}\n".repeat(200).getBytes(StandardCharsets.UTF_8);

  @Test
  void forTypeReturnsSharedInstances() {
    assertSame(NoneCompressor.INSTANCE, Compressors.forType(CompressionType.NONE));
    assertSame(GzipCompressor.INSTANCE, Compressors.forType(CompressionType.GZIP));
    assertSame(DeflateCompressor.INSTANCE, Compressors.forType(CompressionType.DEFLATE));
  }

  @Test
  void gzipShrinksRepetitivePayloadAndRestoresIt() throws IOException {
    PayloadCompressor gzip = Compressors.forType(CompressionType.GZIP);

    byte[] compressed = gzip.compress(PAYLOAD);

    assertTrue(compressed.length < PAYLOAD.length / 4);
    assertEquals((byte) 0x1f, compressed[0]);
    assertEquals((byte) 0x8b, compressed[1]);
    assertArrayEquals(PAYLOAD, gzip.decompress(compressed));
  }

  @Test
  void deflateUsesZlibFraming() throws IOException {
    PayloadCompressor deflate = Compressors.forType(CompressionType.DEFLATE);

    byte[] compressed = deflate.compress(PAYLOAD);

    assertEquals((byte) 0x78, compressed[0]);
    assertArrayEquals(PAYLOAD, deflate.decompress(compressed));
  }

  @Test
  void noneIsPassThrough() throws IOException {
    PayloadCompressor none = Compressors.forType(CompressionType.NONE);
    assertSame(PAYLOAD, none.compress(PAYLOAD));
    assertSame(PAYLOAD, none.decompress(PAYLOAD));
  }

  @Test
  void corruptInputFailsWithIoException() {
    byte[] garbage = "not compressed".getBytes(StandardCharsets.UTF_8);
    assertThrows(IOException.class, () -> Compressors.forType(CompressionType.GZIP).decompress(garbage));
    assertThrows(IOException.class, () -> Compressors.forType(CompressionType.DEFLATE).decompress(garbage));
  }
}
