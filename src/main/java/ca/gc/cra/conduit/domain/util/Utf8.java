package ca.gc.cra.conduit.domain.util;

/**
 * UTF-8 helpers shared by the domain layer.
 *
 * @since 0.1.0
 */
public final class Utf8 {
  private Utf8() {}

  /**
   * Counts the bytes {@code value} occupies when encoded as UTF-8 without allocating the encoding.
   *
   * @param value text to measure; {@code null} counts as zero bytes
   * @return encoded length in bytes
   */
  public static int encodedLength(CharSequence value) {
    if (value == null) {
      return 0;
    }
    int bytes = 0;
    int len = value.length();
    for (int i = 0; i < len; i++) {
      char c = value.charAt(i);
      if (c < 0x80) {
        bytes += 1;
      } else if (c < 0x800) {
        bytes += 2;
      } else if (Character.isHighSurrogate(c) && i + 1 < len && Character.isLowSurrogate(value.charAt(i + 1))) {
        bytes += 4;
        i++;
      } else {
        bytes += 3;
      }
    }
    return bytes;
  }
}
