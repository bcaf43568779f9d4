package ca.gc.cra.conduit.application.port;

/**
 * Signals that a batch cannot be encoded into the destination's wire representation.
 * <p>Never retried: a malformed batch encodes the same way on every attempt.</p>
 *
 * @since 0.1.0
 */
public class SerializationException extends Exception {
  private static final long serialVersionUID = 1L;

  public SerializationException(String message) {
    super(message);
  }

  public SerializationException(String message, Throwable cause) {
    super(message, cause);
  }
}
