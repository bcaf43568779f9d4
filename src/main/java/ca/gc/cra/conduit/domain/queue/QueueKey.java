package ca.gc.cra.conduit.domain.queue;

import java.util.Objects;

/**
 * <strong>What:</strong> Identity of a logical destination stream.
 * <p><strong>Why:</strong> Selects the batcher bucket, sender queue, and rate-limiter scopes for an event group.</p>
 * <p><strong>Role:</strong> Domain value object used as the key of every per-stream structure.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe as a hash key.</p>
 *
 * @param region destination region; non-blank
 * @param project destination project; non-blank
 * @param logstore logical store inside the project; non-blank
 * @param shard shard or partition hint; empty when the destination picks one
 * @since 0.1.0
 */
public record QueueKey(String region, String project, String logstore, String shard) {

  /**
   * Validates the key components.
   *
   * @throws IllegalArgumentException if region, project, or logstore are blank
   */
  public QueueKey {
    region = requireText("region", region);
    project = requireText("project", project);
    logstore = requireText("logstore", logstore);
    shard = shard == null ? "" : shard.trim();
  }

  /**
   * Creates a key without a shard hint.
   *
   * @param region destination region
   * @param project destination project
   * @param logstore logical store
   * @return new key
   */
  public static QueueKey of(String region, String project, String logstore) {
    return new QueueKey(region, project, logstore, "");
  }

  /**
   * Parses the {@link #toString()} form {@code region/project/logstore[#shard]}.
   *
   * @param text key text
   * @return parsed key
   * @throws IllegalArgumentException if the text does not have three non-blank path segments
   */
  public static QueueKey parse(String text) {
    Objects.requireNonNull(text, "text");
    String path = text.trim();
    String shard = "";
    int hash = path.indexOf('#');
    if (hash >= 0) {
      shard = path.substring(hash + 1);
      path = path.substring(0, hash);
    }
    String[] parts = path.split("/", -1);
    if (parts.length != 3) {
      throw new IllegalArgumentException("queue key must look like region/project/logstore: " + text);
    }
    return new QueueKey(parts[0], parts[1], parts[2], shard);
  }

  @Override
  public String toString() {
    String base = region + "/" + project + "/" + logstore;
    return shard.isEmpty() ? base : base + "#" + shard;
  }

  private static String requireText(String name, String value) {
    Objects.requireNonNull(value, name);
    String trimmed = value.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
    return trimmed;
  }
}
