package tiered.cache.core.tier;

/**
 * Where a read found its bytes.
 *
 * @param source tier that answered
 * @param bytes payload, {@code null} for {@link Source#MISS}
 */
public record Lookup(Source source, byte[] bytes) {

  private static final Lookup MISS = new Lookup(Source.MISS, null);

  public enum Source {
    LOCAL,
    REMOTE,
    MISS
  }

  public static Lookup local(byte[] bytes) {
    return new Lookup(Source.LOCAL, bytes);
  }

  public static Lookup remote(byte[] bytes) {
    return new Lookup(Source.REMOTE, bytes);
  }

  public static Lookup miss() {
    return MISS;
  }

  public boolean isHit() {
    return source != Source.MISS;
  }
}
