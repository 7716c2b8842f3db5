package tiered.cache.core.coalesce;

/**
 * Outcome of a coalesced load, identical for the leader and every follower.
 *
 * @param bytes encoded value
 * @param cached {@code true} when the bytes came from a cache tier, {@code false} when a producer
 *     computed them during this load
 */
public record FlightResult(byte[] bytes, boolean cached) {

  public static FlightResult cached(byte[] bytes) {
    return new FlightResult(bytes, true);
  }

  public static FlightResult fresh(byte[] bytes) {
    return new FlightResult(bytes, false);
  }
}
