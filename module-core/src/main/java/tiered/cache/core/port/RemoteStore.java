package tiered.cache.core.port;

import java.time.Duration;
import java.util.Optional;

/**
 * Shared, durable key-value backend (L2).
 *
 * <p>Implementations must be safe for concurrent use. Any failure other than "not found" is
 * reported by throwing; the cache wraps it in {@link
 * tiered.cache.error.exception.CacheTransportException} and never retries it.
 */
public interface RemoteStore {

  /**
   * Stores the value.
   *
   * @param ttl expiration; {@link Duration#ZERO} means no expiration
   */
  void set(String key, byte[] value, Duration ttl);

  /**
   * @return the stored bytes, or empty when the key does not exist
   */
  Optional<byte[]> get(String key);

  /**
   * @return number of keys actually removed
   */
  long delete(String key);
}
