package tiered.cache.core.port;

import java.util.Optional;

/**
 * Fixed-capacity in-process byte store (L1).
 *
 * <p>Eviction under capacity pressure is opaque to the cache, and there is no native expiration:
 * staleness is emulated by {@link tiered.cache.core.ttl.StalenessPolicy}. Implementations must be
 * safe for concurrent use.
 */
public interface LocalCache {

  void set(String key, byte[] value);

  Optional<byte[]> get(String key);

  void delete(String key);

  boolean has(String key);
}
