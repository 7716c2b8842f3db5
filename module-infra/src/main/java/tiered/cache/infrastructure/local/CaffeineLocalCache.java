package tiered.cache.infrastructure.local;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.util.Optional;
import java.util.concurrent.Executor;
import tiered.cache.core.port.LocalCache;

/**
 * Caffeine 기반 L1 바이트 캐시
 *
 * <p>Capacity is bounded by total payload bytes (key chars count twice, UTF-16) rather than entry
 * count, so large values cannot crowd the heap. No expiration is configured here: staleness is
 * tracked inside the stored bytes by the core.
 */
public class CaffeineLocalCache implements LocalCache {

  private final Cache<String, byte[]> cache;

  public CaffeineLocalCache(long maximumWeightBytes) {
    this(maximumWeightBytes, null);
  }

  CaffeineLocalCache(long maximumWeightBytes, Executor maintenanceExecutor) {
    Caffeine<String, byte[]> builder =
        Caffeine.newBuilder()
            .maximumWeight(maximumWeightBytes)
            .weigher((String key, byte[] value) -> key.length() * 2 + value.length);
    if (maintenanceExecutor != null) {
      builder.executor(maintenanceExecutor);
    }
    this.cache = builder.build();
  }

  @Override
  public void set(String key, byte[] value) {
    cache.put(key, value);
  }

  @Override
  public Optional<byte[]> get(String key) {
    return Optional.ofNullable(cache.getIfPresent(key));
  }

  @Override
  public void delete(String key) {
    cache.invalidate(key);
  }

  @Override
  public boolean has(String key) {
    return cache.asMap().containsKey(key);
  }

  /** 근사치 엔트리 수 (모니터링용) */
  public long estimatedSize() {
    return cache.estimatedSize();
  }

  void cleanUp() {
    cache.cleanUp();
  }
}
