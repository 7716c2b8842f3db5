package tiered.cache.core;

import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import tiered.cache.core.coalesce.CoalescingExecutor;
import tiered.cache.core.coalesce.FlightResult;
import tiered.cache.core.executor.ExceptionTranslator;
import tiered.cache.core.executor.LogicExecutor;
import tiered.cache.core.executor.TaskContext;
import tiered.cache.core.port.ValueSerializer;
import tiered.cache.core.stats.CacheStatistics;
import tiered.cache.core.stats.CacheStats;
import tiered.cache.core.tier.LocalTier;
import tiered.cache.core.tier.Lookup;
import tiered.cache.core.tier.TieredAccessor;
import tiered.cache.core.ttl.StalenessPolicy;
import tiered.cache.error.exception.CacheConfigurationException;
import tiered.cache.error.exception.CacheMissException;
import tiered.cache.error.exception.CacheSerializationException;
import tiered.cache.error.exception.CacheTransportException;
import tiered.cache.error.exception.base.BaseException;

/**
 * Read-through, write-through cache over a remote store (L2) and an in-process byte cache (L1).
 *
 * <h4>Operations</h4>
 *
 * <ul>
 *   <li>{@link #set}: encode once, write L1 then L2
 *   <li>{@link #get} / {@link #exists}: L1, then L2 with write-back into L1
 *   <li>{@link #once}: get-or-compute with at most one in-flight producer per key in this process
 *   <li>{@link #delete}: remove from both tiers; the remote store decides whether it was a miss
 *   <li>{@link #stats}: counters, empty when statistics are disabled
 * </ul>
 *
 * <h4>Self-healing decode</h4>
 *
 * <p>When bytes read from a tier no longer decode into the requested type (the value type evolved),
 * {@link #once} deletes the key from both tiers and starts over, so a schema change never needs a
 * manual flush. Bytes a producer just returned are not retried.
 *
 * <p>Thread-safe. When neither tier is configured every method throws {@link
 * CacheConfigurationException}, except {@link #exists}, which reports {@code false}.
 */
@Slf4j
public class TieredCache {

  private final TieredAccessor accessor;
  private final LocalTier localTier;
  private final CoalescingExecutor coalescing;
  private final ValueSerializer serializer;
  private final CacheStatistics statistics;
  private final LogicExecutor executor;

  public TieredCache(CacheOptions options) {
    Objects.requireNonNull(options, "options");
    if (options.getSerializer() == null) {
      throw new CacheConfigurationException("serializer is required");
    }

    this.serializer = options.getSerializer();
    this.executor = options.getExecutor();
    this.statistics = CacheStatistics.of(options.isStatsEnabled());
    this.localTier =
        options.getLocalCache() == null
            ? null
            : new LocalTier(
                options.getLocalCache(),
                StalenessPolicy.forWindow(options.getLocalCacheTtl(), options.getClock()),
                statistics,
                executor);
    this.accessor =
        new TieredAccessor(options.getRemoteStore(), localTier, serializer, statistics, executor);
    this.coalescing = new CoalescingExecutor(options.getClock());

    if (options.getRemoteStore() == null && options.getLocalCache() == null) {
      log.warn(
          "[TieredCache] Neither remote store nor local cache configured, every call will fail");
    } else {
      log.info(
          "[TieredCache] Initialized: remote={}, local={}, localTtl={}, stats={}",
          options.getRemoteStore() != null,
          options.getLocalCache() != null,
          options.getLocalCacheTtl(),
          options.isStatsEnabled());
    }
  }

  /** Caches the item's value, or the producer's result when no value is given. */
  public void set(CacheItem<?> item) {
    String key = requireKey(item);
    Object value = produce(item);
    accessor.write(key, value, item.expiration());
  }

  /**
   * @return the cached value; {@code null} when {@code null} was cached
   * @throws CacheMissException when no tier holds the key
   */
  public <T> T get(String key, Class<T> type) {
    Objects.requireNonNull(key, "key");
    Lookup lookup = accessor.read(key);
    if (!lookup.isHit()) {
      throw new CacheMissException(key);
    }
    return decode(lookup.bytes(), type);
  }

  /**
   * @return {@code true} when a read of the key would succeed; any failure reads as {@code false}
   */
  public boolean exists(String key) {
    Objects.requireNonNull(key, "key");
    return executor.executeOrDefault(
        () -> accessor.read(key).isHit(), false, TaskContext.of("Cache", "Exists", key));
  }

  /**
   * Returns the cached value or computes, caches and returns it, making sure only one producer runs
   * at a time per key. Concurrent callers for the same key wait for that producer and receive the
   * same result, failures included.
   */
  public <T> T once(CacheItem<T> item, Class<T> type) {
    String key = requireKey(item);
    FlightResult result = loadOnce(item);

    try {
      return decode(result.bytes(), type);
    } catch (CacheSerializationException e) {
      if (!result.cached()) {
        throw e;
      }
      log.warn(
          "[TieredCache] Cached bytes no longer decode into {}, evicting and reloading: key={}",
          type.getSimpleName(),
          key);
      evictUndecodable(key, e);
      return once(item, type);
    }
  }

  /**
   * @throws CacheMissException when the remote store had nothing to remove
   */
  public void delete(String key) {
    Objects.requireNonNull(key, "key");
    accessor.delete(key);
  }

  public Optional<CacheStats> stats() {
    return statistics.snapshot();
  }

  /** Number of keys with a coalesced load currently running. */
  public int inFlightCount() {
    return coalescing.inFlightCount();
  }

  private FlightResult loadOnce(CacheItem<?> item) {
    String key = item.getKey();
    if (localTier != null) {
      Optional<byte[]> local = localTier.get(key);
      if (local.isPresent()) {
        return FlightResult.cached(local.get());
      }
    }
    return coalescing.execute(key, item.getContext(), () -> loadOrProduce(item));
  }

  private FlightResult loadOrProduce(CacheItem<?> item) {
    String key = item.getKey();
    Lookup lookup;
    try {
      lookup = accessor.read(key);
    } catch (CacheTransportException e) {
      log.warn("[TieredCache] Remote read failed, falling back to producer: key={}", key);
      lookup = Lookup.miss();
    }
    if (lookup.isHit()) {
      return FlightResult.cached(lookup.bytes());
    }

    Object value = produce(item);
    return FlightResult.fresh(accessor.write(key, value, item.expiration()));
  }

  private Object produce(CacheItem<?> item) {
    String key = item.getKey();
    return executor.executeWithTranslation(
        item::resolveValue,
        ExceptionTranslator.forProducer(key),
        TaskContext.of("Cache", "Produce", key));
  }

  private void evictUndecodable(String key, CacheSerializationException decodeError) {
    try {
      accessor.evict(key);
    } catch (CacheMissException e) {
      log.debug("[TieredCache] Undecodable entry was not in the remote store: key={}", key);
    } catch (RuntimeException deleteError) {
      decodeError.addSuppressed(deleteError);
      throw decodeError;
    }
  }

  private <T> T decode(byte[] bytes, Class<T> type) {
    if (bytes == null || bytes.length == 0) {
      return null;
    }
    try {
      return serializer.decode(bytes, type);
    } catch (BaseException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new CacheSerializationException("decode", type.getName(), e);
    }
  }

  private static String requireKey(CacheItem<?> item) {
    Objects.requireNonNull(item, "item");
    return Objects.requireNonNull(item.getKey(), "key");
  }
}
