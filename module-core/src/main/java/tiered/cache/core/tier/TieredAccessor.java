package tiered.cache.core.tier;

import java.time.Duration;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import tiered.cache.core.executor.ExceptionTranslator;
import tiered.cache.core.executor.LogicExecutor;
import tiered.cache.core.executor.TaskContext;
import tiered.cache.core.port.RemoteStore;
import tiered.cache.core.port.ValueSerializer;
import tiered.cache.core.stats.CacheStatistics;
import tiered.cache.error.exception.CacheConfigurationException;
import tiered.cache.error.exception.CacheMissException;
import tiered.cache.error.exception.CacheSerializationException;
import tiered.cache.error.exception.base.BaseException;

/**
 * 2층 구조 캐시 접근기 (L1: local, L2: remote)
 *
 * <h4>Read</h4>
 *
 * <ol>
 *   <li>L1 hit short-circuits; L2 is not consulted, so the tiers may transiently disagree
 *   <li>L2 not-found is a miss; any other L2 failure is counted as a miss and propagated
 *   <li>L2 hit is written back into L1 before returning
 * </ol>
 *
 * <h4>Write</h4>
 *
 * <p>Encode once, L1 (best-effort), then L2 (failures propagate). The encoded bytes are returned so
 * callers can share them without encoding again.
 *
 * <p>Either tier may be absent, not both: with neither, every operation throws {@link
 * CacheConfigurationException}.
 */
@Slf4j
public class TieredAccessor {

  private static final byte[] EMPTY = new byte[0];

  private final RemoteStore remote;
  private final LocalTier local;
  private final ValueSerializer serializer;
  private final CacheStatistics statistics;
  private final LogicExecutor executor;

  /**
   * @param remote L2, {@code null} when not configured
   * @param local L1, {@code null} when not configured
   */
  public TieredAccessor(
      RemoteStore remote,
      LocalTier local,
      ValueSerializer serializer,
      CacheStatistics statistics,
      LogicExecutor executor) {
    this.remote = remote;
    this.local = local;
    this.serializer = serializer;
    this.statistics = statistics;
    this.executor = executor;
  }

  /**
   * @param ttl resolved remote expiration ({@link RemoteTtl})
   * @return the encoded bytes written to both tiers
   */
  public byte[] write(String key, Object value, Duration ttl) {
    byte[] bytes = encode(key, value);

    if (local != null) {
      local.set(key, bytes);
    }

    if (remote == null) {
      if (local == null) {
        throw new CacheConfigurationException();
      }
      return bytes;
    }

    executor.executeWithTranslation(
        () -> {
          remote.set(key, bytes, ttl);
          return null;
        },
        ExceptionTranslator.forRemoteStore("SET", key),
        TaskContext.of("Cache", "RemoteSet", key));
    return bytes;
  }

  public Lookup read(String key) {
    if (local != null) {
      Optional<byte[]> cached = local.get(key);
      if (cached.isPresent()) {
        return Lookup.local(cached.get());
      }
    }

    if (remote == null) {
      if (local == null) {
        throw new CacheConfigurationException();
      }
      return Lookup.miss();
    }

    Optional<byte[]> found;
    try {
      found =
          executor.executeWithTranslation(
              () -> remote.get(key),
              ExceptionTranslator.forRemoteStore("GET", key),
              TaskContext.of("Cache", "RemoteGet", key));
    } catch (RuntimeException e) {
      statistics.recordMiss();
      throw e;
    }

    if (found == null || found.isEmpty()) {
      statistics.recordMiss();
      return Lookup.miss();
    }

    statistics.recordHit();
    byte[] bytes = found.get();
    if (local != null) {
      local.set(key, bytes);
    }
    return Lookup.remote(bytes);
  }

  /**
   * Removes the key from both tiers.
   *
   * <p>Local-only presence is not authoritative: with a remote store configured, a key it did not
   * hold is reported as {@link CacheMissException} even though the local entry was removed.
   */
  public void delete(String key) {
    if (local != null) {
      if (log.isDebugEnabled()) {
        log.debug("[TieredCache] Local delete: key={}, present={}", key, local.has(key));
      }
      local.delete(key);
    }
    deleteRemote(key);
  }

  /**
   * Like {@link #delete}, but a local removal failure propagates instead of being logged, so the
   * caller never assumes an entry is gone while the local tier still serves it.
   */
  public void evict(String key) {
    if (local != null) {
      local.deleteStrict(key);
    }
    deleteRemote(key);
  }

  private void deleteRemote(String key) {

    if (remote == null) {
      if (local == null) {
        throw new CacheConfigurationException();
      }
      return;
    }

    long deleted =
        executor.executeWithTranslation(
            () -> remote.delete(key),
            ExceptionTranslator.forRemoteStore("DEL", key),
            TaskContext.of("Cache", "RemoteDelete", key));
    if (deleted == 0) {
      throw new CacheMissException(key);
    }
  }

  private byte[] encode(String key, Object value) {
    if (value == null) {
      return EMPTY;
    }
    return executor.executeWithTranslation(
        () -> serializer.encode(value),
        (error, context) ->
            error instanceof BaseException be
                ? be
                : new CacheSerializationException(
                    "encode", value.getClass().getName() + " (key: " + key + ")", error),
        TaskContext.of("Cache", "Encode", key));
  }
}
