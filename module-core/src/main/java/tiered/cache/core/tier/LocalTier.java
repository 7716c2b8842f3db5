package tiered.cache.core.tier;

import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import tiered.cache.core.executor.LogicExecutor;
import tiered.cache.core.executor.TaskContext;
import tiered.cache.core.port.LocalCache;
import tiered.cache.core.stats.CacheStatistics;
import tiered.cache.core.ttl.StalenessPolicy;

/**
 * L1 access with staleness emulation.
 *
 * <p>The local tier is advisory: failures of the underlying {@link LocalCache} are logged and read
 * as a miss (get) or ignored (set/delete), so they never block the remote path. A stored entry that
 * violates the staleness layout is a programming error and is not absorbed.
 */
@Slf4j
public class LocalTier {

  private final LocalCache cache;
  private final StalenessPolicy stalenessPolicy;
  private final CacheStatistics statistics;
  private final LogicExecutor executor;

  public LocalTier(
      LocalCache cache,
      StalenessPolicy stalenessPolicy,
      CacheStatistics statistics,
      LogicExecutor executor) {
    this.cache = cache;
    this.stalenessPolicy = stalenessPolicy;
    this.statistics = statistics;
    this.executor = executor;
  }

  public void set(String key, byte[] payload) {
    byte[] stored = stalenessPolicy.wrap(payload);
    executor.executeOrDefault(
        () -> {
          cache.set(key, stored);
          return null;
        },
        null,
        TaskContext.of("LocalTier", "Set", key));
  }

  public Optional<byte[]> get(String key) {
    Optional<byte[]> stored =
        executor.executeOrDefault(
            () -> cache.get(key), Optional.empty(), TaskContext.of("LocalTier", "Get", key));

    Optional<byte[]> payload = stored.flatMap(stalenessPolicy::unwrap);
    if (payload.isPresent()) {
      statistics.recordLocalHit();
    } else {
      statistics.recordLocalMiss();
      if (stored.isPresent()) {
        log.debug("[LocalTier] Stale entry ignored: key={}", key);
      }
    }
    return payload;
  }

  public void delete(String key) {
    executor.executeOrDefault(
        () -> {
          cache.delete(key);
          return null;
        },
        null,
        TaskContext.of("LocalTier", "Delete", key));
  }

  /**
   * Removes the key and propagates a failure of the underlying cache, for callers that must know
   * the entry is gone.
   */
  public void deleteStrict(String key) {
    executor.executeVoid(
        () -> cache.delete(key), TaskContext.of("LocalTier", "DeleteStrict", key));
  }

  /** Physical presence, stale entries included. */
  public boolean has(String key) {
    return executor.executeOrDefault(
        () -> cache.has(key), false, TaskContext.of("LocalTier", "Has", key));
  }
}
