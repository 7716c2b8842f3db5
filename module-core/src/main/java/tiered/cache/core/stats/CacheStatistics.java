package tiered.cache.core.stats;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hit/miss counters touched on every read.
 *
 * <p>Counters only grow and live as long as the cache. A disabled instance records nothing and
 * returns no snapshot, so callers can tell "no data" apart from "no activity".
 */
public class CacheStatistics {

  private final boolean enabled;
  private final AtomicLong hits = new AtomicLong();
  private final AtomicLong misses = new AtomicLong();
  private final AtomicLong localHits = new AtomicLong();
  private final AtomicLong localMisses = new AtomicLong();

  private CacheStatistics(boolean enabled) {
    this.enabled = enabled;
  }

  public static CacheStatistics enabled() {
    return new CacheStatistics(true);
  }

  public static CacheStatistics disabled() {
    return new CacheStatistics(false);
  }

  public static CacheStatistics of(boolean enabled) {
    return enabled ? enabled() : disabled();
  }

  public boolean isEnabled() {
    return enabled;
  }

  public void recordHit() {
    if (enabled) {
      hits.incrementAndGet();
    }
  }

  public void recordMiss() {
    if (enabled) {
      misses.incrementAndGet();
    }
  }

  public void recordLocalHit() {
    if (enabled) {
      localHits.incrementAndGet();
    }
  }

  public void recordLocalMiss() {
    if (enabled) {
      localMisses.incrementAndGet();
    }
  }

  public Optional<CacheStats> snapshot() {
    if (!enabled) {
      return Optional.empty();
    }
    return Optional.of(
        new CacheStats(hits.get(), misses.get(), localHits.get(), localMisses.get()));
  }
}
