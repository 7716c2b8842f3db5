package tiered.cache.core.stats;

/**
 * Point-in-time view of the cache counters.
 *
 * @param hits remote reads that found the key
 * @param misses remote reads that did not (not-found and transport failures alike)
 * @param localHits local lookups that returned a fresh entry
 * @param localMisses local lookups that found nothing or only a stale entry
 */
public record CacheStats(long hits, long misses, long localHits, long localMisses) {}
