package tiered.cache.infrastructure.metrics;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import java.util.function.ToLongFunction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tiered.cache.core.TieredCache;
import tiered.cache.core.stats.CacheStats;

/**
 * TieredCache Micrometer 바인더
 *
 * <pre>
 * - cache_requests_total{result=hit|miss, layer=remote|local} : FunctionCounter
 * - cache_once_inflight                                       : Gauge
 * </pre>
 *
 * <p>Counters read the cache's own statistics on scrape, so nothing is recorded twice. With
 * statistics disabled they stay at zero.
 */
@Slf4j
@RequiredArgsConstructor
public class TieredCacheMetrics implements MeterBinder {

  private static final String REQUESTS = "cache.requests";

  private final TieredCache cache;

  @Override
  public void bindTo(MeterRegistry registry) {
    counter(registry, "hit", "remote", CacheStats::hits);
    counter(registry, "miss", "remote", CacheStats::misses);
    counter(registry, "hit", "local", CacheStats::localHits);
    counter(registry, "miss", "local", CacheStats::localMisses);

    Gauge.builder("cache.once.inflight", cache, TieredCache::inFlightCount)
        .description("Keys with a coalesced load currently running")
        .register(registry);

    log.info(
        "[TieredCacheMetrics] Registered: {} (hit/miss x remote/local), cache.once.inflight",
        REQUESTS);
  }

  private void counter(
      MeterRegistry registry, String result, String layer, ToLongFunction<CacheStats> reader) {
    FunctionCounter.builder(
            REQUESTS, cache, c -> c.stats().map(reader::applyAsLong).orElse(0L).doubleValue())
        .description("Cache lookups by result and tier")
        .tag("result", result)
        .tag("layer", layer)
        .register(registry);
  }
}
