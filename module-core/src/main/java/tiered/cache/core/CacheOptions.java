package tiered.cache.core;

import java.time.Clock;
import java.time.Duration;
import lombok.Builder;
import lombok.Getter;
import tiered.cache.core.executor.DefaultLogicExecutor;
import tiered.cache.core.executor.LogicExecutor;
import tiered.cache.core.port.LocalCache;
import tiered.cache.core.port.RemoteStore;
import tiered.cache.core.port.ValueSerializer;

/**
 * Construction-time configuration of a {@link TieredCache}; never re-read per call.
 *
 * <p>{@code localCacheTtl} regimes: negative → local entries never go stale, {@code null}/zero →
 * one minute, positive → exact window.
 */
@Getter
@Builder(toBuilder = true)
public class CacheOptions {

  /** L2, may be {@code null}. */
  private final RemoteStore remoteStore;

  /** L1, may be {@code null}. */
  private final LocalCache localCache;

  private final Duration localCacheTtl;

  private final boolean statsEnabled;

  private final ValueSerializer serializer;

  @Builder.Default private final Clock clock = Clock.systemUTC();

  @Builder.Default private final LogicExecutor executor = new DefaultLogicExecutor();
}
