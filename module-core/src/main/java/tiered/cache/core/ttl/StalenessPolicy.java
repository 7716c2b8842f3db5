package tiered.cache.core.ttl;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import tiered.cache.error.exception.CacheConfigurationException;

/**
 * Decides how a payload is stored in, and read back from, a local cache that has no native
 * expiration.
 *
 * <p>A local cache that supports per-entry expiration can plug in an identity policy and let the
 * store expire entries itself; the tiered accessor never looks at the stored layout.
 */
public interface StalenessPolicy {

  Duration DEFAULT_WINDOW = Duration.ofMinutes(1);

  /** Payload as it should be handed to the local cache. */
  byte[] wrap(byte[] payload);

  /**
   * @param stored bytes as returned by the local cache
   * @return the original payload, or empty when the entry is stale
   */
  Optional<byte[]> unwrap(byte[] stored);

  /**
   * Maps a configured window to a policy.
   *
   * <ul>
   *   <li>negative: entries never go stale ({@link NeverStalePolicy})
   *   <li>{@code null} or zero: {@link #DEFAULT_WINDOW}
   *   <li>positive: exact window
   * </ul>
   *
   * @throws CacheConfigurationException if the window exceeds {@link
   *     TimestampCodec#MAX_WINDOW_MILLIS}
   */
  static StalenessPolicy forWindow(Duration window, Clock clock) {
    if (window != null && window.isNegative()) {
      return NeverStalePolicy.INSTANCE;
    }
    Duration effective = (window == null || window.isZero()) ? DEFAULT_WINDOW : window;
    if (effective.toMillis() > TimestampCodec.MAX_WINDOW_MILLIS) {
      throw new CacheConfigurationException(
          "local cache ttl " + effective + " exceeds " + TimestampCodec.MAX_WINDOW_MILLIS + "ms");
    }
    return new TimestampSuffixPolicy(effective, clock);
  }
}
