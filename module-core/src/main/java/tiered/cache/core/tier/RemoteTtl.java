package tiered.cache.core.tier;

import java.time.Duration;

/**
 * Remote expiration rules. These intentionally differ from the local staleness defaults.
 *
 * <ul>
 *   <li>negative: no expiration ({@link Duration#ZERO})
 *   <li>{@code null} or below one second: {@link #DEFAULT_TTL}
 *   <li>otherwise: as given
 * </ul>
 */
public final class RemoteTtl {

  public static final Duration DEFAULT_TTL = Duration.ofHours(1);
  public static final Duration NO_EXPIRATION = Duration.ZERO;

  private static final Duration MIN_TTL = Duration.ofSeconds(1);

  private RemoteTtl() {}

  public static Duration resolve(Duration requested) {
    if (requested == null) {
      return DEFAULT_TTL;
    }
    if (requested.isNegative()) {
      return NO_EXPIRATION;
    }
    if (requested.compareTo(MIN_TTL) < 0) {
      return DEFAULT_TTL;
    }
    return requested;
  }
}
