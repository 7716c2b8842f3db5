package tiered.cache.core.ttl;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Optional;
import lombok.Getter;

/**
 * Appends the write instant ({@link TimestampCodec}) to every non-empty payload and reports entries
 * older than the window as absent.
 *
 * <p>Stale entries are not removed here; the next write or capacity eviction replaces them. Empty
 * payloads carry no suffix and never go stale.
 *
 * <p>A write instant ahead of the clock (wall clock stepped backwards) is fresh as long as the step
 * is within the window. Anything further ahead is treated like an entry older than the window.
 */
public class TimestampSuffixPolicy implements StalenessPolicy {

  @Getter private final Duration window;
  private final Clock clock;

  public TimestampSuffixPolicy(Duration window, Clock clock) {
    this.window = window;
    this.clock = clock;
  }

  @Override
  public byte[] wrap(byte[] payload) {
    if (payload.length == 0) {
      return payload;
    }
    byte[] stored = Arrays.copyOf(payload, payload.length + TimestampCodec.LENGTH);
    TimestampCodec.encode(clock.instant(), stored, payload.length);
    return stored;
  }

  @Override
  public Optional<byte[]> unwrap(byte[] stored) {
    if (stored.length == 0) {
      return Optional.of(stored);
    }
    // every non-empty write appends exactly LENGTH bytes
    if (stored.length <= TimestampCodec.LENGTH) {
      throw new IllegalStateException(
          "local entry of " + stored.length + " bytes cannot carry a write timestamp");
    }

    int payloadLength = stored.length - TimestampCodec.LENGTH;
    Instant now = clock.instant();
    Instant writtenAt = TimestampCodec.decode(stored, payloadLength, now);
    if (Duration.between(writtenAt, now).abs().compareTo(window) > 0) {
      return Optional.empty();
    }
    return Optional.of(Arrays.copyOf(stored, payloadLength));
  }
}
