package tiered.cache.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Deadline carrier of a single cache call.
 *
 * <p>The deadline only bounds how long a caller waits for another caller's in-flight load of the
 * same key. Remote stores and producers enforce their own timeouts. Thread interruption is honored
 * while waiting regardless of the deadline.
 *
 * @param deadline absolute deadline, {@code null} for none
 */
public record CacheContext(Instant deadline) {

  private static final CacheContext BACKGROUND = new CacheContext(null);

  /** No deadline. */
  public static CacheContext background() {
    return BACKGROUND;
  }

  public static CacheContext withDeadline(Instant deadline) {
    return new CacheContext(Objects.requireNonNull(deadline, "deadline"));
  }

  public static CacheContext withTimeout(Duration timeout, Clock clock) {
    return withDeadline(clock.instant().plus(timeout));
  }

  public Optional<Instant> getDeadline() {
    return Optional.ofNullable(deadline);
  }

  /**
   * @return time left before the deadline (negative once passed), empty without a deadline
   */
  public Optional<Duration> remaining(Clock clock) {
    return getDeadline().map(d -> Duration.between(clock.instant(), d));
  }
}
