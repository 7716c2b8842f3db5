package tiered.cache.core.coalesce;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import tiered.cache.core.CacheContext;
import tiered.cache.error.exception.CacheDeadlineExceededException;
import tiered.cache.error.exception.CacheInterruptedException;

/**
 * Single-flight 실행기 (프로세스 내)
 *
 * <h4>Core behavior</h4>
 *
 * <ul>
 *   <li>Of N concurrent calls for one key, only the first (the leader) actually loads
 *   <li>The other calls (followers) receive the leader's result, failures included
 *   <li>Leader runs the loader on its own thread, outside any lock, so slow loads of one key never
 *       hold up other keys
 * </ul>
 *
 * <h4>Group table</h4>
 *
 * <p>Join-or-create is a single {@link ConcurrentHashMap#putIfAbsent}. The leader removes its
 * entry once the result is published, so a caller arriving afterwards starts a new load.
 *
 * <h4>Follower wait</h4>
 *
 * <p>Bounded by the caller's own {@link CacheContext} deadline and interruptible. Giving up never
 * affects the leader or the other followers.
 */
@Slf4j
public class CoalescingExecutor {

  private final ConcurrentHashMap<String, Flight> inFlight = new ConcurrentHashMap<>();
  private final Clock clock;

  public CoalescingExecutor(Clock clock) {
    this.clock = clock;
  }

  /**
   * @param loader runs at most once concurrently per key; failures must be unchecked
   */
  public FlightResult execute(String key, CacheContext context, Supplier<FlightResult> loader) {
    Flight flight = new Flight(key);
    Flight existing = inFlight.putIfAbsent(key, flight);
    if (existing == null) {
      return lead(flight, loader);
    }
    return follow(existing, context);
  }

  /** 진행 중인 로드 수 (모니터링용) */
  public int inFlightCount() {
    return inFlight.size();
  }

  private FlightResult lead(Flight flight, Supplier<FlightResult> loader) {
    try {
      FlightResult result = loader.get();
      flight.result().complete(result);
      return result;
    } catch (RuntimeException | Error e) {
      flight.result().completeExceptionally(e);
      throw e;
    } finally {
      inFlight.remove(flight.key(), flight);
      if (log.isDebugEnabled() && flight.waiters() > 1) {
        log.debug(
            "[Coalescing] Shared load: key={}, callers={}", maskKey(flight.key()), flight.waiters());
      }
    }
  }

  private FlightResult follow(Flight flight, CacheContext context) {
    flight.join();
    Optional<Duration> remaining = context.remaining(clock);
    try {
      if (remaining.isEmpty()) {
        return flight.result().get();
      }
      long millis = remaining.get().toMillis();
      if (millis <= 0) {
        throw new CacheDeadlineExceededException(flight.key());
      }
      return flight.result().get(millis, TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CacheInterruptedException(flight.key(), e);
    } catch (TimeoutException e) {
      log.warn("[Coalescing] Follower deadline exceeded: key={}", maskKey(flight.key()));
      throw new CacheDeadlineExceededException(flight.key());
    } catch (ExecutionException e) {
      throw rethrow(e.getCause());
    }
  }

  private static RuntimeException rethrow(Throwable cause) {
    if (cause instanceof RuntimeException re) {
      return re;
    }
    if (cause instanceof Error err) {
      throw err;
    }
    return new IllegalStateException("In-flight load failed", cause);
  }

  /** 키 마스킹 (로깅용) */
  private static String maskKey(String key) {
    if (key == null) return "null";
    if (key.length() <= 8) return "***";
    return key.substring(0, 4) + "***" + key.substring(key.length() - 4);
  }
}
