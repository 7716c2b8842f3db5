package tiered.cache.core.coalesce;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/** In-flight load of one key: the shared result slot plus the number of callers attached to it. */
final class Flight {

  private final String key;
  private final CompletableFuture<FlightResult> result = new CompletableFuture<>();
  private final AtomicInteger waiters = new AtomicInteger(1);

  Flight(String key) {
    this.key = key;
  }

  String key() {
    return key;
  }

  CompletableFuture<FlightResult> result() {
    return result;
  }

  int join() {
    return waiters.incrementAndGet();
  }

  int waiters() {
    return waiters.get();
  }
}
