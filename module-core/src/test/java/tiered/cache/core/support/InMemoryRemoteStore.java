package tiered.cache.core.support;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import tiered.cache.core.port.RemoteStore;

/** Map-backed remote store that records the TTL of each write and can be told to fail. */
public class InMemoryRemoteStore implements RemoteStore {

  private final Map<String, byte[]> values = new ConcurrentHashMap<>();
  private final Map<String, Duration> ttls = new ConcurrentHashMap<>();
  private final AtomicInteger getCalls = new AtomicInteger();
  private volatile RuntimeException failure;

  @Override
  public void set(String key, byte[] value, Duration ttl) {
    failIfRequested();
    values.put(key, value);
    ttls.put(key, ttl);
  }

  @Override
  public Optional<byte[]> get(String key) {
    getCalls.incrementAndGet();
    failIfRequested();
    return Optional.ofNullable(values.get(key));
  }

  @Override
  public long delete(String key) {
    failIfRequested();
    ttls.remove(key);
    return values.remove(key) != null ? 1 : 0;
  }

  public void put(String key, byte[] value) {
    values.put(key, value);
  }

  public boolean contains(String key) {
    return values.containsKey(key);
  }

  public Duration ttlOf(String key) {
    return ttls.get(key);
  }

  public int getCalls() {
    return getCalls.get();
  }

  public void failWith(RuntimeException failure) {
    this.failure = failure;
  }

  private void failIfRequested() {
    RuntimeException f = failure;
    if (f != null) {
      throw f;
    }
  }
}
