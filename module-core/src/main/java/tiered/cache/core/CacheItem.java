package tiered.cache.core;

import java.time.Duration;
import lombok.Builder;
import lombok.Getter;
import tiered.cache.core.tier.RemoteTtl;

/**
 * Per-call request descriptor.
 *
 * <pre>{@code
 * User user = cache.once(
 *     CacheItem.<User>builder()
 *         .key("user:" + id)
 *         .producer(() -> userRepository.load(id))
 *         .ttl(Duration.ofMinutes(10))
 *         .build(),
 *     User.class);
 * }</pre>
 *
 * <p>An explicit {@code value} wins over the {@code producer}.
 *
 * @param <T> value type
 */
@Getter
@Builder
public class CacheItem<T> {

  private final String key;
  private final T value;
  private final ValueProducer<T> producer;

  /** Remote expiration, see {@link RemoteTtl#resolve(Duration)}. */
  private final Duration ttl;

  @Builder.Default private final CacheContext context = CacheContext.background();

  /**
   * @return the explicit value, else the producer's result, else {@code null}
   * @throws Exception whatever the producer throws
   */
  public T resolveValue() throws Exception {
    if (value != null) {
      return value;
    }
    if (producer != null) {
      return producer.produce();
    }
    return null;
  }

  /** Remote expiration actually applied to this item. */
  public Duration expiration() {
    return RemoteTtl.resolve(ttl);
  }

  public CacheContext getContext() {
    return context != null ? context : CacheContext.background();
  }
}
