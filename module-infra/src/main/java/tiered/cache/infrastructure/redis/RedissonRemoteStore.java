package tiered.cache.infrastructure.redis;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RBucket;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.ByteArrayCodec;
import tiered.cache.core.port.RemoteStore;

/**
 * Redis L2 저장소 (Redisson RBucket 기반)
 *
 * <p>Values are stored as raw bytes ({@link ByteArrayCodec}) so what Redis holds is exactly what
 * the serializer produced. An optional key prefix namespaces every key of this cache.
 *
 * <p>Redisson failures (timeouts, connection loss) propagate untouched; the cache translates them.
 */
@Slf4j
public class RedissonRemoteStore implements RemoteStore {

  private final RedissonClient redissonClient;
  private final String keyPrefix;

  public RedissonRemoteStore(RedissonClient redissonClient) {
    this(redissonClient, "");
  }

  public RedissonRemoteStore(RedissonClient redissonClient, String keyPrefix) {
    this.redissonClient = Objects.requireNonNull(redissonClient, "redissonClient");
    this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
  }

  @Override
  public void set(String key, byte[] value, Duration ttl) {
    RBucket<byte[]> bucket = bucket(key);
    if (ttl == null || ttl.isZero() || ttl.isNegative()) {
      bucket.set(value);
      return;
    }
    bucket.set(value, ttl);
  }

  @Override
  public Optional<byte[]> get(String key) {
    return Optional.ofNullable(bucket(key).get());
  }

  @Override
  public long delete(String key) {
    long deleted = redissonClient.getKeys().delete(redisKey(key));
    log.debug("[RedissonRemoteStore] DEL key={}, deleted={}", redisKey(key), deleted);
    return deleted;
  }

  String redisKey(String key) {
    return keyPrefix + key;
  }

  private RBucket<byte[]> bucket(String key) {
    return redissonClient.getBucket(redisKey(key), ByteArrayCodec.INSTANCE);
  }
}
