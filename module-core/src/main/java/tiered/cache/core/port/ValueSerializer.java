package tiered.cache.core.port;

/**
 * Byte-exact encode/decode pair for cached values.
 *
 * <p>Bytes are encoded once per write and shared between both tiers and every caller of a
 * coalesced load, so an implementation must never mutate an array it returned or received.
 * {@code null} values never reach the serializer: the cache stores them as an empty payload.
 */
public interface ValueSerializer {

  /**
   * @throws tiered.cache.error.exception.CacheSerializationException if the value cannot be encoded
   */
  byte[] encode(Object value);

  /**
   * @throws tiered.cache.error.exception.CacheSerializationException if the bytes do not decode into
   *     {@code type}
   */
  <T> T decode(byte[] bytes, Class<T> type);
}
