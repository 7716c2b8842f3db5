package tiered.cache.core.support;

import java.nio.charset.StandardCharsets;
import tiered.cache.core.port.ValueSerializer;
import tiered.cache.error.exception.CacheSerializationException;

/** Text serializer for String, Integer and Long values. */
public class StringValueSerializer implements ValueSerializer {

  @Override
  public byte[] encode(Object value) {
    return value.toString().getBytes(StandardCharsets.UTF_8);
  }

  @Override
  public <T> T decode(byte[] bytes, Class<T> type) {
    String text = new String(bytes, StandardCharsets.UTF_8);
    try {
      if (type == String.class) {
        return type.cast(text);
      }
      if (type == Integer.class) {
        return type.cast(Integer.valueOf(text));
      }
      if (type == Long.class) {
        return type.cast(Long.valueOf(text));
      }
    } catch (NumberFormatException e) {
      throw new CacheSerializationException("decode", type.getName(), e);
    }
    throw new CacheSerializationException("decode", "unsupported type " + type.getName());
  }

  public static byte[] bytes(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }
}
