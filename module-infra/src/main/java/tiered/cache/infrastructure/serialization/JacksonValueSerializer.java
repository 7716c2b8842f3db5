package tiered.cache.infrastructure.serialization;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.util.Arrays;
import java.util.Objects;
import tiered.cache.core.port.ValueSerializer;
import tiered.cache.error.exception.CacheSerializationException;
import tiered.cache.util.GzipUtils;

/**
 * JSON 직렬화기 (Jackson) + 선택적 GZIP 압축
 *
 * <h4>Stored layout</h4>
 *
 * <pre>
 * [format:1][body:N]
 *   format 0 → body is JSON
 *   format 1 → body is GZIP-compressed JSON
 * </pre>
 *
 * <p>JSON at or above {@code compressionThresholdBytes} is compressed; {@code 0} disables
 * compression. Decoding accepts both formats regardless of the current threshold, so changing it
 * never invalidates entries already cached.
 *
 * <p>An unknown format byte or JSON that no longer maps onto the requested type is reported as
 * {@link CacheSerializationException}, which lets the cache evict the entry and reload it.
 */
public class JacksonValueSerializer implements ValueSerializer {

  public static final int DEFAULT_COMPRESSION_THRESHOLD = 64;

  static final byte FORMAT_JSON = 0;
  static final byte FORMAT_GZIP = 1;

  private final ObjectMapper objectMapper;
  private final int compressionThresholdBytes;

  public JacksonValueSerializer() {
    this(defaultObjectMapper(), DEFAULT_COMPRESSION_THRESHOLD);
  }

  public JacksonValueSerializer(ObjectMapper objectMapper, int compressionThresholdBytes) {
    if (compressionThresholdBytes < 0) {
      throw new IllegalArgumentException(
          "compressionThresholdBytes must be >= 0: " + compressionThresholdBytes);
    }
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    this.compressionThresholdBytes = compressionThresholdBytes;
  }

  /** JavaTimeModule 등록, 날짜는 ISO-8601 문자열로 기록 */
  public static ObjectMapper defaultObjectMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
  }

  @Override
  public byte[] encode(Object value) {
    byte[] json;
    try {
      json = objectMapper.writeValueAsBytes(value);
    } catch (IOException e) {
      throw new CacheSerializationException("encode", value.getClass().getName(), e);
    }

    if (compressionThresholdBytes > 0 && json.length >= compressionThresholdBytes) {
      return frame(FORMAT_GZIP, compress(json));
    }
    return frame(FORMAT_JSON, json);
  }

  @Override
  public <T> T decode(byte[] bytes, Class<T> type) {
    if (bytes == null || bytes.length == 0) {
      throw new CacheSerializationException("decode", "empty payload for " + type.getName());
    }

    byte[] body = Arrays.copyOfRange(bytes, 1, bytes.length);
    byte[] json =
        switch (bytes[0]) {
          case FORMAT_JSON -> body;
          case FORMAT_GZIP -> decompress(body, type);
          default -> throw new CacheSerializationException(
              "decode", "unknown format header " + bytes[0] + " for " + type.getName());
        };

    try {
      return objectMapper.readValue(json, type);
    } catch (IOException e) {
      throw new CacheSerializationException("decode", type.getName(), e);
    }
  }

  private static byte[] frame(byte format, byte[] body) {
    byte[] framed = new byte[body.length + 1];
    framed[0] = format;
    System.arraycopy(body, 0, framed, 1, body.length);
    return framed;
  }

  private static byte[] compress(byte[] json) {
    try {
      return GzipUtils.compress(json);
    } catch (IOException e) {
      throw new CacheSerializationException("encode", "gzip", e);
    }
  }

  private static byte[] decompress(byte[] body, Class<?> type) {
    try {
      return GzipUtils.decompress(body);
    } catch (IOException e) {
      throw new CacheSerializationException("decode", "gzip body for " + type.getName(), e);
    }
  }
}
