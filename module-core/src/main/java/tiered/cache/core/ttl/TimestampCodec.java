package tiered.cache.core.ttl;

import java.time.Instant;

/**
 * 4-byte write timestamp appended to locally cached payloads.
 *
 * <h4>Layout</h4>
 *
 * <p>Low 32 bits of the epoch milliseconds, big-endian. Resolution is one millisecond.
 *
 * <h4>Range</h4>
 *
 * <p>The field wraps every 2<sup>32</sup> ms (~49.7 days), so decoding needs a reference instant:
 * the result is the instant closest to {@code now} whose low 32 bits match, which puts it within
 * ±2<sup>31</sup> ms (~24.8 days) of {@code now}. A wall clock stepped backwards therefore yields a
 * write instant slightly after {@code now} instead of one almost 50 days ago. Staleness windows are
 * capped at {@link #MAX_WINDOW_MILLIS} to stay inside that range.
 */
public final class TimestampCodec {

  public static final int LENGTH = 4;

  /** Largest staleness window whose comparisons stay unambiguous. */
  public static final long MAX_WINDOW_MILLIS = Integer.MAX_VALUE;

  private TimestampCodec() {}

  public static byte[] encode(Instant instant) {
    byte[] out = new byte[LENGTH];
    encode(instant, out, 0);
    return out;
  }

  public static void encode(Instant instant, byte[] dst, int offset) {
    long millis = instant.toEpochMilli();
    dst[offset] = (byte) (millis >>> 24);
    dst[offset + 1] = (byte) (millis >>> 16);
    dst[offset + 2] = (byte) (millis >>> 8);
    dst[offset + 3] = (byte) millis;
  }

  public static Instant decode(byte[] src, Instant now) {
    return decode(src, 0, now);
  }

  public static Instant decode(byte[] src, int offset, Instant now) {
    long stored =
        ((src[offset] & 0xFFL) << 24)
            | ((src[offset + 1] & 0xFFL) << 16)
            | ((src[offset + 2] & 0xFFL) << 8)
            | (src[offset + 3] & 0xFFL);
    long nowMillis = now.toEpochMilli();
    // signed 32-bit distance, negative when the clock went backwards after the write
    long age = (int) (nowMillis - stored);
    return Instant.ofEpochMilli(nowMillis - age);
  }
}
