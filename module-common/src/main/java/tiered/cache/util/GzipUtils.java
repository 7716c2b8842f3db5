package tiered.cache.util;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

public class GzipUtils {

  private GzipUtils() {}

  /**
   * 바이트 배열을 GZIP 압축합니다.
   *
   * @param data 압축할 바이트 배열
   * @return 압축된 바이트 배열 (입력이 비어 있으면 빈 배열)
   * @throws IOException 압축 중 I/O 오류 발생 시
   */
  public static byte[] compress(byte[] data) throws IOException {
    if (data == null || data.length == 0) {
      return new byte[0];
    }

    ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(32, data.length / 2));
    try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
      gzip.write(data);
    }
    return out.toByteArray();
  }

  /**
   * GZIP 압축된 바이트 배열을 압축 해제합니다.
   *
   * @param compressed 압축된 바이트 배열
   * @return 압축 해제된 바이트 배열
   * @throws IOException 입력이 GZIP 형식이 아니거나 손상된 경우
   */
  public static byte[] decompress(byte[] compressed) throws IOException {
    if (compressed == null || compressed.length == 0) {
      return new byte[0];
    }

    if (!isGzipped(compressed)) {
      throw new IOException("not in GZIP format");
    }

    try (GZIPInputStream gzip = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
      return gzip.readAllBytes();
    }
  }

  public static boolean isGzipped(byte[] data) {
    return data != null
        && data.length >= 2
        && data[0] == (byte) (GZIPInputStream.GZIP_MAGIC)
        && data[1] == (byte) (GZIPInputStream.GZIP_MAGIC >> 8);
  }
}
