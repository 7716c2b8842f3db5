package tiered.cache.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class GzipUtilsTest {

  @Test
  void compressedBytesRestoreOriginal() throws IOException {
    byte[] original = "a".repeat(500).getBytes(StandardCharsets.UTF_8);

    byte[] compressed = GzipUtils.compress(original);

    assertThat(GzipUtils.isGzipped(compressed)).isTrue();
    assertThat(compressed.length).isLessThan(original.length);
    assertThat(GzipUtils.decompress(compressed)).isEqualTo(original);
  }

  @Test
  void emptyInputStaysEmpty() throws IOException {
    assertThat(GzipUtils.compress(new byte[0])).isEmpty();
    assertThat(GzipUtils.decompress(new byte[0])).isEmpty();
  }

  @Test
  void plainBytesAreRejected() {
    byte[] plain = "{\"a\":1}".getBytes(StandardCharsets.UTF_8);

    assertThat(GzipUtils.isGzipped(plain)).isFalse();
    assertThatThrownBy(() -> GzipUtils.decompress(plain)).isInstanceOf(IOException.class);
  }
}
