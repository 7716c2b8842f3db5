package tiered.cache.error;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import org.junit.jupiter.api.Test;
import tiered.cache.error.exception.CacheMissException;
import tiered.cache.error.exception.CacheTransportException;

class CommonErrorCodeTest {

  @Test
  void codesAreUnique() {
    assertThat(Arrays.stream(CommonErrorCode.values()).map(CommonErrorCode::getCode))
        .doesNotHaveDuplicates();
  }

  @Test
  void cacheMissCarriesKeyInMessage() {
    CacheMissException e = new CacheMissException("user:42");

    assertThat(e.getKey()).isEqualTo("user:42");
    assertThat(e.getErrorCode()).isEqualTo(CommonErrorCode.CACHE_MISS);
    assertThat(e.getMessage()).isEqualTo("cache: key is missing (key: user:42)");
  }

  @Test
  void transportExceptionKeepsCause() {
    IllegalStateException cause = new IllegalStateException("connection reset");

    CacheTransportException e = new CacheTransportException("GET", "k", cause);

    assertThat(e).hasCause(cause);
    assertThat(e.getMessage()).isEqualTo("cache: remote store GET failed (key: k)");
  }
}
