package tiered.cache.core.tier;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RemoteTtlTest {

  @Test
  @DisplayName("negative ttl stores without expiration")
  void negativeMeansNoExpiration() {
    assertThat(RemoteTtl.resolve(Duration.ofSeconds(-1))).isEqualTo(RemoteTtl.NO_EXPIRATION);
    assertThat(RemoteTtl.resolve(Duration.ofNanos(-1))).isEqualTo(Duration.ZERO);
  }

  @Test
  @DisplayName("ttl below one second is coerced to one hour")
  void belowOneSecondDefaults() {
    assertThat(RemoteTtl.resolve(null)).isEqualTo(Duration.ofHours(1));
    assertThat(RemoteTtl.resolve(Duration.ZERO)).isEqualTo(Duration.ofHours(1));
    assertThat(RemoteTtl.resolve(Duration.ofMillis(999))).isEqualTo(Duration.ofHours(1));
  }

  @Test
  @DisplayName("one second and above is used as given")
  void usedAsGiven() {
    assertThat(RemoteTtl.resolve(Duration.ofSeconds(1))).isEqualTo(Duration.ofSeconds(1));
    assertThat(RemoteTtl.resolve(Duration.ofDays(2))).isEqualTo(Duration.ofDays(2));
  }
}
