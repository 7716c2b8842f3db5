package tiered.cache.infrastructure.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * TieredCache 외부 설정 프로퍼티
 *
 * <pre>
 * tiered:
 *   cache:
 *     enabled: true
 *     stats-enabled: false
 *     local:
 *       enabled: true
 *       maximum-weight-bytes: 33554432
 *       ttl: 0          # 0 → 1m, negative → never stale
 *     remote:
 *       enabled: true   # requires a RedissonClient bean
 *       key-prefix: ""
 *     serialization:
 *       compression-threshold-bytes: 64   # 0 disables gzip
 * </pre>
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "tiered.cache")
public class TieredCacheProperties {

  /** 전체 자동 구성 on/off */
  private boolean enabled = true;

  /** 히트/미스 카운터 수집 여부 (메트릭 바인더 포함) */
  private boolean statsEnabled = false;

  @Valid @NotNull private Local local = new Local();

  @Valid @NotNull private Remote remote = new Remote();

  @Valid @NotNull private Serialization serialization = new Serialization();

  @Getter
  @Setter
  public static class Local {

    private boolean enabled = true;

    /** Caffeine maximumWeight, payload bytes */
    @Positive private long maximumWeightBytes = 32L * 1024 * 1024;

    /**
     * Local staleness window. Zero selects the one minute default, negative disables staleness.
     */
    @NotNull private Duration ttl = Duration.ZERO;
  }

  @Getter
  @Setter
  public static class Remote {

    private boolean enabled = true;

    /** Prepended to every Redis key */
    @NotNull private String keyPrefix = "";
  }

  @Getter
  @Setter
  public static class Serialization {

    @PositiveOrZero private int compressionThresholdBytes = 64;
  }
}
