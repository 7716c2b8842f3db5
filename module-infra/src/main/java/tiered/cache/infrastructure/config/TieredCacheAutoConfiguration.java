package tiered.cache.infrastructure.config;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tiered.cache.core.CacheOptions;
import tiered.cache.core.TieredCache;
import tiered.cache.core.port.LocalCache;
import tiered.cache.core.port.RemoteStore;
import tiered.cache.core.port.ValueSerializer;
import tiered.cache.infrastructure.local.CaffeineLocalCache;
import tiered.cache.infrastructure.metrics.TieredCacheMetrics;
import tiered.cache.infrastructure.redis.RedissonRemoteStore;
import tiered.cache.infrastructure.serialization.JacksonValueSerializer;

/**
 * TieredCache 자동 구성
 *
 * <h4>등록 빈</h4>
 *
 * <ul>
 *   <li>{@link ValueSerializer}: Jackson + gzip (없을 때만)
 *   <li>{@link LocalCache}: Caffeine, {@code tiered.cache.local.enabled}
 *   <li>{@link RemoteStore}: Redisson, {@code tiered.cache.remote.enabled} and a {@link
 *       RedissonClient} bean
 *   <li>{@link TieredCache}: wired from whichever tiers exist
 *   <li>{@link TieredCacheMetrics}: when Micrometer is present and {@code tiered.cache.stats-enabled}
 * </ul>
 *
 * <p>Every bean backs off when the application defines its own.
 */
@Slf4j
@AutoConfiguration(
    afterName = {
      "org.redisson.spring.starter.RedissonAutoConfiguration",
      "org.redisson.spring.starter.RedissonAutoConfigurationV2"
    })
@EnableConfigurationProperties(TieredCacheProperties.class)
@ConditionalOnProperty(
    prefix = "tiered.cache",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class TieredCacheAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public ValueSerializer tieredCacheValueSerializer(TieredCacheProperties properties) {
    return new JacksonValueSerializer(
        JacksonValueSerializer.defaultObjectMapper(),
        properties.getSerialization().getCompressionThresholdBytes());
  }

  @Bean
  @ConditionalOnMissingBean(LocalCache.class)
  @ConditionalOnProperty(
      prefix = "tiered.cache.local",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  public CaffeineLocalCache tieredCacheLocalCache(TieredCacheProperties properties) {
    return new CaffeineLocalCache(properties.getLocal().getMaximumWeightBytes());
  }

  @Bean
  @ConditionalOnMissingBean(RemoteStore.class)
  @ConditionalOnBean(RedissonClient.class)
  @ConditionalOnProperty(
      prefix = "tiered.cache.remote",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  public RedissonRemoteStore tieredCacheRemoteStore(
      RedissonClient redissonClient, TieredCacheProperties properties) {
    return new RedissonRemoteStore(redissonClient, properties.getRemote().getKeyPrefix());
  }

  @Bean
  @ConditionalOnMissingBean
  public TieredCache tieredCache(
      TieredCacheProperties properties,
      ValueSerializer serializer,
      ObjectProvider<RemoteStore> remoteStore,
      ObjectProvider<LocalCache> localCache) {
    CacheOptions options =
        CacheOptions.builder()
            .remoteStore(remoteStore.getIfAvailable())
            .localCache(localCache.getIfAvailable())
            .localCacheTtl(properties.getLocal().getTtl())
            .statsEnabled(properties.isStatsEnabled())
            .serializer(serializer)
            .build();
    if (options.getRemoteStore() == null && properties.getRemote().isEnabled()) {
      log.warn(
          "[TieredCacheAutoConfiguration] Remote tier enabled but no RedissonClient bean found");
    }
    return new TieredCache(options);
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(MeterRegistry.class)
  @ConditionalOnProperty(prefix = "tiered.cache", name = "stats-enabled", havingValue = "true")
  static class MetricsConfiguration {

    @Bean
    @ConditionalOnMissingBean
    TieredCacheMetrics tieredCacheMetrics(
        TieredCache tieredCache, ObjectProvider<MeterRegistry> meterRegistry) {
      TieredCacheMetrics metrics = new TieredCacheMetrics(tieredCache);
      meterRegistry.ifAvailable(metrics::bindTo);
      return metrics;
    }
  }
}
