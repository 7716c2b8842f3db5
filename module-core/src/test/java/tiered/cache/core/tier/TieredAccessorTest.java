package tiered.cache.core.tier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tiered.cache.core.executor.DefaultLogicExecutor;
import tiered.cache.core.executor.LogicExecutor;
import tiered.cache.core.port.LocalCache;
import tiered.cache.core.port.RemoteStore;
import tiered.cache.core.stats.CacheStatistics;
import tiered.cache.core.stats.CacheStats;
import tiered.cache.core.support.InMemoryLocalCache;
import tiered.cache.core.support.InMemoryRemoteStore;
import tiered.cache.core.support.StringValueSerializer;
import tiered.cache.core.ttl.NeverStalePolicy;
import tiered.cache.error.exception.CacheConfigurationException;
import tiered.cache.error.exception.CacheMissException;
import tiered.cache.error.exception.CacheSerializationException;
import tiered.cache.error.exception.CacheTransportException;

@DisplayName("TieredAccessor")
class TieredAccessorTest {

  private static final Duration TTL = Duration.ofMinutes(5);

  private final LogicExecutor executor = new DefaultLogicExecutor();
  private final StringValueSerializer serializer = new StringValueSerializer();

  private CacheStatistics statistics;
  private InMemoryRemoteStore remote;
  private InMemoryLocalCache localCache;

  @BeforeEach
  void setUp() {
    statistics = CacheStatistics.enabled();
    remote = new InMemoryRemoteStore();
    localCache = new InMemoryLocalCache();
  }

  private LocalTier localTier(LocalCache cache) {
    return new LocalTier(cache, NeverStalePolicy.INSTANCE, statistics, executor);
  }

  private TieredAccessor accessor(RemoteStore remoteStore, LocalCache cache) {
    return new TieredAccessor(
        remoteStore, cache == null ? null : localTier(cache), serializer, statistics, executor);
  }

  private CacheStats stats() {
    return statistics.snapshot().orElseThrow();
  }

  @Nested
  @DisplayName("read")
  class Read {

    @Test
    @DisplayName("local hit never consults the remote store")
    void localHitShortCircuits() {
      RemoteStore mockRemote = mock(RemoteStore.class);
      localCache.set("k", StringValueSerializer.bytes("v"));

      Lookup lookup = accessor(mockRemote, localCache).read("k");

      assertThat(lookup.source()).isEqualTo(Lookup.Source.LOCAL);
      assertThat(lookup.bytes()).isEqualTo(StringValueSerializer.bytes("v"));
      verify(mockRemote, never()).get(anyString());
      assertThat(stats()).isEqualTo(new CacheStats(0, 0, 1, 0));
    }

    @Test
    @DisplayName("remote hit is written back into the local tier")
    void remoteHitWritesBack() {
      remote.put("k", StringValueSerializer.bytes("v"));

      Lookup lookup = accessor(remote, localCache).read("k");

      assertThat(lookup.source()).isEqualTo(Lookup.Source.REMOTE);
      assertThat(localCache.raw("k")).isEqualTo(StringValueSerializer.bytes("v"));
      assertThat(stats()).isEqualTo(new CacheStats(1, 0, 0, 1));
    }

    @Test
    void remoteNotFoundIsMiss() {
      Lookup lookup = accessor(remote, localCache).read("absent");

      assertThat(lookup.isHit()).isFalse();
      assertThat(stats().misses()).isEqualTo(1);
    }

    @Test
    @DisplayName("remote failure counts as a miss and propagates as a transport error")
    void remoteFailure() {
      RuntimeException down = new RuntimeException("connection reset");
      remote.failWith(down);

      assertThatThrownBy(() -> accessor(remote, localCache).read("k"))
          .isInstanceOf(CacheTransportException.class)
          .hasCause(down);
      assertThat(stats().misses()).isEqualTo(1);
    }

    @Test
    void localOnlyMissWithoutRemote() {
      assertThat(accessor(null, localCache).read("k").isHit()).isFalse();
    }

    @Test
    @DisplayName("local failure is advisory and the remote store still answers")
    void localFailureFallsThrough() {
      LocalCache broken = mock(LocalCache.class);
      given(broken.get(anyString())).willThrow(new IllegalStateException("local down"));
      remote.put("k", StringValueSerializer.bytes("v"));

      Lookup lookup = accessor(remote, broken).read("k");

      assertThat(lookup.source()).isEqualTo(Lookup.Source.REMOTE);
    }
  }

  @Nested
  @DisplayName("write")
  class Write {

    @Test
    void writesBothTiersAndReturnsEncodedBytes() {
      byte[] bytes = accessor(remote, localCache).write("k", 42, TTL);

      assertThat(bytes).isEqualTo(StringValueSerializer.bytes("42"));
      assertThat(localCache.raw("k")).isEqualTo(bytes);
      assertThat(remote.contains("k")).isTrue();
      assertThat(remote.ttlOf("k")).isEqualTo(TTL);
    }

    @Test
    @DisplayName("null is stored as an empty payload")
    void nullIsEmpty() {
      byte[] bytes = accessor(remote, localCache).write("k", null, TTL);

      assertThat(bytes).isEmpty();
    }

    @Test
    @DisplayName("local set failure does not prevent the remote write")
    void localSetFailureIgnored() {
      LocalCache broken = mock(LocalCache.class);
      willThrow(new IllegalStateException("full")).given(broken).set(anyString(), any());

      accessor(remote, broken).write("k", "v", TTL);

      assertThat(remote.contains("k")).isTrue();
    }

    @Test
    void remoteSetFailurePropagates() {
      remote.failWith(new RuntimeException("READONLY"));

      assertThatThrownBy(() -> accessor(remote, localCache).write("k", "v", TTL))
          .isInstanceOf(CacheTransportException.class);
    }

    @Test
    void encodeFailureIsFatal() {
      RemoteStore mockRemote = mock(RemoteStore.class);
      TieredAccessor failing =
          new TieredAccessor(
              mockRemote,
              null,
              new StringValueSerializer() {
                @Override
                public byte[] encode(Object value) {
                  throw new IllegalArgumentException("not encodable");
                }
              },
              statistics,
              executor);

      assertThatThrownBy(() -> failing.write("k", "v", TTL))
          .isInstanceOf(CacheSerializationException.class);
      verify(mockRemote, never()).set(anyString(), any(), any());
    }
  }

  @Nested
  @DisplayName("delete")
  class Delete {

    @Test
    void removesFromBothTiers() {
      TieredAccessor accessor = accessor(remote, localCache);
      accessor.write("k", "v", TTL);

      accessor.delete("k");

      assertThat(localCache.has("k")).isFalse();
      assertThat(remote.contains("k")).isFalse();
    }

    @Test
    @DisplayName("key present only locally reports a miss but is removed locally")
    void localOnlyPresenceIsMiss() {
      localCache.set("k", StringValueSerializer.bytes("v"));

      assertThatThrownBy(() -> accessor(remote, localCache).delete("k"))
          .isInstanceOf(CacheMissException.class);
      assertThat(localCache.has("k")).isFalse();
    }

    @Test
    void localOnlyConfigurationSucceeds() {
      accessor(null, localCache).delete("never-written");
    }

    @Test
    @DisplayName("evict propagates a local removal failure and leaves the remote entry alone")
    void evictPropagatesLocalFailure() {
      LocalCache broken = mock(LocalCache.class);
      willThrow(new IllegalStateException("read-only")).given(broken).delete("k");
      remote.put("k", StringValueSerializer.bytes("v"));

      assertThatThrownBy(() -> accessor(remote, broken).evict("k"))
          .isInstanceOf(IllegalStateException.class);
      assertThat(remote.contains("k")).isTrue();
    }

    @Test
    @DisplayName("delete keeps treating a local removal failure as advisory")
    void deleteIgnoresLocalFailure() {
      LocalCache broken = mock(LocalCache.class);
      willThrow(new IllegalStateException("read-only")).given(broken).delete("k");
      remote.put("k", StringValueSerializer.bytes("v"));

      accessor(remote, broken).delete("k");

      assertThat(remote.contains("k")).isFalse();
    }

    @Test
    void remoteDeleteFailurePropagates() {
      RemoteStore mockRemote = mock(RemoteStore.class);
      given(mockRemote.delete("k")).willThrow(new RuntimeException("timeout"));

      assertThatThrownBy(() -> accessor(mockRemote, localCache).delete("k"))
          .isInstanceOf(CacheTransportException.class);
    }
  }

  @Nested
  @DisplayName("no tier configured")
  class NoTier {

    @Test
    void everyOperationIsAConfigurationError() {
      TieredAccessor accessor = accessor(null, null);

      assertThatThrownBy(() -> accessor.read("k")).isInstanceOf(CacheConfigurationException.class);
      assertThatThrownBy(() -> accessor.write("k", "v", TTL))
          .isInstanceOf(CacheConfigurationException.class);
      assertThatThrownBy(() -> accessor.delete("k"))
          .isInstanceOf(CacheConfigurationException.class);
    }
  }

  @Test
  void remoteReturningEmptyOptionalIsMiss() {
    RemoteStore mockRemote = mock(RemoteStore.class);
    given(mockRemote.get("k")).willReturn(Optional.empty());

    assertThat(accessor(mockRemote, null).read("k").isHit()).isFalse();
  }
}
