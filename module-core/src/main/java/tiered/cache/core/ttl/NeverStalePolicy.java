package tiered.cache.core.ttl;

import java.util.Optional;

/** Stores payloads unmodified; entries live until capacity-driven eviction. */
public enum NeverStalePolicy implements StalenessPolicy {
  INSTANCE;

  @Override
  public byte[] wrap(byte[] payload) {
    return payload;
  }

  @Override
  public Optional<byte[]> unwrap(byte[] stored) {
    return Optional.of(stored);
  }
}
