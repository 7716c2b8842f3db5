package tiered.cache.error.exception;

import lombok.Getter;
import tiered.cache.error.CommonErrorCode;
import tiered.cache.error.exception.base.ClientBaseException;

/**
 * Cache miss.
 *
 * <p>Neither tier holds the key, or a delete found nothing to remove in the remote store. This is
 * an expected outcome, not a fault: callers catch it and fall back to the source of truth.
 */
@Getter
public class CacheMissException extends ClientBaseException {

  private final String key;

  public CacheMissException(String key) {
    super(CommonErrorCode.CACHE_MISS, key);
    this.key = key;
  }
}
