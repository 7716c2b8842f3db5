package tiered.cache.error.exception;

import tiered.cache.error.CommonErrorCode;
import tiered.cache.error.exception.base.ServerBaseException;

/**
 * The caller's deadline passed while it waited for another caller's load of the same key.
 *
 * <p>The load itself keeps running and still populates the cache for everyone else.
 */
public class CacheDeadlineExceededException extends ServerBaseException {

  public CacheDeadlineExceededException(String key) {
    super(CommonErrorCode.DEADLINE_EXCEEDED, key);
  }
}
