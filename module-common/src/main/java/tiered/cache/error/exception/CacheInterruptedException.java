package tiered.cache.error.exception;

import tiered.cache.error.CommonErrorCode;
import tiered.cache.error.exception.base.ServerBaseException;

/** The calling thread was interrupted while it waited for another caller's load of the same key. */
public class CacheInterruptedException extends ServerBaseException {

  public CacheInterruptedException(String key, InterruptedException cause) {
    super(CommonErrorCode.WAIT_INTERRUPTED, cause, key);
  }
}
