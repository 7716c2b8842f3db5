package tiered.cache.error.exception;

import tiered.cache.error.CommonErrorCode;
import tiered.cache.error.exception.base.ServerBaseException;

/**
 * Remote store failure other than "not found".
 *
 * <p>Wraps the protocol/transport error of the remote store verbatim as the cause. The cache counts
 * it as a miss for statistics and never retries it.
 */
public class CacheTransportException extends ServerBaseException {

  public CacheTransportException(String operation, String key, Throwable cause) {
    super(CommonErrorCode.REMOTE_STORE_FAILURE, cause, operation, key);
  }
}
