package tiered.cache.error.exception.base;

import tiered.cache.error.ErrorCode;

/**
 * ClientBaseException: an outcome caused by what the caller asked for rather than by a fault in the
 * cache. Callers are expected to catch and branch on these.
 */
public abstract class ClientBaseException extends BaseException {

  public ClientBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  public ClientBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }
}
