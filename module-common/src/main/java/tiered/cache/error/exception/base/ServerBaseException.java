package tiered.cache.error.exception.base;

import tiered.cache.error.ErrorCode;

/**
 * ServerBaseException: a fault inside the cache or one of its collaborators (remote store,
 * serializer, producer). Always carries enough context to be logged on its own.
 */
public abstract class ServerBaseException extends BaseException {

  public ServerBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  public ServerBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  public ServerBaseException(ErrorCode errorCode, Throwable cause) {
    super(errorCode, cause);
  }

  public ServerBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}
