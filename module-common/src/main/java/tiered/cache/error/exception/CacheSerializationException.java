package tiered.cache.error.exception;

import tiered.cache.error.CommonErrorCode;
import tiered.cache.error.exception.base.ServerBaseException;

/** Encode or decode failure of a cached value. */
public class CacheSerializationException extends ServerBaseException {

  public CacheSerializationException(String operation, String detail) {
    super(CommonErrorCode.SERIALIZATION_FAILURE, operation, detail);
  }

  public CacheSerializationException(String operation, String detail, Throwable cause) {
    super(CommonErrorCode.SERIALIZATION_FAILURE, cause, operation, detail);
  }
}
