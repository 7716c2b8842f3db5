package tiered.cache.error.exception;

import tiered.cache.error.CommonErrorCode;
import tiered.cache.error.exception.base.ServerBaseException;

/**
 * A value producer threw a checked exception.
 *
 * <p>Unchecked producer failures reach the caller unchanged; only checked ones are wrapped here.
 * Every caller sharing the in-flight load receives the same instance.
 */
public class ProducerFailedException extends ServerBaseException {

  public ProducerFailedException(String key, Throwable cause) {
    super(CommonErrorCode.PRODUCER_FAILURE, cause, key);
  }
}
