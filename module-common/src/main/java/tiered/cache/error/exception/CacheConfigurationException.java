package tiered.cache.error.exception;

import tiered.cache.error.CommonErrorCode;
import tiered.cache.error.exception.base.ServerBaseException;

/**
 * Invalid cache wiring.
 *
 * <p>Thrown by every operation when neither the remote store nor the local cache is configured, and
 * at construction when an option is out of range. Never retried.
 */
public class CacheConfigurationException extends ServerBaseException {

  /** Both tiers absent. */
  public CacheConfigurationException() {
    super(CommonErrorCode.CACHE_NOT_CONFIGURED);
  }

  /**
   * Option out of range.
   *
   * @param detail which option and why
   */
  public CacheConfigurationException(String detail) {
    super(CommonErrorCode.INVALID_CACHE_OPTION, detail);
  }
}
