package tiered.cache.core.executor;

import tiered.cache.error.exception.CacheTransportException;
import tiered.cache.error.exception.ProducerFailedException;
import tiered.cache.error.exception.base.BaseException;

/**
 * Maps a failure raised inside {@link LogicExecutor} to the unchecked exception the caller sees.
 *
 * <p>Exceptions that already belong to the cache taxonomy ({@link BaseException}) always pass
 * through untouched so a translator never double-wraps.
 */
@FunctionalInterface
public interface ExceptionTranslator {

  RuntimeException translate(Throwable error, TaskContext context);

  /** RuntimeException 그대로, checked 예외는 IllegalStateException으로 감싼다. */
  static ExceptionTranslator defaultTranslator() {
    return (error, context) -> {
      if (error instanceof RuntimeException re) {
        return re;
      }
      return new IllegalStateException(
          "Unexpected checked exception in " + context.toTaskName(), error);
    };
  }

  /**
   * Remote store failures become {@link CacheTransportException} carrying the original error as
   * cause.
   *
   * @param operation remote command name (GET, SET, DEL)
   * @param key cache key
   */
  static ExceptionTranslator forRemoteStore(String operation, String key) {
    return (error, context) -> {
      if (error instanceof BaseException be) {
        return be;
      }
      return new CacheTransportException(operation, key, error);
    };
  }

  /**
   * Producer failures: unchecked exceptions reach the caller unchanged, checked ones are wrapped in
   * {@link ProducerFailedException}.
   */
  static ExceptionTranslator forProducer(String key) {
    return (error, context) -> {
      if (error instanceof RuntimeException re) {
        return re;
      }
      return new ProducerFailedException(key, error);
    };
  }
}
