package tiered.cache.error;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Error codes shared by every module of the tiered cache.
 *
 * <p>Messages are {@link String#format} templates filled in by {@link
 * tiered.cache.error.exception.base.BaseException}.
 *
 * <ul>
 *   <li>{@code Cxxx}: expected outcomes the caller is supposed to branch on
 *   <li>{@code Sxxx}: configuration, transport, serialization and producer failures
 * </ul>
 */
@Getter
@AllArgsConstructor
public enum CommonErrorCode implements ErrorCode {
  // === Client outcomes ===
  CACHE_MISS("C001", "cache: key is missing (key: %s)"),

  // === Server errors ===
  CACHE_NOT_CONFIGURED("S001", "cache: both remote store and local cache are absent"),
  INVALID_CACHE_OPTION("S002", "cache: invalid option (%s)"),
  REMOTE_STORE_FAILURE("S003", "cache: remote store %s failed (key: %s)"),
  SERIALIZATION_FAILURE("S004", "cache: %s failed (%s)"),
  PRODUCER_FAILURE("S005", "cache: value producer failed (key: %s)"),
  WAIT_INTERRUPTED("S006", "cache: interrupted while waiting for in-flight load (key: %s)"),
  DEADLINE_EXCEEDED("S007", "cache: deadline exceeded while waiting for in-flight load (key: %s)");

  private final String code;
  private final String message;
}
