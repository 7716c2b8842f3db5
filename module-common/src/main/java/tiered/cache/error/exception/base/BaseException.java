package tiered.cache.error.exception.base;

import lombok.Getter;
import tiered.cache.error.ErrorCode;

@Getter
public abstract class BaseException extends RuntimeException {
  private final ErrorCode errorCode;

  public BaseException(ErrorCode errorCode) {
    super(errorCode.getMessage());
    this.errorCode = errorCode;
  }

  public BaseException(ErrorCode errorCode, Object... args) {
    super(String.format(errorCode.getMessage(), args));
    this.errorCode = errorCode;
  }

  public BaseException(ErrorCode errorCode, Throwable cause) {
    super(errorCode.getMessage(), cause);
    this.errorCode = errorCode;
  }

  public BaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(String.format(errorCode.getMessage(), args), cause);
    this.errorCode = errorCode;
  }
}
