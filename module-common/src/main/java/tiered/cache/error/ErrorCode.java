package tiered.cache.error;

public interface ErrorCode {
  String getCode();

  String getMessage();
}
