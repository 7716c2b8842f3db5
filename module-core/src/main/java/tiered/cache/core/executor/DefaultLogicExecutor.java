package tiered.cache.core.executor;

import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import tiered.cache.core.executor.function.CheckedSupplier;
import tiered.cache.error.exception.base.ClientBaseException;
import tiered.cache.util.InterruptUtils;

/**
 * {@link LogicExecutor} 기본 구현체
 *
 * <p>Logging contract:
 *
 * <ul>
 *   <li>[Task:FAILURE] {taskName}, elapsed=..., errorType=... → ERROR with stack trace, except
 *       {@link ClientBaseException} (expected outcomes such as a cache miss) → DEBUG
 *   <li>[Task:SLOW] {taskName}, elapsed=..., threshold=...ms → INFO, when a slow threshold is set
 *   <li>[Task:RECOVERED] {taskName}, errorType=..., message=... → WARN without stack trace when a
 *       recovery function absorbed the failure (DEBUG for {@link ClientBaseException})
 * </ul>
 */
@Slf4j
public class DefaultLogicExecutor implements LogicExecutor {

  private static final String TAG_FAILURE = "[Task:FAILURE]";
  private static final String TAG_SLOW = "[Task:SLOW]";
  private static final String TAG_RECOVERED = "[Task:RECOVERED]";
  private static final long MAX_SLOW_MS = 60_000L;

  private final ExceptionTranslator defaultTranslator = ExceptionTranslator.defaultTranslator();
  private final boolean slowEnabled;
  private final long slowThresholdMs;
  private final long slowThresholdNanos;

  /** SLOW 로그 비활성 */
  public DefaultLogicExecutor() {
    this(0L);
  }

  /**
   * @param slowMs slow threshold in milliseconds; 0 or less disables SLOW logging
   */
  public DefaultLogicExecutor(long slowMs) {
    long clamped = Math.max(0L, Math.min(slowMs, MAX_SLOW_MS));
    this.slowThresholdMs = clamped;
    this.slowEnabled = clamped > 0;
    this.slowThresholdNanos = slowEnabled ? TimeUnit.MILLISECONDS.toNanos(clamped) : Long.MAX_VALUE;
  }

  @Override
  public <T> T execute(CheckedSupplier<T> task, TaskContext context) {
    return executeWithTranslation(task, defaultTranslator, context);
  }

  @Override
  public <T> T executeWithTranslation(
      CheckedSupplier<T> task, ExceptionTranslator translator, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(translator, "translator");
    Objects.requireNonNull(context, "context");

    long start = System.nanoTime();
    try {
      T result = task.get();
      onSuccess(System.nanoTime() - start, context);
      return result;
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      onFailure(t, System.nanoTime() - start, context);
      InterruptUtils.restoreInterruptIfNeeded(t);
      throw translate(translator, t, context);
    }
  }

  @Override
  public <T> T executeOrCatch(
      CheckedSupplier<T> task, Function<Throwable, T> recovery, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(recovery, "recovery");
    Objects.requireNonNull(context, "context");

    long start = System.nanoTime();
    try {
      T result = task.get();
      onSuccess(System.nanoTime() - start, context);
      return result;
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      InterruptUtils.restoreInterruptIfNeeded(t);
      onRecovered(t, System.nanoTime() - start, context);
      return recovery.apply(t);
    }
  }

  private RuntimeException translate(
      ExceptionTranslator translator, Throwable error, TaskContext context) {
    RuntimeException mapped = translator.translate(error, context);
    if (mapped == null) {
      throw new IllegalStateException(
          "Exception translator returned null for: " + error.getClass().getName(), error);
    }
    return mapped;
  }

  private void onSuccess(long elapsedNanos, TaskContext context) {
    if (slowEnabled && elapsedNanos >= slowThresholdNanos && log.isInfoEnabled()) {
      log.info(
          "{} {}, elapsed={}, threshold={}ms",
          TAG_SLOW,
          context.toTaskName(),
          formatDuration(elapsedNanos),
          slowThresholdMs);
    }
  }

  private void onFailure(Throwable error, long elapsedNanos, TaskContext context) {
    String errorType = error.getClass().getSimpleName();
    if (error instanceof ClientBaseException) {
      log.debug(
          "{} {}, elapsed={}, errorType={}",
          TAG_FAILURE,
          context.toTaskName(),
          formatDuration(elapsedNanos),
          errorType);
      return;
    }
    log.error(
        "{} {}, elapsed={}, errorType={}",
        TAG_FAILURE,
        context.toTaskName(),
        formatDuration(elapsedNanos),
        errorType,
        error);
  }

  private void onRecovered(Throwable error, long elapsedNanos, TaskContext context) {
    String errorType = error.getClass().getSimpleName();
    if (error instanceof ClientBaseException) {
      log.debug("{} {}, errorType={}", TAG_RECOVERED, context.toTaskName(), errorType);
      return;
    }
    log.warn(
        "{} {}, elapsed={}, errorType={}, message={}",
        TAG_RECOVERED,
        context.toTaskName(),
        formatDuration(elapsedNanos),
        errorType,
        error.getMessage());
  }

  private static String formatDuration(long elapsedNanos) {
    return String.format(Locale.ROOT, "%.3fms", elapsedNanos / 1_000_000d);
  }
}
