package tiered.cache.core.executor;

import java.util.function.Function;
import tiered.cache.core.executor.function.CheckedRunnable;
import tiered.cache.core.executor.function.CheckedSupplier;

/**
 * Centralizes try-catch, failure logging and interrupt restoration for collaborator calls.
 *
 * <ul>
 *   <li>{@link #execute}: failures propagate (checked → {@link IllegalStateException})
 *   <li>{@link #executeWithTranslation}: failures propagate through an {@link ExceptionTranslator}
 *   <li>{@link #executeOrCatch} / {@link #executeOrDefault}: failures are logged and recovered
 * </ul>
 *
 * <p>{@link Error}s are never translated or recovered.
 */
public interface LogicExecutor {

  <T> T execute(CheckedSupplier<T> task, TaskContext context);

  <T> T executeWithTranslation(
      CheckedSupplier<T> task, ExceptionTranslator translator, TaskContext context);

  <T> T executeOrCatch(
      CheckedSupplier<T> task, Function<Throwable, T> recovery, TaskContext context);

  default <T> T executeOrDefault(CheckedSupplier<T> task, T defaultValue, TaskContext context) {
    return executeOrCatch(task, e -> defaultValue, context);
  }

  default void executeVoid(CheckedRunnable task, TaskContext context) {
    execute(
        () -> {
          task.run();
          return null;
        },
        context);
  }
}
