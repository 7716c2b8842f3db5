package tiered.cache.core.executor.function;

/** {@link Runnable} that may throw a checked exception. */
@FunctionalInterface
public interface CheckedRunnable {

  void run() throws Exception;
}
