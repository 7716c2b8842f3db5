package tiered.cache.core.executor.function;

/**
 * Exception을 던질 수 있는 Supplier (IO 경계 전용)
 *
 * <p>Used with {@link tiered.cache.core.executor.LogicExecutor} so collaborator calls that may
 * throw checked exceptions (remote store, producers) can be passed as lambdas without a local
 * try-catch.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface CheckedSupplier<T> {

  T get() throws Exception;
}
