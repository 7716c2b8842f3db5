package tiered.cache.core;

/**
 * Computes the value to cache on a miss.
 *
 * @param <T> value type
 */
@FunctionalInterface
public interface ValueProducer<T> {

  T produce() throws Exception;
}
