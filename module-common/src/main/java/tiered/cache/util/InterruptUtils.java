package tiered.cache.util;

import java.io.InterruptedIOException;

/**
 * Restores the interrupt flag when an interruption is buried inside a wrapped exception.
 *
 * <p>Remote clients and producers often wrap {@link InterruptedException} in their own runtime
 * exceptions; without this the calling thread would silently lose its interrupt status.
 */
public final class InterruptUtils {

  private static final int MAX_GRAPH_DEPTH = 32;

  private InterruptUtils() {}

  public static void restoreInterruptIfNeeded(Throwable t) {
    if (t != null && containsInterrupted(t, 0)) {
      Thread.currentThread().interrupt();
    }
  }

  private static boolean containsInterrupted(Throwable t, int depth) {
    if (t == null || depth >= MAX_GRAPH_DEPTH) return false;
    if (t instanceof InterruptedException || t instanceof InterruptedIOException) return true;

    for (Throwable s : t.getSuppressed()) {
      if (containsInterrupted(s, depth + 1)) return true;
    }

    return containsInterrupted(t.getCause(), depth + 1);
  }
}
