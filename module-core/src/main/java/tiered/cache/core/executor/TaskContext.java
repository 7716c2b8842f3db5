package tiered.cache.core.executor;

import java.util.Objects;

/**
 * 로그/메트릭 카디널리티 통제를 위한 작업 컨텍스트
 *
 * <p>Separates the fixed taxonomy (component, operation) from the dynamic value (usually the cache
 * key), so log lines stay greppable and the key never leaks into a metric tag.
 *
 * <pre>
 * TaskContext.of("Cache", "RemoteGet", "user:42").toTaskName()  → "Cache:RemoteGet:user:42"
 * TaskContext.of("Cache", "Stats").toTaskName()                 → "Cache:Stats"
 * </pre>
 *
 * @param component component name (e.g. "Cache", "LocalTier")
 * @param operation operation name (e.g. "RemoteGet", "Produce")
 * @param dynamicValue dynamic value, logged only
 */
public record TaskContext(String component, String operation, String dynamicValue) {

  public TaskContext {
    Objects.requireNonNull(component, "component");
    Objects.requireNonNull(operation, "operation");
    if (dynamicValue == null) {
      dynamicValue = "";
    }
  }

  public static TaskContext of(String component, String operation, String dynamicValue) {
    return new TaskContext(component, operation, dynamicValue);
  }

  public static TaskContext of(String component, String operation) {
    return new TaskContext(component, operation, "");
  }

  /**
   * @return "component:operation:dynamicValue", or "component:operation" without a dynamic value
   */
  public String toTaskName() {
    if (dynamicValue.isEmpty()) {
      return component + ":" + operation;
    }
    return component + ":" + operation + ":" + dynamicValue;
  }
}
