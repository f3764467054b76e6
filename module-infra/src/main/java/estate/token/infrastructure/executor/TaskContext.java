package estate.token.infrastructure.executor;

import java.util.Objects;

/**
 * 실행 작업 식별 컨텍스트
 *
 * <p>메트릭 태그(component, operation)와 로그용 동적 값(예: lock key)을 분리해 카디널리티 폭발을 막습니다.
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

  public String toTaskName() {
    if (dynamicValue.isEmpty()) {
      return component + ":" + operation;
    }
    return component + ":" + operation + ":" + dynamicValue;
  }
}
