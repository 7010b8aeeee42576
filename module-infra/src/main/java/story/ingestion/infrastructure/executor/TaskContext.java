package story.ingestion.infrastructure.executor;

import java.util.Objects;

/**
 * 로그/메트릭용 작업 컨텍스트
 *
 * <h3>형식</h3>
 *
 * <pre>
 * "component:operation:dynamicValue"
 *
 * 예시:
 * - TaskContext.of("QueueStore", "PopByScore", tenantId) → "QueueStore:PopByScore:{tenantId}"
 * - TaskContext.of("Dispatcher", "Tick")                  → "Dispatcher:Tick"
 * </pre>
 *
 * <p>component, operation은 고정 값이고 dynamicValue(테넌트 ID 등)는 로그에만 남긴다.
 *
 * @param component 컴포넌트 이름 (예: "QueueStore", "Dispatcher")
 * @param operation 작업 유형 (예: "PopByScore", "ListTenants")
 * @param dynamicValue 동적 값 (예: 테넌트 ID)
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
   * @return "component:operation[:dynamicValue]" 형식의 문자열
   */
  public String toTaskName() {
    if (dynamicValue.isEmpty()) {
      return component + ":" + operation;
    }
    return component + ":" + operation + ":" + dynamicValue;
  }
}
