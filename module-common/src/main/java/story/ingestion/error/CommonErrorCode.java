package story.ingestion.error;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum CommonErrorCode implements ErrorCode {
  // === Client Errors ===
  INVALID_ARGUMENT("C001", "잘못된 입력값입니다: %s"),

  // === Server Errors ===
  STORE_UNAVAILABLE("S001", "큐 저장소를 사용할 수 없습니다 (%s)"),
  STORE_CORRUPT("S002", "큐 멤버를 해석할 수 없습니다 (member: %s)"),
  OPERATION_CANCELLED("S003", "작업이 취소되었습니다 (%s)"),
  INTERNAL_SERVER_ERROR("S004", "서버 내부 오류가 발생했습니다 (%s)"),
  CONSUMER_FAILED("S005", "배치 일부를 처리하지 못했습니다 (tenant: %s, failed: %d/%d)");

  private final String code;
  private final String message;
}
