package story.ingestion.error.exception.base;

import story.ingestion.error.ErrorCode;

/**
 * ClientBaseException: 호출자의 입력이 계약을 위반했을 때 발생하는 예외입니다. 프로그래머 오류이므로 재시도하지 않습니다.
 */
public abstract class ClientBaseException extends BaseException {

  public ClientBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  // "잘못된 입력값입니다: limit=0" 처럼 동적 인자로 메시지를 완성합니다.
  public ClientBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }
}
