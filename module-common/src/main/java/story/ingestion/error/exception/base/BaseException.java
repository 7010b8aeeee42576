package story.ingestion.error.exception.base;

import lombok.Getter;
import story.ingestion.error.ErrorCode;

/**
 * 모든 도메인 예외의 루트
 *
 * <p>호출부는 메시지 문자열이 아닌 {@link #getErrorCode()}로 예외 종류를 판별합니다.
 */
@Getter
public abstract class BaseException extends RuntimeException {
  private final ErrorCode errorCode;

  public BaseException(ErrorCode errorCode) {
    super(errorCode.getMessage());
    this.errorCode = errorCode;
  }

  public BaseException(ErrorCode errorCode, Object... args) {
    super(String.format(errorCode.getMessage(), args));
    this.errorCode = errorCode;
  }

  public BaseException(ErrorCode errorCode, Throwable cause) {
    super(errorCode.getMessage(), cause);
    this.errorCode = errorCode;
  }

  public BaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(String.format(errorCode.getMessage(), args), cause);
    this.errorCode = errorCode;
  }

  /**
   * 호출자가 같은 요청을 다시 시도해도 되는지 여부
   *
   * @return 재시도 가능하면 true
   */
  public boolean isRetryable() {
    return false;
  }
}
