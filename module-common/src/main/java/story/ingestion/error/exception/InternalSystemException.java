package story.ingestion.error.exception;

import story.ingestion.error.CommonErrorCode;
import story.ingestion.error.exception.base.ServerBaseException;

/** 분류되지 않은 예외를 감싸는 기본 서버 예외 */
public class InternalSystemException extends ServerBaseException {

  public InternalSystemException(String taskName, Throwable cause) {
    super(CommonErrorCode.INTERNAL_SERVER_ERROR, cause, taskName);
  }

  public InternalSystemException(String taskName) {
    super(CommonErrorCode.INTERNAL_SERVER_ERROR, taskName);
  }
}
