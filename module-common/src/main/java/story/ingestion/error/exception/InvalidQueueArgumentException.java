package story.ingestion.error.exception;

import story.ingestion.error.CommonErrorCode;
import story.ingestion.error.exception.base.ClientBaseException;

/** 큐 호출 인자 오류 (빈 sourceType, nil 식별자, 0 이하 limit 등) */
public class InvalidQueueArgumentException extends ClientBaseException {

  public InvalidQueueArgumentException(String detail) {
    super(CommonErrorCode.INVALID_ARGUMENT, detail);
  }
}
