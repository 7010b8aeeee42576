package story.ingestion.error.exception;

import story.ingestion.error.CommonErrorCode;
import story.ingestion.error.exception.base.ServerBaseException;

/** 호출자의 CancellationContext가 취소되었거나 deadline을 넘김 */
public class QueueOperationCancelledException extends ServerBaseException {

  public QueueOperationCancelledException(String operation) {
    super(CommonErrorCode.OPERATION_CANCELLED, operation);
  }

  public QueueOperationCancelledException(String operation, Throwable cause) {
    super(CommonErrorCode.OPERATION_CANCELLED, cause, operation);
  }
}
