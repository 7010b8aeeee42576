package story.ingestion.error.exception;

import story.ingestion.error.CommonErrorCode;
import story.ingestion.error.exception.base.ServerBaseException;

/**
 * 백킹 스토어(Redis) 연결 실패 또는 타임아웃
 *
 * <p>큐는 이 예외를 삼키지 않고 그대로 전파하며, 재시도 여부는 호출자(디스패처)가 결정합니다.
 */
public class QueueStoreUnavailableException extends ServerBaseException {

  public QueueStoreUnavailableException(String operation, Throwable cause) {
    super(CommonErrorCode.STORE_UNAVAILABLE, cause, operation);
  }

  public QueueStoreUnavailableException(String operation) {
    super(CommonErrorCode.STORE_UNAVAILABLE, operation);
  }

  @Override
  public boolean isRetryable() {
    return true;
  }
}
