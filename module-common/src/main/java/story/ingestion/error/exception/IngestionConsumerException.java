package story.ingestion.error.exception;

import java.util.UUID;
import lombok.Getter;
import story.ingestion.error.CommonErrorCode;
import story.ingestion.error.exception.base.ServerBaseException;

/**
 * 다운스트림 consumer가 배치의 일부 항목을 처리하지 못함
 *
 * <p>개별 실패는 {@link #getSuppressed()}에 붙는다. 꺼낸 항목은 이미 소비된 것으로 보므로 재시도 대상이 아니다.
 */
@Getter
public class IngestionConsumerException extends ServerBaseException {

  private final int failedCount;
  private final int batchSize;

  public IngestionConsumerException(UUID tenantId, int failedCount, int batchSize) {
    super(CommonErrorCode.CONSUMER_FAILED, tenantId, failedCount, batchSize);
    this.failedCount = failedCount;
    this.batchSize = batchSize;
  }
}
