package story.ingestion.error.exception;

import lombok.Getter;
import story.ingestion.error.CommonErrorCode;
import story.ingestion.error.exception.base.ServerBaseException;

/** 저장소의 멤버 문자열을 (sourceType, sourceId)로 해석할 수 없음 */
@Getter
public class QueueStoreCorruptException extends ServerBaseException {

  private final String member;

  public QueueStoreCorruptException(String member) {
    super(CommonErrorCode.STORE_CORRUPT, member);
    this.member = member;
  }

  public QueueStoreCorruptException(String member, Throwable cause) {
    super(CommonErrorCode.STORE_CORRUPT, cause, member);
    this.member = member;
  }
}
