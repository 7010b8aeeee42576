package story.ingestion.core.domain.model;

import java.util.Objects;
import java.util.UUID;

/**
 * 테넌트 내부의 복합 키 (sourceType, sourceId)
 *
 * <p>저장소에는 {@code "{sourceType}:{sourceId}"} 문자열로 기록됩니다.
 */
public record QueueMember(String sourceType, UUID sourceId) {

  public QueueMember {
    Objects.requireNonNull(sourceType, "sourceType");
    Objects.requireNonNull(sourceId, "sourceId");
  }
}
