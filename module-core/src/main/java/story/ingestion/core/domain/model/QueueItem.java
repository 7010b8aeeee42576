package story.ingestion.core.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * 하나의 소스 엔티티에 대한 대기 중 수집 신호
 *
 * @param tenantId 테넌트 ID
 * @param sourceType 소스 종류 (예: character, scene)
 * @param sourceId 소스 엔티티 ID
 * @param timestamp 이 항목을 마지막으로 건드린 Push 시각 (초 단위)
 */
public record QueueItem(UUID tenantId, String sourceType, UUID sourceId, Instant timestamp) {

  public QueueItem {
    Objects.requireNonNull(tenantId, "tenantId");
    Objects.requireNonNull(sourceType, "sourceType");
    Objects.requireNonNull(sourceId, "sourceId");
    Objects.requireNonNull(timestamp, "timestamp");
  }

  /** 알려진 어휘에 속하면 해당 {@link SourceType} */
  public Optional<SourceType> knownSourceType() {
    return SourceType.fromWireValue(sourceType);
  }
}
