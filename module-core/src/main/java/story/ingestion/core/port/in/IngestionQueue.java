package story.ingestion.core.port.in;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import story.ingestion.core.context.CancellationContext;
import story.ingestion.core.domain.model.QueueItem;

/**
 * 테넌트 단위 디바운스 수집 큐
 *
 * <p>(tenantId, sourceType, sourceId)마다 최대 한 항목만 유지하며, 재-Push는 타임스탬프만 갱신한다. 마지막 Push 이후 조용한
 * 구간이 지난 항목만 {@link #popStable}로 꺼낼 수 있다.
 */
public interface IngestionQueue {

  /** 모든 항목을 꺼내는 cutoff (종료 시 drain 용) */
  Instant DRAIN_ALL = Instant.parse("9999-12-31T23:59:59Z");

  /** 항목을 추가하거나 타임스탬프를 현재 시각으로 갱신 */
  void push(CancellationContext ctx, UUID tenantId, String sourceType, UUID sourceId);

  /**
   * 타임스탬프 ≤ stableAt 인 항목을 오래된 순으로 최대 limit개 꺼낸다.
   *
   * <p>반환된 항목은 큐에서 제거된다. 결과 크기가 limit과 같으면 더 남아 있을 수 있다.
   */
  List<QueueItem> popStable(CancellationContext ctx, UUID tenantId, Instant stableAt, int limit);

  /** {@link #popStable}과 같지만 sourceType이 일치하는 항목만 꺼낸다. */
  List<QueueItem> popStableBySourceType(
      CancellationContext ctx, UUID tenantId, String sourceType, Instant stableAt, int limit);

  /** 항목 삭제. 없으면 아무 일도 하지 않는다. */
  void remove(CancellationContext ctx, UUID tenantId, String sourceType, UUID sourceId);

  /** 항목이 하나 이상 있는 테넌트 목록 */
  List<UUID> listTenantsWithItems(CancellationContext ctx);
}
