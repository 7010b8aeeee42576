package story.ingestion.core.queue;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import story.ingestion.core.context.CancellationContext;
import story.ingestion.core.domain.model.QueueItem;
import story.ingestion.core.domain.model.QueueMember;
import story.ingestion.core.domain.model.ScoredMember;
import story.ingestion.core.port.in.IngestionQueue;
import story.ingestion.core.port.out.SortedSetStore;
import story.ingestion.error.exception.InvalidQueueArgumentException;
import story.ingestion.error.exception.QueueStoreCorruptException;
import story.ingestion.error.exception.base.BaseException;

/**
 * 정렬 집합 저장소 위의 디바운스 큐
 *
 * <h3>score 규칙</h3>
 *
 * <ul>
 *   <li>score = 마지막 Push 시각의 epoch seconds (초 미만 절삭)
 *   <li>{@code stableAt}도 같은 방식으로 절삭하여 score ≤ cutoff 비교
 * </ul>
 *
 * <h3>손상 멤버</h3>
 *
 * <p>저장소 pop은 형식 오류 멤버를 limit에 세지 않고 제자리에 남기므로 손상 멤버가 뒤의 정상 항목을 막지 않는다. 그래도 해석할 수 없는
 * 멤버가 돌아오면 결과에서 빼고 WARN 로그를 남긴 뒤 원래 score로 되돌려 놓는다. 같은 배치의 정상 항목은 그대로 반환된다.
 */
@Slf4j
public class DebounceIngestionQueue implements IngestionQueue {

  private final SortedSetStore store;
  private final Clock clock;

  public DebounceIngestionQueue(SortedSetStore store, Clock clock) {
    this.store = Objects.requireNonNull(store, "store");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public void push(CancellationContext ctx, UUID tenantId, String sourceType, UUID sourceId) {
    requireContext(ctx);
    QueueMemberCodec.requireId("tenantId", tenantId);
    String member = QueueMemberCodec.encode(sourceType, sourceId);
    store.addOrUpdate(ctx, tenantId, member, clock.instant().getEpochSecond());
  }

  @Override
  public List<QueueItem> popStable(
      CancellationContext ctx, UUID tenantId, Instant stableAt, int limit) {
    long cutoff = validatePop(ctx, tenantId, stableAt, limit);
    return toItems(ctx, tenantId, store.popByScore(ctx, tenantId, cutoff, limit));
  }

  @Override
  public List<QueueItem> popStableBySourceType(
      CancellationContext ctx, UUID tenantId, String sourceType, Instant stableAt, int limit) {
    long cutoff = validatePop(ctx, tenantId, stableAt, limit);
    String prefix = QueueMemberCodec.prefixOf(sourceType);
    return toItems(ctx, tenantId, store.popByScore(ctx, tenantId, cutoff, limit, prefix));
  }

  @Override
  public void remove(CancellationContext ctx, UUID tenantId, String sourceType, UUID sourceId) {
    requireContext(ctx);
    QueueMemberCodec.requireId("tenantId", tenantId);
    String member = QueueMemberCodec.encode(sourceType, sourceId);
    boolean removed = store.removeMember(ctx, tenantId, member);
    if (log.isDebugEnabled()) {
      log.debug(
          "[IngestionQueue] remove tenant={} member={} removed={}", tenantId, member, removed);
    }
  }

  @Override
  public List<UUID> listTenantsWithItems(CancellationContext ctx) {
    requireContext(ctx);
    return store.listTenants(ctx);
  }

  private long validatePop(CancellationContext ctx, UUID tenantId, Instant stableAt, int limit) {
    requireContext(ctx);
    QueueMemberCodec.requireId("tenantId", tenantId);
    if (stableAt == null) {
      throw new InvalidQueueArgumentException("stableAt is null");
    }
    if (limit <= 0) {
      throw new InvalidQueueArgumentException("limit=" + limit);
    }
    return stableAt.isAfter(DRAIN_ALL) ? DRAIN_ALL.getEpochSecond() : stableAt.getEpochSecond();
  }

  private List<QueueItem> toItems(
      CancellationContext ctx, UUID tenantId, List<ScoredMember> popped) {
    List<QueueItem> items = new ArrayList<>(popped.size());
    List<ScoredMember> corrupt = new ArrayList<>();
    for (ScoredMember entry : popped) {
      try {
        QueueMember decoded = QueueMemberCodec.decode(entry.member());
        items.add(
            new QueueItem(
                tenantId,
                decoded.sourceType(),
                decoded.sourceId(),
                Instant.ofEpochSecond(entry.score())));
      } catch (QueueStoreCorruptException e) {
        log.warn(
            "[IngestionQueue] 해석 불가 멤버 건너뜀: tenant={}, member={}, score={}",
            tenantId,
            entry.member(),
            entry.score());
        corrupt.add(entry);
      }
    }
    if (!corrupt.isEmpty()) {
      restoreCorrupt(ctx, tenantId, corrupt);
    }
    return items;
  }

  // 손상 멤버는 이미 꺼내진 상태이므로 원래 score로 되돌린다. 실패해도 정상 항목 반환은 계속한다.
  private void restoreCorrupt(CancellationContext ctx, UUID tenantId, List<ScoredMember> corrupt) {
    for (ScoredMember entry : corrupt) {
      try {
        store.addOrUpdate(ctx, tenantId, entry.member(), entry.score());
      } catch (BaseException e) {
        log.error(
            "[IngestionQueue] 손상 멤버 복원 실패 (수동 확인 필요): tenant={}, member={}, score={}",
            tenantId,
            entry.member(),
            entry.score(),
            e);
      }
    }
  }

  private static void requireContext(CancellationContext ctx) {
    if (ctx == null) {
      throw new InvalidQueueArgumentException("ctx is null");
    }
  }
}
