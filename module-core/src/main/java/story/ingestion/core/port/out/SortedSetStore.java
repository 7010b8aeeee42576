package story.ingestion.core.port.out;

import java.util.List;
import java.util.UUID;
import story.ingestion.core.context.CancellationContext;
import story.ingestion.core.domain.model.ScoredMember;

/**
 * 테넌트별 정렬 집합 저장소 포트
 *
 * <h3>계약</h3>
 *
 * <ul>
 *   <li>모든 조회 결과는 (score, member) 오름차순
 *   <li>{@code popByScore}는 조회와 삭제가 원자적이다. 동시 호출자 둘이 같은 멤버를 받지 않는다.
 *   <li>{@code popByScore}는 {@code QueueMemberCodec#isWellFormed}를 통과하는 멤버만 꺼낸다. 형식 오류 멤버는 limit에
 *       세지 않고 그대로 남기며 WARN 로그로 알린다.
 *   <li>전송 실패는 {@code QueueStoreUnavailableException}, 취소는 {@code
 *       QueueOperationCancelledException}
 * </ul>
 */
public interface SortedSetStore {

  /** 멤버를 추가하거나 score를 덮어쓴다. */
  void addOrUpdate(CancellationContext ctx, UUID tenantId, String member, long score);

  /** score ≤ maxScore 인 멤버를 최대 limit개 조회 (삭제하지 않음) */
  List<ScoredMember> rangeByScore(CancellationContext ctx, UUID tenantId, long maxScore, int limit);

  /** score ≤ maxScore 인 정상 형식 멤버를 최대 limit개 원자적으로 꺼낸다. */
  List<ScoredMember> popByScore(CancellationContext ctx, UUID tenantId, long maxScore, int limit);

  /**
   * 멤버 접두어가 일치하는 것만 원자적으로 꺼낸다.
   *
   * <p>접두어가 다른 멤버는 limit 계산에 포함되지 않고 그대로 남는다.
   */
  List<ScoredMember> popByScore(
      CancellationContext ctx, UUID tenantId, long maxScore, int limit, String memberPrefix);

  /**
   * @return 멤버가 존재해서 삭제했으면 true
   */
  boolean removeMember(CancellationContext ctx, UUID tenantId, String member);

  /** 비어 있지 않은 정렬 집합을 가진 테넌트 목록 (순서 무관, 중복 없음) */
  List<UUID> listTenants(CancellationContext ctx);
}
