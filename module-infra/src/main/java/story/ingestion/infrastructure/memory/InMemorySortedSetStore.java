package story.ingestion.infrastructure.memory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import story.ingestion.core.context.CancellationContext;
import story.ingestion.core.domain.model.ScoredMember;
import story.ingestion.core.port.out.SortedSetStore;
import story.ingestion.core.queue.QueueMemberCodec;

/**
 * 프로세스 내부 {@link SortedSetStore} (로컬 실행/테스트용)
 *
 * <p>테넌트별 정렬 집합을 {@link ConcurrentHashMap#compute}로만 변경하므로 같은 테넌트에 대한 연산은 서로 직렬화된다. 비어 있는
 * 집합은 즉시 맵에서 제거되어 {@link #listTenants}에 나타나지 않는다.
 *
 * <p>pop은 형식 오류 멤버를 건너뛰고 limit에 세지 않는다. 건너뛴 멤버는 제자리에 남는다.
 */
@Slf4j
public class InMemorySortedSetStore implements SortedSetStore {

  private static final Comparator<ScoredMember> ORDER =
      Comparator.comparingLong(ScoredMember::score).thenComparing(ScoredMember::member);

  private final ConcurrentHashMap<UUID, TenantSet> tenants = new ConcurrentHashMap<>();

  @Override
  public void addOrUpdate(CancellationContext ctx, UUID tenantId, String member, long score) {
    ctx.throwIfCancelled("InMemory:AddOrUpdate");
    tenants.compute(
        tenantId,
        (id, set) -> {
          TenantSet target = set != null ? set : new TenantSet();
          target.put(member, score);
          return target;
        });
  }

  @Override
  public List<ScoredMember> rangeByScore(
      CancellationContext ctx, UUID tenantId, long maxScore, int limit) {
    ctx.throwIfCancelled("InMemory:RangeByScore");
    List<ScoredMember> result = new ArrayList<>();
    tenants.computeIfPresent(
        tenantId,
        (id, set) -> {
          set.collect(maxScore, limit, null, false, result, null);
          return set;
        });
    return result;
  }

  @Override
  public List<ScoredMember> popByScore(
      CancellationContext ctx, UUID tenantId, long maxScore, int limit) {
    return pop(ctx, tenantId, maxScore, limit, null);
  }

  @Override
  public List<ScoredMember> popByScore(
      CancellationContext ctx, UUID tenantId, long maxScore, int limit, String memberPrefix) {
    return pop(ctx, tenantId, maxScore, limit, memberPrefix);
  }

  @Override
  public boolean removeMember(CancellationContext ctx, UUID tenantId, String member) {
    ctx.throwIfCancelled("InMemory:RemoveMember");
    boolean[] removed = {false};
    tenants.computeIfPresent(
        tenantId,
        (id, set) -> {
          removed[0] = set.remove(member);
          return set.isEmpty() ? null : set;
        });
    return removed[0];
  }

  @Override
  public List<UUID> listTenants(CancellationContext ctx) {
    ctx.throwIfCancelled("InMemory:ListTenants");
    return new ArrayList<>(tenants.keySet());
  }

  /** 저장된 멤버 수 (테스트/진단용) */
  public int size(UUID tenantId) {
    TenantSet set = tenants.get(tenantId);
    return set == null ? 0 : set.scores.size();
  }

  private List<ScoredMember> pop(
      CancellationContext ctx, UUID tenantId, long maxScore, int limit, String memberPrefix) {
    ctx.throwIfCancelled("InMemory:PopByScore");
    List<ScoredMember> result = new ArrayList<>();
    List<ScoredMember> malformed = new ArrayList<>();
    tenants.computeIfPresent(
        tenantId,
        (id, set) -> {
          set.collect(maxScore, limit, memberPrefix, true, result, malformed);
          return set.isEmpty() ? null : set;
        });
    for (ScoredMember entry : malformed) {
      log.warn(
          "[InMemorySortedSetStore] 형식 오류 멤버 건너뜀 (수동 확인 필요): tenant={}, member={}, score={}",
          tenantId,
          entry.member(),
          entry.score());
    }
    return result;
  }

  private static final class TenantSet {

    private final Map<String, Long> scores = new HashMap<>();
    private final NavigableSet<ScoredMember> ordered = new TreeSet<>(ORDER);

    void put(String member, long score) {
      Long previous = scores.put(member, score);
      if (previous != null) {
        ordered.remove(new ScoredMember(member, previous));
      }
      ordered.add(new ScoredMember(member, score));
    }

    boolean remove(String member) {
      Long previous = scores.remove(member);
      if (previous == null) {
        return false;
      }
      ordered.remove(new ScoredMember(member, previous));
      return true;
    }

    // malformed가 null이면 형식 검사 없이 모두 수집 (조회 전용)
    void collect(
        long maxScore,
        int limit,
        String prefix,
        boolean removeMatched,
        List<ScoredMember> out,
        List<ScoredMember> malformed) {
      Iterator<ScoredMember> it = ordered.iterator();
      while (it.hasNext() && out.size() < limit) {
        ScoredMember entry = it.next();
        if (entry.score() > maxScore) {
          break;
        }
        if (prefix != null && !entry.member().startsWith(prefix)) {
          continue;
        }
        if (malformed != null && !QueueMemberCodec.isWellFormed(entry.member())) {
          malformed.add(entry);
          continue;
        }
        out.add(entry);
        if (removeMatched) {
          it.remove();
          scores.remove(entry.member());
        }
      }
    }

    boolean isEmpty() {
      return scores.isEmpty();
    }
  }
}
