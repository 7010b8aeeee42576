package story.ingestion.infrastructure.redis;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RFuture;
import org.redisson.api.RScoredSortedSet;
import org.redisson.api.RScript;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import org.redisson.client.protocol.ScoredEntry;
import story.ingestion.core.context.CancellationContext;
import story.ingestion.core.domain.model.ScoredMember;
import story.ingestion.core.port.out.SortedSetStore;
import story.ingestion.infrastructure.executor.LogicExecutor;
import story.ingestion.infrastructure.executor.TaskContext;
import story.ingestion.infrastructure.executor.strategy.ExceptionTranslator;
import story.ingestion.infrastructure.redis.script.QueueScript;
import story.ingestion.infrastructure.redis.script.QueueScriptProvider;

/**
 * Redis ZSET 기반 {@link SortedSetStore}
 *
 * <h3>명령 매핑</h3>
 *
 * <ul>
 *   <li>addOrUpdate → ZADD (score 덮어쓰기)
 *   <li>rangeByScore → ZRANGEBYSCORE -inf max WITHSCORES LIMIT 0 n
 *   <li>popByScore → Lua (ZRANGEBYSCORE + ZREM, 원자적). 형식 오류 멤버는 건너뛰고 남긴다.
 *   <li>removeMember → ZREM
 *   <li>listTenants → SCAN MATCH {prefix}:* (KEYS 미사용)
 * </ul>
 *
 * <h3>취소</h3>
 *
 * <p>모든 명령은 비동기로 보내고 짧은 간격으로 Future를 기다리며 {@link CancellationContext}를 확인한다. 취소되면 Future를
 * cancel하고 {@code QueueOperationCancelledException}을 던진다. Lua pop이 Redis에 도달한 뒤 취소되면 꺼낸 배치는 돌려받지
 * 못하므로 pop은 종료와 무관한 컨텍스트로 호출해야 한다.
 */
@Slf4j
public class RedisSortedSetStore implements SortedSetStore {

  private static final String COMPONENT = "QueueStore";
  private static final long AWAIT_SLICE_NANOS = TimeUnit.MILLISECONDS.toNanos(50);

  private final RedissonClient redissonClient;
  private final QueueScriptProvider scriptProvider;
  private final LogicExecutor executor;
  private final IngestionRedisKeys keys;
  private final int scanCount;

  public RedisSortedSetStore(
      RedissonClient redissonClient,
      QueueScriptProvider scriptProvider,
      LogicExecutor executor,
      IngestionRedisKeys keys,
      int scanCount) {
    if (scanCount <= 0) {
      throw new IllegalArgumentException("scanCount must be positive: " + scanCount);
    }
    this.redissonClient = Objects.requireNonNull(redissonClient, "redissonClient");
    this.scriptProvider = Objects.requireNonNull(scriptProvider, "scriptProvider");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.keys = Objects.requireNonNull(keys, "keys");
    this.scanCount = scanCount;
  }

  @Override
  public void addOrUpdate(CancellationContext ctx, UUID tenantId, String member, long score) {
    TaskContext task = TaskContext.of(COMPONENT, "AddOrUpdate", tenantId.toString());
    executor.executeWithTranslation(
        () -> {
          ctx.throwIfCancelled(task.toTaskName());
          return await(ctx, task, sortedSet(tenantId).addAsync((double) score, member));
        },
        ExceptionTranslator.forQueueStore(),
        task);
  }

  @Override
  public List<ScoredMember> rangeByScore(
      CancellationContext ctx, UUID tenantId, long maxScore, int limit) {
    TaskContext task = TaskContext.of(COMPONENT, "RangeByScore", tenantId.toString());
    return executor.executeWithTranslation(
        () -> {
          ctx.throwIfCancelled(task.toTaskName());
          Collection<ScoredEntry<String>> entries =
              await(
                  ctx,
                  task,
                  sortedSet(tenantId)
                      .entryRangeAsync(
                          Double.NEGATIVE_INFINITY, true, (double) maxScore, true, 0, limit));
          return toScoredMembers(entries);
        },
        ExceptionTranslator.forQueueStore(),
        task);
  }

  @Override
  public List<ScoredMember> popByScore(
      CancellationContext ctx, UUID tenantId, long maxScore, int limit) {
    return evalPop(ctx, tenantId, String.valueOf(maxScore), String.valueOf(limit));
  }

  @Override
  public List<ScoredMember> popByScore(
      CancellationContext ctx, UUID tenantId, long maxScore, int limit, String memberPrefix) {
    return evalPop(ctx, tenantId, String.valueOf(maxScore), String.valueOf(limit), memberPrefix);
  }

  @Override
  public boolean removeMember(CancellationContext ctx, UUID tenantId, String member) {
    TaskContext task = TaskContext.of(COMPONENT, "RemoveMember", tenantId.toString());
    return executor.executeWithTranslation(
        () -> {
          ctx.throwIfCancelled(task.toTaskName());
          return Boolean.TRUE.equals(await(ctx, task, sortedSet(tenantId).removeAsync(member)));
        },
        ExceptionTranslator.forQueueStore(),
        task);
  }

  @Override
  public List<UUID> listTenants(CancellationContext ctx) {
    TaskContext task = TaskContext.of(COMPONENT, "ListTenants");
    return executor.executeWithTranslation(
        () -> scanTenants(ctx, task), ExceptionTranslator.forQueueStore(), task);
  }

  private List<UUID> scanTenants(CancellationContext ctx, TaskContext task) {
    ctx.throwIfCancelled(task.toTaskName());
    Set<UUID> tenants = new LinkedHashSet<>();
    Iterable<String> found =
        redissonClient.getKeys().getKeysByPattern(keys.scanPattern(), scanCount);
    for (String key : found) {
      ctx.throwIfCancelled(task.toTaskName());
      keys.tenantOf(key).ifPresent(tenants::add);
    }
    log.debug("[RedisSortedSetStore] tenants with items: {}", tenants.size());
    return new ArrayList<>(tenants);
  }

  private List<ScoredMember> evalPop(CancellationContext ctx, UUID tenantId, Object... args) {
    TaskContext task = TaskContext.of(COMPONENT, "PopByScore", tenantId.toString());
    List<Object> keyList = List.of(keys.queueKey(tenantId));
    List<Object> flat =
        scriptProvider.executeWithNoscriptHandling(
            QueueScript.POP_BY_SCORE,
            sha -> {
              ctx.throwIfCancelled(task.toTaskName());
              RFuture<List<Object>> future =
                  redissonClient
                      .getScript(StringCodec.INSTANCE)
                      .evalShaAsync(
                          RScript.Mode.READ_WRITE, sha, RScript.ReturnType.MULTI, keyList, args);
              return await(ctx, task, future);
            });
    if (flat == null || flat.isEmpty()) {
      return List.of();
    }
    int poppedEnd = 1 + Integer.parseInt(String.valueOf(flat.get(0))) * 2;
    List<ScoredMember> popped = parsePairs(flat, 1, poppedEnd);
    for (ScoredMember entry : parsePairs(flat, poppedEnd, flat.size())) {
      log.warn(
          "[RedisSortedSetStore] 형식 오류 멤버 건너뜀 (수동 확인 필요): tenant={}, member={}, score={}",
          tenantId,
          entry.member(),
          entry.score());
    }
    if (!popped.isEmpty()) {
      log.debug("[RedisSortedSetStore] popped tenant={} count={}", tenantId, popped.size());
    }
    return popped;
  }

  private RScoredSortedSet<String> sortedSet(UUID tenantId) {
    return redissonClient.getScoredSortedSet(keys.queueKey(tenantId), StringCodec.INSTANCE);
  }

  /**
   * Future를 슬라이스 단위로 기다리며 취소를 관찰한다.
   *
   * @throws ExecutionException Redis 명령 실패 (translator가 StoreUnavailable로 변환)
   * @throws InterruptedException 대기 중 인터럽트 (translator가 Cancelled로 변환하고 플래그 복원)
   */
  private static <T> T await(CancellationContext ctx, TaskContext task, RFuture<T> future)
      throws ExecutionException, InterruptedException {
    for (; ; ) {
      if (ctx.isCancelled()) {
        future.cancel(false);
        ctx.throwIfCancelled(task.toTaskName());
      }
      long slice = Math.max(1L, Math.min(AWAIT_SLICE_NANOS, ctx.remainingNanos()));
      try {
        return future.get(slice, TimeUnit.NANOSECONDS);
      } catch (TimeoutException stillRunning) {
        continue;
      } catch (InterruptedException e) {
        future.cancel(false);
        throw e;
      }
    }
  }

  private static List<ScoredMember> toScoredMembers(Collection<ScoredEntry<String>> entries) {
    List<ScoredMember> result = new ArrayList<>(entries.size());
    for (ScoredEntry<String> entry : entries) {
      result.add(new ScoredMember(entry.getValue(), entry.getScore().longValue()));
    }
    return result;
  }

  // [n, member1, score1, ..., memberN, scoreN, (형식 오류 member, score)...] 중 [from, to) 구간
  private static List<ScoredMember> parsePairs(List<Object> flat, int from, int to) {
    int end = Math.min(to, flat.size());
    if (from >= end) {
      return List.of();
    }
    List<ScoredMember> result = new ArrayList<>((end - from) / 2);
    for (int i = from; i + 1 < end; i += 2) {
      String member = String.valueOf(flat.get(i));
      long score = (long) Double.parseDouble(String.valueOf(flat.get(i + 1)));
      result.add(new ScoredMember(member, score));
    }
    return result;
  }
}
