package story.ingestion.infrastructure.redis.script;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import story.ingestion.infrastructure.executor.LogicExecutor;
import story.ingestion.infrastructure.executor.TaskContext;
import story.ingestion.infrastructure.executor.strategy.ExceptionTranslator;
import story.ingestion.util.ExceptionUtils;

/**
 * Lua Script SHA 캐싱 및 NOSCRIPT 에러 핸들링 제공자
 *
 * <h3>NOSCRIPT Error Handling</h3>
 *
 * <pre>
 * 1. evalSha(sha) 호출
 * 2. NOSCRIPT 에러 발생 (Redis 재시작/SCRIPT FLUSH로 스크립트 유실)
 * 3. scriptLoad()로 스크립트 재로드
 * 4. evalSha(newSha) 1회 재시도
 * </pre>
 */
@Slf4j
public class QueueScriptProvider {

  private static final String NOSCRIPT_ERROR_PREFIX = "NOSCRIPT";

  private final RedissonClient redissonClient;
  private final LogicExecutor executor;
  private final Map<QueueScript, AtomicReference<String>> shaRefs =
      new EnumMap<>(QueueScript.class);

  /** SHA를 받아 스크립트를 실행하는 호출 */
  @FunctionalInterface
  public interface ShaCall<T> {
    T call(String sha) throws Throwable;
  }

  public QueueScriptProvider(RedissonClient redissonClient, LogicExecutor executor) {
    this.redissonClient = redissonClient;
    this.executor = executor;
    for (QueueScript script : QueueScript.values()) {
      shaRefs.put(script, new AtomicReference<>());
    }
  }

  /**
   * 시작 시 모든 스크립트를 로드 (웜업)
   *
   * <p>Redis 연결 실패해도 시작을 막지 않는다. 첫 호출 시 다시 로드한다.
   *
   * @return 모두 로드되었으면 true
   */
  public boolean loadScripts() {
    boolean loaded =
        executor.executeOrDefault(
            () -> {
              for (QueueScript script : QueueScript.values()) {
                shaRefs.get(script).set(load(script));
              }
              log.info("[QueueScriptProvider] SHA 캐싱 완료 - {}", shaRefs);
              return true;
            },
            false,
            TaskContext.of("LuaScript", "LoadAll"));

    if (!loaded) {
      log.warn("[QueueScriptProvider] 시작 시 스크립트 로드 실패 - 첫 호출 시 Lazy Loading 시도");
    }
    return loaded;
  }

  /** 캐시된 SHA (없으면 로드) */
  public String sha(QueueScript script) {
    return shaRefs
        .get(script)
        .updateAndGet(current -> current != null ? current : load(script));
  }

  /**
   * NOSCRIPT 발생 시 재로드 후 1회 재실행
   *
   * <p>NOSCRIPT가 아닌 실패는 {@link ExceptionTranslator#forQueueStore()}로 변환되어 전파된다.
   */
  public <T> T executeWithNoscriptHandling(QueueScript script, ShaCall<T> call) {
    TaskContext context = TaskContext.of("LuaScript", "Execute", script.name());
    return executor.executeWithFallback(
        () -> call.call(sha(script)),
        e -> handleNoscriptAndRetry(e, script, call, context),
        context);
  }

  private <T> T handleNoscriptAndRetry(
      Throwable e, QueueScript script, ShaCall<T> call, TaskContext context) {
    if (!ExceptionUtils.causeMessageContains(e, NOSCRIPT_ERROR_PREFIX)) {
      throw ExceptionTranslator.forQueueStore().translate(e, context);
    }

    log.warn("[NOSCRIPT] 스크립트 재로드 필요: {}", script);
    return executor.executeWithTranslation(
        () -> {
          String newSha = load(script);
          shaRefs.get(script).set(newSha);
          return call.call(newSha);
        },
        ExceptionTranslator.forQueueStore(),
        context);
  }

  private String load(QueueScript script) {
    String sha = redissonClient.getScript(StringCodec.INSTANCE).scriptLoad(script.getSource());
    log.info("[QueueScriptProvider] 스크립트 로드 완료 - {}: {}", script, sha);
    return sha;
  }
}
