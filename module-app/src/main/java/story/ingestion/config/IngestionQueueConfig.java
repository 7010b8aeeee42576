package story.ingestion.config;

import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RedissonClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import story.ingestion.core.port.in.IngestionQueue;
import story.ingestion.core.port.out.SortedSetStore;
import story.ingestion.core.queue.DebounceIngestionQueue;
import story.ingestion.infrastructure.executor.DefaultLogicExecutor;
import story.ingestion.infrastructure.executor.LogicExecutor;
import story.ingestion.infrastructure.memory.InMemorySortedSetStore;
import story.ingestion.infrastructure.redis.IngestionRedisKeys;
import story.ingestion.infrastructure.redis.RedisSortedSetStore;
import story.ingestion.infrastructure.redis.script.QueueScriptProvider;

/**
 * 수집 큐와 저장소 어댑터 구성
 *
 * <p>{@code ingestion.queue.store} 값에 따라 Redis 또는 In-Memory 저장소 중 하나만 등록된다.
 */
@Slf4j
@Configuration
public class IngestionQueueConfig {

  private static final String STORE_PROPERTY = "ingestion.queue.store";

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public LogicExecutor logicExecutor() {
    return new DefaultLogicExecutor();
  }

  @Bean
  @ConditionalOnProperty(name = STORE_PROPERTY, havingValue = "redis", matchIfMissing = true)
  public QueueScriptProvider queueScriptProvider(
      RedissonClient redissonClient, LogicExecutor executor) {
    QueueScriptProvider provider = new QueueScriptProvider(redissonClient, executor);
    provider.loadScripts();
    return provider;
  }

  @Bean
  @ConditionalOnProperty(name = STORE_PROPERTY, havingValue = "redis", matchIfMissing = true)
  public SortedSetStore redisSortedSetStore(
      RedissonClient redissonClient,
      QueueScriptProvider scriptProvider,
      LogicExecutor executor,
      IngestionQueueProperties properties) {
    log.info(
        "[IngestionQueueConfig] Redis 저장소 사용: keyPrefix={}, scanCount={}",
        properties.keyPrefix(),
        properties.scanCount());
    return new RedisSortedSetStore(
        redissonClient,
        scriptProvider,
        executor,
        new IngestionRedisKeys(properties.keyPrefix()),
        properties.scanCount());
  }

  @Bean
  @ConditionalOnProperty(name = STORE_PROPERTY, havingValue = "in-memory")
  public SortedSetStore inMemorySortedSetStore() {
    log.warn("[IngestionQueueConfig] In-Memory 저장소 사용 - 재시작 시 대기 항목이 유실된다");
    return new InMemorySortedSetStore();
  }

  @Bean
  public IngestionQueue ingestionQueue(SortedSetStore store, Clock clock) {
    return new DebounceIngestionQueue(store, clock);
  }
}
