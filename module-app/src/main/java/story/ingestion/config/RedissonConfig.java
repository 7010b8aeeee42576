package story.ingestion.config;

import java.time.Duration;
import java.util.Arrays;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.redisson.config.ReadMode;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Redisson 클라이언트 구성
 *
 * <p>{@code ingestion.queue.store=redis}일 때만 등록된다. Sentinel master/nodes가 모두 설정되면 Sentinel 모드,
 * 아니면 단일 서버로 접속한다. 큐 연산은 항상 master에서 읽고 쓴다.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
@ConditionalOnProperty(name = "ingestion.queue.store", havingValue = "redis", matchIfMissing = true)
public class RedissonConfig {

  private static final String REDISSON_HOST_PREFIX = "redis://";
  private static final int RETRY_ATTEMPTS = 3;
  private static final int RETRY_INTERVAL_MS = 1500;

  private final RedisConnectionProperties properties;

  @Bean(destroyMethod = "shutdown")
  public RedissonClient redissonClient() {
    Config config = new Config();

    if (properties.isSentinelMode()) {
      configureSentinel(config);
    } else {
      configureSingleServer(config);
    }

    return Redisson.create(config);
  }

  private void configureSentinel(Config config) {
    String[] addresses =
        Arrays.stream(properties.sentinel().nodes().split(","))
            .map(String::trim)
            .filter(node -> !node.isEmpty())
            .map(RedissonConfig::withScheme)
            .toArray(String[]::new);

    log.info(
        "[RedissonConfig] Sentinel mode: master={}, sentinels={}",
        properties.sentinel().master(),
        addresses.length);

    config
        .useSentinelServers()
        .setMasterName(properties.sentinel().master())
        .addSentinelAddress(addresses)
        .setCheckSentinelsList(false)
        .setReadMode(ReadMode.MASTER)
        .setRetryAttempts(RETRY_ATTEMPTS)
        .setRetryInterval(RETRY_INTERVAL_MS)
        .setTimeout(toMillis(properties.timeout()))
        .setConnectTimeout(toMillis(properties.connectTimeout()))
        .setMasterConnectionPoolSize(properties.connectionPoolSize());
  }

  private void configureSingleServer(Config config) {
    log.info("[RedissonConfig] Single server mode: address={}", properties.address());

    config
        .useSingleServer()
        .setAddress(withScheme(properties.address()))
        .setRetryAttempts(RETRY_ATTEMPTS)
        .setRetryInterval(RETRY_INTERVAL_MS)
        .setTimeout(toMillis(properties.timeout()))
        .setConnectTimeout(toMillis(properties.connectTimeout()))
        .setConnectionPoolSize(properties.connectionPoolSize())
        .setConnectionMinimumIdleSize(Math.min(8, properties.connectionPoolSize()));
  }

  private static String withScheme(String address) {
    if (address.startsWith("redis://") || address.startsWith("rediss://")) {
      return address;
    }
    return REDISSON_HOST_PREFIX + address;
  }

  private static int toMillis(Duration duration) {
    return (int) Math.min(Integer.MAX_VALUE, duration.toMillis());
  }
}
