package story.ingestion.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Redisson 접속 설정
 *
 * <pre>{@code
 * redis:
 *   address: redis://localhost:6379
 *   sentinel:
 *     master: ""            # master와 nodes가 모두 있으면 Sentinel 모드
 *     nodes: ""             # host:port,host:port
 *   timeout: 3s
 *   connect-timeout: 5s
 *   connection-pool-size: 32
 * }</pre>
 */
@Validated
@ConfigurationProperties(prefix = "redis")
public record RedisConnectionProperties(
    @DefaultValue("redis://localhost:6379") @NotBlank String address,
    @DefaultValue Sentinel sentinel,
    @DefaultValue("3s") Duration timeout,
    @DefaultValue("5s") Duration connectTimeout,
    @DefaultValue("32") @Min(1) int connectionPoolSize) {

  public RedisConnectionProperties {
    if (sentinel == null) {
      sentinel = new Sentinel("", "");
    }
  }

  public boolean isSentinelMode() {
    return !sentinel.master().isBlank() && !sentinel.nodes().isBlank();
  }

  public record Sentinel(@DefaultValue("") String master, @DefaultValue("") String nodes) {

    public Sentinel {
      master = master == null ? "" : master;
      nodes = nodes == null ? "" : nodes;
    }
  }
}
