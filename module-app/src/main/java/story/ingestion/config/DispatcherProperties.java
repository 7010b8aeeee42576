package story.ingestion.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * 디스패처 설정
 *
 * <h2>설정</h2>
 *
 * <pre>{@code
 * ingestion:
 *   dispatcher:
 *     enabled: true
 *     quiet-period: 30s          # 마지막 Push 이후 이만큼 조용해야 안정 상태
 *     tick-interval:             # 비우면 max(1s, quiet-period / 3)
 *     batch-limit: 100
 *     max-concurrent-tenants: 4
 *     consumer-timeout:          # 비우면 5 x quiet-period
 *     drain-on-shutdown: false
 *     retry:
 *       max-attempts: 3
 *       base-delay: 200ms
 *       jitter-factor: 0.2       # 최대 지연은 항상 quiet-period
 * }</pre>
 *
 * @see story.ingestion.scheduler.IngestionDispatcher
 */
@Validated
@ConfigurationProperties(prefix = "ingestion.dispatcher")
public record DispatcherProperties(
    @DefaultValue("true") boolean enabled,
    @DefaultValue("30s") Duration quietPeriod,
    Duration tickInterval,
    @DefaultValue("100") @Min(1) @Max(10000) int batchLimit,
    @DefaultValue("4") @Min(1) @Max(64) int maxConcurrentTenants,
    Duration consumerTimeout,
    @DefaultValue("false") boolean drainOnShutdown,
    @DefaultValue @Valid Retry retry) {

  private static final Duration MIN_TICK_INTERVAL = Duration.ofSeconds(1);
  private static final int CONSUMER_TIMEOUT_MULTIPLIER = 5;

  public DispatcherProperties {
    if (quietPeriod == null || quietPeriod.isNegative() || quietPeriod.isZero()) {
      throw new IllegalArgumentException(
          "ingestion.dispatcher.quiet-period must be positive, got: " + quietPeriod);
    }
    if (tickInterval != null && (tickInterval.isNegative() || tickInterval.isZero())) {
      throw new IllegalArgumentException(
          "ingestion.dispatcher.tick-interval must be positive, got: " + tickInterval);
    }
    if (consumerTimeout != null && (consumerTimeout.isNegative() || consumerTimeout.isZero())) {
      throw new IllegalArgumentException(
          "ingestion.dispatcher.consumer-timeout must be positive, got: " + consumerTimeout);
    }
    if (retry == null) {
      retry = Retry.defaults();
    }
    if (retry.baseDelay().compareTo(quietPeriod) > 0) {
      throw new IllegalArgumentException(
          "ingestion.dispatcher.retry.base-delay must not exceed quiet-period (base: "
              + retry.baseDelay()
              + ", quiet-period: "
              + quietPeriod
              + ")");
    }
  }

  /** 코드에서 직접 생성할 때 사용하는 기본값 (application.yml 기본값과 동일) */
  public static DispatcherProperties defaults() {
    return new DispatcherProperties(
        true, Duration.ofSeconds(30), null, 100, 4, null, false, Retry.defaults());
  }

  /** 설정값이 없으면 quiet-period / 3, 최소 1초 */
  public Duration effectiveTickInterval() {
    Duration candidate = tickInterval != null ? tickInterval : quietPeriod.dividedBy(3);
    return candidate.compareTo(MIN_TICK_INTERVAL) < 0 ? MIN_TICK_INTERVAL : candidate;
  }

  /** 설정값이 없으면 quiet-period x 5 */
  public Duration effectiveConsumerTimeout() {
    return consumerTimeout != null
        ? consumerTimeout
        : quietPeriod.multipliedBy(CONSUMER_TIMEOUT_MULTIPLIER);
  }

  /**
   * 저장소 장애 재시도 설정
   *
   * @param maxAttempts 첫 시도를 포함한 최대 시도 횟수
   * @param baseDelay 첫 재시도 전 대기 시간
   * @param jitterFactor 지연에 더할 무작위 비율 (0.0 ~ 1.0)
   */
  public record Retry(
      @DefaultValue("3") @Min(1) @Max(10) int maxAttempts,
      @DefaultValue("200ms") Duration baseDelay,
      @DefaultValue("0.2") @DecimalMin("0.0") @DecimalMax("1.0") double jitterFactor) {

    public Retry {
      if (maxAttempts < 1) {
        throw new IllegalArgumentException("retry.max-attempts must be >= 1, got: " + maxAttempts);
      }
      if (baseDelay == null || baseDelay.isNegative() || baseDelay.isZero()) {
        throw new IllegalArgumentException("retry.base-delay must be positive, got: " + baseDelay);
      }
      if (jitterFactor < 0.0 || jitterFactor > 1.0) {
        throw new IllegalArgumentException(
            "retry.jitter-factor must be between 0.0 and 1.0, got: " + jitterFactor);
      }
    }

    public static Retry defaults() {
      return new Retry(3, Duration.ofMillis(200), 0.2);
    }
  }
}
