package story.ingestion.infrastructure.retry;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential Backoff with Jitter 계산기.
 *
 * <p>저장소 장애 재시도 간격을 지수적으로 늘리되 Jitter를 더해 여러 디스패처가 동시에 재시도하지 않도록 한다.
 *
 * <pre>
 * delay  = min(baseDelay * 2^(attemptCount-1) + jitter, maxDelay)
 * jitter = random(0, exponential * jitterFactor)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=200ms, jitterFactor=0.2, maxDelay=30s):</strong>
 *
 * <ul>
 *   <li>attemptCount=1: 200-240ms
 *   <li>attemptCount=2: 400-480ms
 *   <li>attemptCount=3: 800-960ms
 * </ul>
 */
public class BackoffCalculator {

  private static final int MAX_SHIFT = 30;

  private final long baseDelayMs;
  private final long maxDelayMs;
  private final double jitterFactor;
  private final DoubleSupplier random;

  /**
   * @param baseDelayMs 기본 지연 시간 (밀리초, 양수)
   * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상)
   * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
   * @throws IllegalArgumentException 파라미터 검증 실패 시
   */
  public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
    this(baseDelayMs, maxDelayMs, jitterFactor, () -> ThreadLocalRandom.current().nextDouble());
  }

  BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor, DoubleSupplier random) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException(
          "baseDelayMs must be positive (current: " + baseDelayMs + ")");
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException(
          "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")");
    }
    if (jitterFactor < 0.0 || jitterFactor > 1.0) {
      throw new IllegalArgumentException(
          "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")");
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.jitterFactor = jitterFactor;
    this.random = random;
  }

  /**
   * 재시도 지연 시간 계산.
   *
   * @param attemptCount 현재 재시도 횟수 (1부터 시작)
   * @return 재시도 전 대기 시간 (밀리초)
   */
  public long calculate(int attemptCount) {
    if (attemptCount <= 0) {
      throw new IllegalArgumentException(
          "attemptCount must be positive (current: " + attemptCount + ")");
    }
    int shift = Math.min(attemptCount - 1, MAX_SHIFT);
    long exponential = baseDelayMs > (maxDelayMs >> shift) ? maxDelayMs : baseDelayMs << shift;
    long jitter = (long) (exponential * jitterFactor * random.getAsDouble());
    return Math.min(exponential + jitter, maxDelayMs);
  }

  public long getBaseDelayMs() {
    return baseDelayMs;
  }

  public long getMaxDelayMs() {
    return maxDelayMs;
  }

  public double getJitterFactor() {
    return jitterFactor;
  }
}
