package story.ingestion.core.context;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import story.ingestion.error.exception.QueueOperationCancelledException;

/**
 * 호출 단위 취소/데드라인 전파 컨텍스트
 *
 * <h3>규칙</h3>
 *
 * <ul>
 *   <li>부모가 취소되면 모든 자식도 취소된 것으로 본다.
 *   <li>자식의 데드라인은 부모 데드라인보다 늦을 수 없다.
 *   <li>자식 취소는 부모에 영향을 주지 않는다.
 * </ul>
 *
 * <p>자식은 부모를 참조만 하고 부모는 자식을 추적하지 않으므로 장수 루트에서 파생해도 누적되지 않는다.
 */
public final class CancellationContext {

  private static final long NO_DEADLINE = Long.MAX_VALUE;
  private static final long SLEEP_SLICE_NANOS = TimeUnit.MILLISECONDS.toNanos(20);

  private final CancellationContext parent;
  private final long deadlineNanos;
  private volatile boolean cancelled;

  private CancellationContext(CancellationContext parent, long deadlineNanos) {
    this.parent = parent;
    this.deadlineNanos = deadlineNanos;
  }

  /** 취소되지 않고 데드라인도 없는 루트 컨텍스트 */
  public static CancellationContext background() {
    return new CancellationContext(null, NO_DEADLINE);
  }

  /** 부모의 취소와 데드라인을 물려받는 자식 */
  public CancellationContext child() {
    return new CancellationContext(this, deadlineNanos);
  }

  /**
   * 타임아웃이 걸린 자식 생성
   *
   * @param timeout 지금부터의 허용 시간 (양수)
   */
  public CancellationContext withTimeout(Duration timeout) {
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive: " + timeout);
    }
    long now = System.nanoTime();
    long candidate = now + saturatedNanos(timeout);
    if (candidate < now) {
      candidate = NO_DEADLINE;
    }
    return new CancellationContext(this, Math.min(deadlineNanos, candidate));
  }

  public void cancel() {
    cancelled = true;
  }

  public boolean isCancelled() {
    return cancelledExplicitly() || isDeadlineExceeded();
  }

  public boolean isDeadlineExceeded() {
    return deadlineNanos != NO_DEADLINE && System.nanoTime() - deadlineNanos >= 0;
  }

  public boolean hasDeadline() {
    return deadlineNanos != NO_DEADLINE;
  }

  /**
   * 데드라인까지 남은 시간
   *
   * @return 남은 나노초, 데드라인이 없으면 {@link Long#MAX_VALUE}, 지났으면 0
   */
  public long remainingNanos() {
    if (deadlineNanos == NO_DEADLINE) {
      return NO_DEADLINE;
    }
    return Math.max(0L, deadlineNanos - System.nanoTime());
  }

  /**
   * 취소되었으면 {@link QueueOperationCancelledException}을 던진다.
   *
   * @param operation 예외 메시지에 남길 작업 이름
   */
  public void throwIfCancelled(String operation) {
    if (cancelledExplicitly()) {
      throw new QueueOperationCancelledException(operation + ": cancelled");
    }
    if (isDeadlineExceeded()) {
      throw new QueueOperationCancelledException(operation + ": deadline exceeded");
    }
  }

  /**
   * 취소를 관찰하며 대기
   *
   * <p>인터럽트되면 인터럽트 플래그를 복원하고 false를 반환한다.
   *
   * @return 전체 시간을 기다렸으면 true, 취소/인터럽트로 중단되었으면 false
   */
  public boolean sleep(Duration duration) {
    long deadline = System.nanoTime() + saturatedNanos(duration);
    while (true) {
      if (isCancelled()) {
        return false;
      }
      long left = deadline - System.nanoTime();
      if (left <= 0) {
        return true;
      }
      try {
        TimeUnit.NANOSECONDS.sleep(Math.min(left, SLEEP_SLICE_NANOS));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return false;
      }
    }
  }

  private boolean cancelledExplicitly() {
    for (CancellationContext c = this; c != null; c = c.parent) {
      if (c.cancelled) {
        return true;
      }
    }
    return false;
  }

  private static long saturatedNanos(Duration duration) {
    try {
      return Math.max(0L, duration.toNanos());
    } catch (ArithmeticException overflow) {
      return NO_DEADLINE;
    }
  }
}
