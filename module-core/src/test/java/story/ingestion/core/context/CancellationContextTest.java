package story.ingestion.core.context;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import story.ingestion.error.exception.QueueOperationCancelledException;

@Tag("unit")
@DisplayName("CancellationContext 테스트")
class CancellationContextTest {

  @Test
  @DisplayName("background는 취소되지 않고 데드라인이 없다")
  void backgroundNeverCancelled() {
    CancellationContext ctx = CancellationContext.background();

    assertThat(ctx.isCancelled()).isFalse();
    assertThat(ctx.hasDeadline()).isFalse();
    assertThat(ctx.remainingNanos()).isEqualTo(Long.MAX_VALUE);
  }

  @Test
  @DisplayName("부모 취소는 자식에 전파되고 자식 취소는 부모에 전파되지 않는다")
  void cancellationFlowsDownOnly() {
    CancellationContext parent = CancellationContext.background();
    CancellationContext child = parent.child();
    CancellationContext sibling = parent.child();

    child.cancel();
    assertThat(child.isCancelled()).isTrue();
    assertThat(parent.isCancelled()).isFalse();
    assertThat(sibling.isCancelled()).isFalse();

    parent.cancel();
    assertThat(sibling.isCancelled()).isTrue();
  }

  @Test
  @DisplayName("데드라인이 지나면 취소로 본다")
  void deadlineExceeded() {
    CancellationContext ctx = CancellationContext.background().withTimeout(Duration.ofMillis(30));

    assertThat(ctx.sleep(Duration.ofSeconds(5))).isFalse();
    assertThat(ctx.isDeadlineExceeded()).isTrue();
    assertThatThrownBy(() -> ctx.throwIfCancelled("pop"))
        .isInstanceOf(QueueOperationCancelledException.class)
        .hasMessageContaining("deadline exceeded");
  }

  @Test
  @DisplayName("자식 타임아웃은 부모 데드라인을 넘지 못한다")
  void childDeadlineBoundedByParent() {
    CancellationContext parent =
        CancellationContext.background().withTimeout(Duration.ofMillis(200));
    CancellationContext child = parent.withTimeout(Duration.ofHours(1));

    assertThat(child.remainingNanos()).isLessThanOrEqualTo(TimeUnit.MILLISECONDS.toNanos(200));
  }

  @Test
  @DisplayName("다른 스레드의 cancel로 sleep이 조기 종료된다")
  void sleepReturnsEarlyOnCancel() throws Exception {
    CancellationContext ctx = CancellationContext.background().child();
    CountDownLatch started = new CountDownLatch(1);
    AtomicBoolean completed = new AtomicBoolean(true);

    Thread sleeper =
        new Thread(
            () -> {
              started.countDown();
              completed.set(ctx.sleep(Duration.ofSeconds(30)));
            });
    sleeper.start();
    started.await();
    ctx.cancel();
    sleeper.join(TimeUnit.SECONDS.toMillis(5));

    assertThat(sleeper.isAlive()).isFalse();
    assertThat(completed.get()).isFalse();
  }

  @Test
  @DisplayName("인터럽트되면 false를 반환하고 플래그를 복원한다")
  void sleepRestoresInterruptFlag() {
    Thread.currentThread().interrupt();
    try {
      boolean completed = CancellationContext.background().sleep(Duration.ofSeconds(5));

      assertThat(completed).isFalse();
      assertThat(Thread.currentThread().isInterrupted()).isTrue();
    } finally {
      Thread.interrupted();
    }
  }

  @Test
  @DisplayName("0 이하 타임아웃은 거부")
  void rejectsNonPositiveTimeout() {
    assertThatThrownBy(() -> CancellationContext.background().withTimeout(Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
