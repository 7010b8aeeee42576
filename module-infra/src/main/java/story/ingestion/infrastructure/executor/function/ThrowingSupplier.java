package story.ingestion.infrastructure.executor.function;

/**
 * 예외를 던질 수 있는 값 공급 작업
 *
 * <p>표준 {@link java.util.function.Supplier}와 달리 Checked Exception을 던질 수 있습니다. Redisson Future 대기처럼
 * {@code ExecutionException}/{@code InterruptedException}을 던지는 코드를 {@code LogicExecutor}에 그대로 넘길 때
 * 사용합니다.
 *
 * @param <T> 결과 타입
 */
@FunctionalInterface
public interface ThrowingSupplier<T> {

  /**
   * @return 작업 결과
   * @throws Throwable 작업 실행 중 발생한 예외
   */
  T get() throws Throwable;
}
