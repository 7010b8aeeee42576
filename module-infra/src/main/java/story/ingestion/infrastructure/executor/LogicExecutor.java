package story.ingestion.infrastructure.executor;

import java.util.function.Function;
import story.ingestion.infrastructure.executor.function.ThrowingSupplier;
import story.ingestion.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * 예외 처리 패턴을 추상화한 실행기
 *
 * <p>비즈니스 로직은 별도 메서드로 분리하고 메서드 참조나 짧은 람다로 넘긴다. try/catch는 이 인터페이스 뒤에만 둔다.
 *
 * <h3>지원 패턴</h3>
 *
 * <ol>
 *   <li><b>try-catch-throw</b> (예외 변환 후 재전파) - {@link #execute}
 *   <li><b>try-catch-return</b> (기본값 반환) - {@link #executeOrDefault}
 *   <li><b>try-catch-recover</b> (번역된 예외로 복구) - {@link #executeOrCatch}
 *   <li><b>try-finally</b> (정리 작업) - {@link #executeWithFinally}
 *   <li><b>다중 catch</b> (ExceptionTranslator 지정) - {@link #executeWithTranslation}
 *   <li><b>원본 예외 fallback</b> - {@link #executeWithFallback}
 * </ol>
 *
 * <h3>사용 예시</h3>
 *
 * <pre>{@code
 * List<UUID> tenants = executor.executeOrDefault(
 *     () -> queue.listTenantsWithItems(ctx),
 *     List.of(),
 *     TaskContext.of("Dispatcher", "ListTenants"));
 * }</pre>
 *
 * @see ThrowingSupplier
 * @see ExceptionTranslator
 */
public interface LogicExecutor {

  /**
   * 예외를 기본 translator로 변환하여 전파
   *
   * @throws RuntimeException 변환된 예외 ({@code BaseException}은 그대로)
   */
  <T> T execute(ThrowingSupplier<T> task, TaskContext context);

  /** 예외 발생 시 로그를 남기고 기본값 반환 */
  <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context);

  /** 예외 발생 시 번역된 예외를 받아 복구값 생성 */
  <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context);

  /** 작업 후 finallyBlock을 정확히 한 번 실행. 정리 중 예외는 원래 예외의 suppressed로 붙는다. */
  <T> T executeWithFinally(ThrowingSupplier<T> task, Runnable finallyBlock, TaskContext context);

  <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator translator, TaskContext context);

  /** 번역 없이 원본 예외를 fallback에 전달 */
  <T> T executeWithFallback(
      ThrowingSupplier<T> task, Function<Throwable, T> fallback, TaskContext context);
}
