package story.ingestion.infrastructure.executor.strategy;

import java.io.IOException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;
import org.redisson.client.RedisException;
import story.ingestion.error.exception.InternalSystemException;
import story.ingestion.error.exception.QueueOperationCancelledException;
import story.ingestion.error.exception.QueueStoreUnavailableException;
import story.ingestion.error.exception.base.BaseException;
import story.ingestion.infrastructure.executor.TaskContext;
import story.ingestion.util.ExceptionUtils;

/** 기술 예외를 도메인 예외로 변환하는 전략 */
@FunctionalInterface
public interface ExceptionTranslator {

  /**
   * @param e 원본 예외
   * @param context 작업 컨텍스트
   * @return 변환된 RuntimeException
   */
  RuntimeException translate(Throwable e, TaskContext context);

  /**
   * Error guard + async unwrap을 선행 적용하는 Decorator
   *
   * <ol>
   *   <li>Error → 즉시 rethrow
   *   <li>CompletionException/ExecutionException → 원본으로 unwrap
   *   <li>BaseException → 그대로 반환
   *   <li>나머지는 inner translator에 위임
   * </ol>
   */
  static ExceptionTranslator withErrorGuardAndUnwrap(ExceptionTranslator inner) {
    return (e, context) -> {
      if (e instanceof Error err) {
        throw err;
      }
      Throwable unwrapped = ExceptionUtils.unwrapAsyncException(e);
      if (unwrapped instanceof BaseException be) {
        return be;
      }
      return inner.translate(unwrapped, context);
    };
  }

  /** 기본 변환기: 도메인 예외가 아니면 InternalSystemException */
  static ExceptionTranslator defaultTranslator() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> new InternalSystemException(context.toTaskName(), unwrapped));
  }

  /**
   * 큐 저장소 예외 변환기
   *
   * <ul>
   *   <li>InterruptedException, CancellationException → Cancelled (인터럽트 플래그 복원)
   *   <li>RedisException 계열, TimeoutException, IOException → StoreUnavailable
   *   <li>그 외 → InternalSystemException
   * </ul>
   */
  static ExceptionTranslator forQueueStore() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> {
          if (unwrapped instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            return new QueueOperationCancelledException(context.toTaskName(), unwrapped);
          }
          if (unwrapped instanceof CancellationException) {
            return new QueueOperationCancelledException(context.toTaskName(), unwrapped);
          }
          if (unwrapped instanceof RedisException
              || unwrapped instanceof TimeoutException
              || unwrapped instanceof IOException) {
            return new QueueStoreUnavailableException(context.toTaskName(), unwrapped);
          }
          return new InternalSystemException(context.toTaskName(), unwrapped);
        });
  }
}
