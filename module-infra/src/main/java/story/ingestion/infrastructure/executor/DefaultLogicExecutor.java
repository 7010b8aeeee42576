package story.ingestion.infrastructure.executor;

import java.util.Objects;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import story.ingestion.error.exception.QueueOperationCancelledException;
import story.ingestion.error.exception.base.BaseException;
import story.ingestion.error.exception.base.ClientBaseException;
import story.ingestion.infrastructure.executor.function.ThrowingSupplier;
import story.ingestion.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * 기본 LogicExecutor 구현체
 *
 * <ul>
 *   <li><b>Error 즉시 rethrow</b>: VirtualMachineError 등은 번역 없이 전파
 *   <li><b>로그 레벨</b>: ClientBaseException, 취소는 DEBUG / 재시도 가능한 서버 예외는 WARN / 나머지는 ERROR
 *   <li><b>translator 실패</b>: translator가 던진 RuntimeException을 그대로 primary로 삼는다
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class DefaultLogicExecutor implements LogicExecutor {

  private static final String UNEXPECTED_TRANSLATOR_FAILURE =
      "Translator failed with unexpected Throwable";

  private final ExceptionTranslator translator;

  public DefaultLogicExecutor() {
    this(ExceptionTranslator.defaultTranslator());
  }

  @Override
  public <T> T execute(ThrowingSupplier<T> task, TaskContext context) {
    return executeWithTranslation(task, translator, context);
  }

  @Override
  public <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context) {
    return executeOrCatch(task, e -> defaultValue, context);
  }

  @Override
  public <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(recovery, "recovery");
    Objects.requireNonNull(context, "context");

    try {
      return task.get();
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      Throwable translated = translateSafe(translator, t, context);
      logFailure(translated, context);
      return recovery.apply(translated);
    }
  }

  @Override
  public <T> T executeWithFinally(
      ThrowingSupplier<T> task, Runnable finallyBlock, TaskContext context) {
    Objects.requireNonNull(finallyBlock, "finallyBlock");

    T result;
    try {
      result = execute(task, context);
    } catch (RuntimeException | Error primary) {
      runCleanupSuppressing(primary, finallyBlock);
      throw primary;
    }
    finallyBlock.run();
    return result;
  }

  @Override
  public <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator customTranslator, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(customTranslator, "customTranslator");
    Objects.requireNonNull(context, "context");

    try {
      return task.get();
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      Throwable primary = translateSafe(customTranslator, t, context);
      logFailure(primary, context);
      throw asUnchecked(primary);
    }
  }

  @Override
  public <T> T executeWithFallback(
      ThrowingSupplier<T> task, Function<Throwable, T> fallback, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(fallback, "fallback");
    Objects.requireNonNull(context, "context");

    try {
      return task.get();
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      return fallback.apply(t);
    }
  }

  private static Throwable translateSafe(
      ExceptionTranslator customTranslator, Throwable t, TaskContext context) {
    try {
      return customTranslator.translate(t, context);
    } catch (RuntimeException | Error ex) {
      return ex;
    } catch (Throwable unexpected) {
      return new IllegalStateException(UNEXPECTED_TRANSLATOR_FAILURE, unexpected);
    }
  }

  private static void logFailure(Throwable error, TaskContext context) {
    String taskName = context.toTaskName();
    if (error instanceof ClientBaseException || error instanceof QueueOperationCancelledException) {
      log.debug("[Task:FAILURE] {}, errorType={}", taskName, error.getClass().getSimpleName());
      return;
    }
    if (error instanceof BaseException be && be.isRetryable()) {
      log.warn(
          "[Task:FAILURE] {}, errorType={}, message={}",
          taskName,
          error.getClass().getSimpleName(),
          error.getMessage());
      return;
    }
    log.error("[Task:FAILURE] {}, errorType={}", taskName, error.getClass().getSimpleName(), error);
  }

  private static void runCleanupSuppressing(Throwable primary, Runnable finallyBlock) {
    try {
      finallyBlock.run();
    } catch (Throwable cleanupEx) {
      if (cleanupEx != primary) {
        primary.addSuppressed(cleanupEx);
      }
    }
  }

  private static RuntimeException asUnchecked(Throwable t) {
    if (t instanceof Error e) {
      throw e;
    }
    if (t instanceof RuntimeException re) {
      return re;
    }
    return new IllegalStateException("Unexpected checked throwable", t);
  }
}
