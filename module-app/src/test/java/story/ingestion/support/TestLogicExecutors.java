package story.ingestion.support;

import java.util.function.Function;
import org.mockito.ArgumentMatchers;
import org.mockito.Mockito;
import story.ingestion.infrastructure.executor.LogicExecutor;
import story.ingestion.infrastructure.executor.TaskContext;
import story.ingestion.infrastructure.executor.function.ThrowingSupplier;
import story.ingestion.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * 작업을 그대로 실행하는 LogicExecutor mock
 *
 * <pre>{@code
 * LogicExecutor executor = TestLogicExecutors.passThrough();
 * }</pre>
 *
 * <p>로그와 번역 없이 작업만 실행하므로 executor 호출 여부를 verify하면서 실제 로직을 돌릴 수 있다.
 */
public final class TestLogicExecutors {

  private TestLogicExecutors() {}

  public static LogicExecutor passThrough() {
    LogicExecutor mock = Mockito.mock(LogicExecutor.class);

    Mockito.lenient()
        .when(
            mock.execute(
                ArgumentMatchers.<ThrowingSupplier<Object>>any(),
                ArgumentMatchers.<TaskContext>any()))
        .thenAnswer(
            invocation -> {
              ThrowingSupplier<Object> task = invocation.getArgument(0);
              return task.get();
            });

    Mockito.lenient()
        .when(
            mock.executeOrDefault(
                ArgumentMatchers.<ThrowingSupplier<Object>>any(),
                ArgumentMatchers.any(),
                ArgumentMatchers.<TaskContext>any()))
        .thenAnswer(
            invocation -> {
              ThrowingSupplier<Object> task = invocation.getArgument(0);
              try {
                return task.get();
              } catch (Throwable t) {
                return invocation.getArgument(1);
              }
            });

    Mockito.lenient()
        .when(
            mock.executeOrCatch(
                ArgumentMatchers.<ThrowingSupplier<Object>>any(),
                ArgumentMatchers.<Function<Throwable, Object>>any(),
                ArgumentMatchers.<TaskContext>any()))
        .thenAnswer(
            invocation -> {
              ThrowingSupplier<Object> task = invocation.getArgument(0);
              Function<Throwable, Object> recovery = invocation.getArgument(1);
              try {
                return task.get();
              } catch (Throwable t) {
                return recovery.apply(t);
              }
            });

    Mockito.lenient()
        .when(
            mock.executeWithFinally(
                ArgumentMatchers.<ThrowingSupplier<Object>>any(),
                ArgumentMatchers.<Runnable>any(),
                ArgumentMatchers.<TaskContext>any()))
        .thenAnswer(
            invocation -> {
              ThrowingSupplier<Object> task = invocation.getArgument(0);
              Runnable finallyBlock = invocation.getArgument(1);
              try {
                return task.get();
              } finally {
                finallyBlock.run();
              }
            });

    Mockito.lenient()
        .when(
            mock.executeWithTranslation(
                ArgumentMatchers.<ThrowingSupplier<Object>>any(),
                ArgumentMatchers.<ExceptionTranslator>any(),
                ArgumentMatchers.<TaskContext>any()))
        .thenAnswer(
            invocation -> {
              ThrowingSupplier<Object> task = invocation.getArgument(0);
              ExceptionTranslator translator = invocation.getArgument(1);
              try {
                return task.get();
              } catch (Throwable t) {
                throw translator.translate(t, invocation.getArgument(2));
              }
            });

    return mock;
  }
}
