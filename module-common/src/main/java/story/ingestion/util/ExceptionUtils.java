package story.ingestion.util;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Exception unwrapping utilities.
 *
 * <p>Extracts root causes from wrapped exceptions like CompletionException and ExecutionException.
 */
public class ExceptionUtils {

  /**
   * Unwrap async exception wrappers to find the root cause.
   *
   * <p>Unwraps: CompletionException, ExecutionException
   *
   * @param throwable The exception to unwrap
   * @return The root cause, or the original if not wrapped
   */
  public static Throwable unwrapAsyncException(Throwable throwable) {
    Throwable cause = throwable;
    while (cause instanceof CompletionException || cause instanceof ExecutionException) {
      cause = cause.getCause();
      if (cause == null) {
        return throwable;
      }
    }
    return cause;
  }

  /**
   * 원인 체인에 특정 메시지 조각이 포함되어 있는지 확인합니다. (Redis NOSCRIPT 감지용)
   *
   * @param throwable 검사할 예외
   * @param fragment 찾을 메시지 조각
   * @return 체인 어딘가에 포함되어 있으면 true
   */
  public static boolean causeMessageContains(Throwable throwable, String fragment) {
    Throwable current = throwable;
    while (current != null) {
      String message = current.getMessage();
      if (message != null && message.contains(fragment)) {
        return true;
      }
      if (current.getCause() == current) {
        return false;
      }
      current = current.getCause();
    }
    return false;
  }

  private ExceptionUtils() {
    // Utility class
  }
}
