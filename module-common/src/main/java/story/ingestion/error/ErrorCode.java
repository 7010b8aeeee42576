package story.ingestion.error;

/**
 * 에러 코드 계약
 *
 * <p>{@link #getMessage()}는 {@link String#format} 형식 문자열이며 예외 생성 시 인자로 완성됩니다.
 */
public interface ErrorCode {
  String getCode();

  String getMessage();
}
