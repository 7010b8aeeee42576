package story.ingestion.core.queue;

import java.util.UUID;
import java.util.regex.Pattern;
import story.ingestion.core.domain.model.QueueMember;
import story.ingestion.error.exception.InvalidQueueArgumentException;
import story.ingestion.error.exception.QueueStoreCorruptException;

/**
 * 큐 멤버 문자열 코덱
 *
 * <p>형식: {@code "{sourceType}:{sourceId}"}. sourceType에는 ':'이 올 수 없으므로 첫 번째 ':'에서 분리합니다.
 */
public final class QueueMemberCodec {

  public static final char SEPARATOR = ':';

  private static final UUID NIL = new UUID(0L, 0L);
  private static final Pattern SOURCE_TYPE = Pattern.compile("[A-Za-z0-9_]{1,64}");
  private static final Pattern CANONICAL_UUID =
      Pattern.compile(
          "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

  private QueueMemberCodec() {}

  public static String encode(String sourceType, UUID sourceId) {
    requireSourceType(sourceType);
    requireId("sourceId", sourceId);
    return sourceType + SEPARATOR + sourceId;
  }

  /**
   * 멤버 문자열 해석
   *
   * @throws QueueStoreCorruptException 구분자가 없거나 sourceType/UUID가 유효하지 않을 때
   */
  public static QueueMember decode(String member) {
    if (member == null) {
      throw new QueueStoreCorruptException("null");
    }
    int idx = member.indexOf(SEPARATOR);
    if (idx <= 0 || idx == member.length() - 1) {
      throw new QueueStoreCorruptException(member);
    }
    String sourceType = member.substring(0, idx);
    String rawId = member.substring(idx + 1);
    if (!SOURCE_TYPE.matcher(sourceType).matches() || !CANONICAL_UUID.matcher(rawId).matches()) {
      throw new QueueStoreCorruptException(member);
    }
    UUID sourceId;
    try {
      sourceId = UUID.fromString(rawId);
    } catch (IllegalArgumentException e) {
      throw new QueueStoreCorruptException(member, e);
    }
    if (NIL.equals(sourceId)) {
      throw new QueueStoreCorruptException(member);
    }
    return new QueueMember(sourceType, sourceId);
  }

  /**
   * {@link #decode}가 성공할 멤버인지 검사 (예외 없이)
   *
   * <p>저장소의 pop이 형식 오류 멤버를 건너뛸 때 쓴다. Redis Lua pop의 멤버 검사와 같은 규칙이어야 한다.
   */
  public static boolean isWellFormed(String member) {
    if (member == null) {
      return false;
    }
    int idx = member.indexOf(SEPARATOR);
    if (idx <= 0) {
      return false;
    }
    String rawId = member.substring(idx + 1);
    return SOURCE_TYPE.matcher(member.substring(0, idx)).matches()
        && CANONICAL_UUID.matcher(rawId).matches()
        && !NIL.equals(UUID.fromString(rawId));
  }

  /** sourceType 단위 필터링에 쓰는 멤버 접두어 ({@code "{sourceType}:"}) */
  public static String prefixOf(String sourceType) {
    requireSourceType(sourceType);
    return sourceType + SEPARATOR;
  }

  public static void requireSourceType(String sourceType) {
    if (sourceType == null || sourceType.isEmpty()) {
      throw new InvalidQueueArgumentException("sourceType is empty");
    }
    if (!SOURCE_TYPE.matcher(sourceType).matches()) {
      throw new InvalidQueueArgumentException("sourceType=" + sourceType);
    }
  }

  public static void requireId(String name, UUID id) {
    if (id == null || NIL.equals(id)) {
      throw new InvalidQueueArgumentException(name + " is nil");
    }
  }
}
