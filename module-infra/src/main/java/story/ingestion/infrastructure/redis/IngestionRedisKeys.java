package story.ingestion.infrastructure.redis;

import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * 테넌트별 큐 키 규칙
 *
 * <pre>
 * {prefix}:{tenantId}   (기본 prefix = ingestion:queue)
 * </pre>
 *
 * <p>prefix는 SCAN 패턴에 그대로 쓰이므로 glob 메타문자({@code * ? [ ] \})를 포함할 수 없다.
 */
public final class IngestionRedisKeys {

  public static final String DEFAULT_PREFIX = "ingestion:queue";

  private static final Pattern GLOB_META = Pattern.compile("[*?\\[\\]\\\\]");
  private static final Pattern CANONICAL_UUID =
      Pattern.compile(
          "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

  private final String prefix;

  public IngestionRedisKeys(String prefix) {
    if (prefix == null || prefix.isBlank()) {
      throw new IllegalArgumentException("key prefix must not be blank");
    }
    if (GLOB_META.matcher(prefix).find()) {
      throw new IllegalArgumentException("key prefix must not contain glob characters: " + prefix);
    }
    this.prefix = prefix.endsWith(":") ? prefix.substring(0, prefix.length() - 1) : prefix;
  }

  public String queueKey(UUID tenantId) {
    return prefix + ":" + tenantId;
  }

  public String scanPattern() {
    return prefix + ":*";
  }

  /**
   * 키에서 테넌트 ID 추출
   *
   * @return 규칙에 맞지 않는 키(다른 용도의 키가 prefix를 공유하는 경우 등)는 empty
   */
  public Optional<UUID> tenantOf(String key) {
    String head = prefix + ":";
    if (key == null || !key.startsWith(head)) {
      return Optional.empty();
    }
    String raw = key.substring(head.length());
    if (!CANONICAL_UUID.matcher(raw).matches()) {
      return Optional.empty();
    }
    return Optional.of(UUID.fromString(raw));
  }
}
