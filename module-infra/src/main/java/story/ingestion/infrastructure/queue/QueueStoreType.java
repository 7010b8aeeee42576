package story.ingestion.infrastructure.queue;

/**
 * 큐 저장소 타입 식별자
 *
 * <h3>application.yml 설정</h3>
 *
 * <pre>
 * ingestion:
 *   queue:
 *     store: ${INGESTION_QUEUE_STORE:redis}  # redis | in-memory
 * </pre>
 */
public enum QueueStoreType {

  /**
   * ConcurrentHashMap 기반 단일 프로세스 저장소
   *
   * <ul>
   *   <li>장점: 외부 의존성 없음
   *   <li>단점: 재시작 시 유실, 인스턴스 간 공유 불가
   *   <li>적합: 로컬 실행, 테스트
   * </ul>
   */
  IN_MEMORY("in-memory"),

  /**
   * Redis ZSET (테넌트별 키)
   *
   * <ul>
   *   <li>장점: 다중 인스턴스 공유, 재시작 후에도 유지
   *   <li>단점: 네트워크 RTT
   * </ul>
   */
  REDIS("redis");

  private final String configValue;

  QueueStoreType(String configValue) {
    this.configValue = configValue;
  }

  public String getConfigValue() {
    return configValue;
  }

  /**
   * 설정값으로 QueueStoreType 조회
   *
   * @throws IllegalArgumentException 알 수 없는 설정값
   */
  public static QueueStoreType fromConfigValue(String configValue) {
    for (QueueStoreType type : values()) {
      if (type.configValue.equalsIgnoreCase(configValue)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown ingestion.queue.store: " + configValue);
  }
}
