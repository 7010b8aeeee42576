package story.ingestion.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;
import story.ingestion.infrastructure.queue.QueueStoreType;

/**
 * 수집 큐 저장소 설정
 *
 * <h2>설정</h2>
 *
 * <pre>{@code
 * ingestion:
 *   queue:
 *     store: redis              # redis | in-memory
 *     key-prefix: ingestion:queue
 *     scan-count: 100           # 테넌트 조회 SCAN COUNT 힌트
 * }</pre>
 *
 * <p>key-prefix를 바꾸면 기존 프로듀서와 키가 달라진다. 마이그레이션 없이 변경하지 않는다.
 */
@Validated
@ConfigurationProperties(prefix = "ingestion.queue")
public record IngestionQueueProperties(
    @DefaultValue("redis") @NotBlank String store,
    @DefaultValue("ingestion:queue") @NotBlank String keyPrefix,
    @DefaultValue("100") @Min(1) @Max(10000) int scanCount) {

  public IngestionQueueProperties {
    // 알 수 없는 값이면 기동 시점에 실패
    QueueStoreType.fromConfigValue(store);
  }

  public QueueStoreType storeType() {
    return QueueStoreType.fromConfigValue(store);
  }
}
