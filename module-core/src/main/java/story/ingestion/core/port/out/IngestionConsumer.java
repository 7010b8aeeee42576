package story.ingestion.core.port.out;

import java.util.List;
import java.util.UUID;
import story.ingestion.core.context.CancellationContext;
import story.ingestion.core.domain.model.QueueItem;

/**
 * 안정화된 배치를 처리하는 다운스트림
 *
 * <p>큐에서 꺼낸 항목은 이미 소비된 것으로 간주된다. 예외를 던져도 항목은 큐에 되돌아가지 않는다.
 */
@FunctionalInterface
public interface IngestionConsumer {

  void consume(CancellationContext ctx, UUID tenantId, List<QueueItem> items);
}
