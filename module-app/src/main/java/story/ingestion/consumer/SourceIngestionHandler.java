package story.ingestion.consumer;

import java.util.Set;
import story.ingestion.core.context.CancellationContext;
import story.ingestion.core.domain.model.QueueItem;
import story.ingestion.core.domain.model.SourceType;

/**
 * 소스 타입별 후처리 (인덱싱, 임베딩 등)
 *
 * <p>같은 항목이 다시 전달될 수 있으므로 멱등하게 구현한다.
 */
public interface SourceIngestionHandler {

  /** 이 핸들러가 담당하는 소스 타입. 타입마다 핸들러는 하나만 등록할 수 있다. */
  Set<SourceType> supportedTypes();

  void handle(CancellationContext ctx, QueueItem item);
}
