package story.ingestion.consumer;

import java.util.EnumSet;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import story.ingestion.core.context.CancellationContext;
import story.ingestion.core.domain.model.QueueItem;
import story.ingestion.core.domain.model.SourceType;

/** 로컬 실행용 핸들러. 모든 소스 타입을 받아 로그만 남긴다. */
@Slf4j
public class LoggingSourceIngestionHandler implements SourceIngestionHandler {

  @Override
  public Set<SourceType> supportedTypes() {
    return EnumSet.allOf(SourceType.class);
  }

  @Override
  public void handle(CancellationContext ctx, QueueItem item) {
    log.info(
        "[LoggingSourceIngestionHandler] tenant={}, source={}:{}, timestamp={}",
        item.tenantId(),
        item.sourceType(),
        item.sourceId(),
        item.timestamp());
  }
}
