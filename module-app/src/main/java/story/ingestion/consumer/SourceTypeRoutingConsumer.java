package story.ingestion.consumer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import story.ingestion.core.context.CancellationContext;
import story.ingestion.core.domain.model.QueueItem;
import story.ingestion.core.domain.model.SourceType;
import story.ingestion.core.port.out.IngestionConsumer;
import story.ingestion.error.exception.IngestionConsumerException;
import story.ingestion.error.exception.QueueOperationCancelledException;
import story.ingestion.infrastructure.executor.LogicExecutor;
import story.ingestion.infrastructure.executor.TaskContext;

/**
 * 소스 타입별 핸들러로 항목을 분배하는 consumer
 *
 * <h3>처리 규칙</h3>
 *
 * <ul>
 *   <li>등록되지 않았거나 어휘에 없는 타입은 WARN 로그 후 건너뛴다.
 *   <li>한 항목의 실패가 나머지 항목 처리를 막지 않는다.
 *   <li>배치를 모두 시도한 뒤 실패가 있으면 {@link IngestionConsumerException} 하나로 모아 던진다.
 *   <li>컨텍스트가 취소되면 남은 항목을 시도하지 않고 취소 예외를 던진다.
 * </ul>
 */
@Slf4j
public class SourceTypeRoutingConsumer implements IngestionConsumer {

  private final Map<SourceType, SourceIngestionHandler> handlers;
  private final LogicExecutor executor;

  public SourceTypeRoutingConsumer(List<SourceIngestionHandler> handlers, LogicExecutor executor) {
    this.handlers = index(handlers);
    this.executor = executor;
  }

  @Override
  public void consume(CancellationContext ctx, UUID tenantId, List<QueueItem> items) {
    List<Throwable> failures = new ArrayList<>();
    int attempted = 0;

    for (QueueItem item : items) {
      if (ctx.isCancelled()) {
        throw cancelled(tenantId, items.size() - attempted, failures);
      }
      attempted++;

      Optional<SourceIngestionHandler> handler = item.knownSourceType().map(handlers::get);
      if (handler.isEmpty()) {
        log.warn(
            "[SourceTypeRoutingConsumer] 처리할 핸들러 없음 - skip: tenant={}, source={}:{}",
            tenantId,
            item.sourceType(),
            item.sourceId());
        continue;
      }

      executor.executeOrCatch(
          () -> {
            handler.get().handle(ctx, item);
            return Boolean.TRUE;
          },
          e -> {
            failures.add(e);
            return Boolean.FALSE;
          },
          TaskContext.of("Consumer", "Handle", item.sourceType() + ":" + item.sourceId()));
    }

    if (!failures.isEmpty()) {
      IngestionConsumerException error =
          new IngestionConsumerException(tenantId, failures.size(), items.size());
      failures.forEach(error::addSuppressed);
      throw error;
    }
  }

  /** 등록된 소스 타입 (읽기 전용) */
  public Map<SourceType, SourceIngestionHandler> getHandlers() {
    return Collections.unmodifiableMap(handlers);
  }

  private static QueueOperationCancelledException cancelled(
      UUID tenantId, int remaining, List<Throwable> failures) {
    QueueOperationCancelledException error =
        new QueueOperationCancelledException(
            "Consume tenant=" + tenantId + ", not attempted=" + remaining);
    failures.forEach(error::addSuppressed);
    return error;
  }

  private static Map<SourceType, SourceIngestionHandler> index(
      List<SourceIngestionHandler> handlers) {
    Map<SourceType, SourceIngestionHandler> byType = new EnumMap<>(SourceType.class);
    for (SourceIngestionHandler handler : handlers) {
      for (SourceType type : handler.supportedTypes()) {
        SourceIngestionHandler previous = byType.putIfAbsent(type, handler);
        if (previous != null) {
          throw new IllegalStateException(
              "Duplicate handler for "
                  + type.getWireValue()
                  + ": "
                  + previous.getClass().getSimpleName()
                  + ", "
                  + handler.getClass().getSimpleName());
        }
      }
    }
    return byType;
  }
}
