package story.ingestion.config;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.List;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import story.ingestion.consumer.LoggingSourceIngestionHandler;
import story.ingestion.consumer.SourceIngestionHandler;
import story.ingestion.consumer.SourceTypeRoutingConsumer;
import story.ingestion.core.port.in.IngestionQueue;
import story.ingestion.core.port.out.IngestionConsumer;
import story.ingestion.infrastructure.executor.LogicExecutor;
import story.ingestion.scheduler.IngestionDispatcher;
import story.ingestion.scheduler.IngestionDispatcherLifecycle;

/**
 * 디스패처, consumer 라우팅, 라이프사이클 구성
 *
 * <p>{@link SourceIngestionHandler} 빈이 하나도 없으면 로그만 남기는 핸들러로 모든 타입을 받는다.
 */
@Configuration
public class DispatcherConfig {

  @Bean
  public IngestionConsumer ingestionConsumer(
      ObjectProvider<SourceIngestionHandler> handlers, LogicExecutor executor) {
    List<SourceIngestionHandler> registered = handlers.orderedStream().toList();
    if (registered.isEmpty()) {
      registered = List.of(new LoggingSourceIngestionHandler());
    }
    return new SourceTypeRoutingConsumer(registered, executor);
  }

  @Bean
  public IngestionDispatcher ingestionDispatcher(
      IngestionQueue queue,
      IngestionConsumer consumer,
      DispatcherProperties properties,
      LogicExecutor executor,
      Clock clock,
      MeterRegistry meterRegistry) {
    return new IngestionDispatcher(queue, consumer, properties, executor, clock, meterRegistry);
  }

  @Bean
  public IngestionDispatcherLifecycle ingestionDispatcherLifecycle(
      IngestionDispatcher dispatcher,
      DispatcherProperties properties,
      LogicExecutor executor,
      MeterRegistry meterRegistry) {
    return new IngestionDispatcherLifecycle(dispatcher, properties, executor, meterRegistry);
  }
}
