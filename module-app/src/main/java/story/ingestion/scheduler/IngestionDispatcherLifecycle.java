package story.ingestion.scheduler;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import story.ingestion.config.DispatcherProperties;
import story.ingestion.core.context.CancellationContext;
import story.ingestion.infrastructure.executor.LogicExecutor;
import story.ingestion.infrastructure.executor.TaskContext;

/**
 * 디스패처 시작/종료 조정
 *
 * <h3>종료 순서</h3>
 *
 * <ol>
 *   <li>루프 정지 (진행 중 배치는 consumerTimeout까지 대기)
 *   <li>{@code drain-on-shutdown=true}이면 cutoff 없이 한 번 Drain
 * </ol>
 *
 * <p>Integer.MAX_VALUE phase: 가장 늦게 시작하고 가장 먼저 종료하여 consumer가 의존하는 빈이 살아 있는 동안 배치를 마무리한다.
 */
@Slf4j
public class IngestionDispatcherLifecycle implements SmartLifecycle {

  private final IngestionDispatcher dispatcher;
  private final DispatcherProperties properties;
  private final LogicExecutor executor;
  private final Timer shutdownTimer;

  private volatile boolean running = false;

  public IngestionDispatcherLifecycle(
      IngestionDispatcher dispatcher,
      DispatcherProperties properties,
      LogicExecutor executor,
      MeterRegistry meterRegistry) {
    this.dispatcher = dispatcher;
    this.properties = properties;
    this.executor = executor;
    this.shutdownTimer =
        Timer.builder("ingestion.dispatcher.shutdown")
            .description("디스패처 종료 소요 시간")
            .register(meterRegistry);
  }

  @Override
  public void start() {
    if (!properties.enabled()) {
      log.info("[IngestionDispatcherLifecycle] ingestion.dispatcher.enabled=false - 루프를 시작하지 않음");
      return;
    }
    dispatcher.start();
    running = true;
  }

  @Override
  public void stop() {
    long startNanos = System.nanoTime();

    executor.executeWithFinally(
        () -> {
          boolean finished = dispatcher.stop();
          if (properties.drainOnShutdown()) {
            drainOnShutdown();
          }
          return finished;
        },
        () -> {
          running = false;
          shutdownTimer.record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
        },
        TaskContext.of("DispatcherLifecycle", "Stop"));
  }

  private void drainOnShutdown() {
    CancellationContext ctx =
        CancellationContext.background().withTimeout(properties.effectiveConsumerTimeout());
    long drained =
        executor.executeOrDefault(
            () -> dispatcher.drain(ctx), 0L, TaskContext.of("DispatcherLifecycle", "Drain"));
    log.info("[IngestionDispatcherLifecycle] 종료 Drain: items={}", drained);
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  @Override
  public int getPhase() {
    return Integer.MAX_VALUE;
  }
}
