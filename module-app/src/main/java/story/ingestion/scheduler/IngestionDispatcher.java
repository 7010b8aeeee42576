package story.ingestion.scheduler;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import story.ingestion.config.DispatcherProperties;
import story.ingestion.core.context.CancellationContext;
import story.ingestion.core.domain.model.QueueItem;
import story.ingestion.core.port.in.IngestionQueue;
import story.ingestion.core.port.out.IngestionConsumer;
import story.ingestion.error.exception.QueueOperationCancelledException;
import story.ingestion.error.exception.base.BaseException;
import story.ingestion.infrastructure.executor.LogicExecutor;
import story.ingestion.infrastructure.executor.TaskContext;
import story.ingestion.infrastructure.retry.BackoffCalculator;

/**
 * 안정화된 항목을 테넌트 단위로 꺼내 consumer에 넘기는 디스패처
 *
 * <h3>틱 처리 순서</h3>
 *
 * <ol>
 *   <li>항목이 있는 테넌트 조회 (직전 틱에서 배치가 가득 찼던 테넌트가 먼저)
 *   <li>테넌트마다 {@code popStable(now - quietPeriod, batchLimit)} 한 번
 *   <li>비어 있지 않은 배치는 consumerTimeout이 걸린 컨텍스트로 consumer에 전달
 *   <li>배치가 batchLimit만큼 찼으면 테넌트를 표시하고 다음 틱을 대기 없이 시작
 * </ol>
 *
 * <p>한 틱 안에서 같은 테넌트를 반복해서 비우지 않으므로 큰 테넌트가 다른 테넌트를 굶기지 않는다.
 *
 * <h3>종료</h3>
 *
 * <p>{@link #stop()}은 루프 컨텍스트를 취소하고 진행 중인 배치를 최대 consumerTimeout까지 기다린다. 루프 컨텍스트는 새 pop을 보낼지만
 * 결정한다. 이미 보낸 pop과 consumer 호출은 루프와 별개의 루트에서 파생된 컨텍스트로 실행되므로 종료 중에도 꺼낸 배치가 consumer까지
 * 전달된다. 꺼낸 항목은 consumer 실패와 상관없이 소비된 것으로 본다.
 */
@Slf4j
public class IngestionDispatcher implements AutoCloseable {

  private static final String COMPONENT = "Dispatcher";
  private static final String OP_LIST = "list";
  private static final String OP_POP = "pop";

  private final IngestionQueue queue;
  private final IngestionConsumer consumer;
  private final DispatcherProperties properties;
  private final LogicExecutor executor;
  private final Clock clock;
  private final BackoffCalculator backoff;

  private final ExecutorService loopExecutor;
  private final ExecutorService drainPool;
  private final CancellationContext consumerRoot = CancellationContext.background();
  private final Set<UUID> pendingRedrain = ConcurrentHashMap.newKeySet();
  private final AtomicInteger tenantsWithItems = new AtomicInteger();

  private final Counter batchSuccessCounter;
  private final Counter batchFailureCounter;
  private final Counter itemsCounter;
  private final Map<String, Counter> retryCounters;
  private final Timer tickTimer;

  private CancellationContext loopContext;
  private Future<?> loopFuture;

  public IngestionDispatcher(
      IngestionQueue queue,
      IngestionConsumer consumer,
      DispatcherProperties properties,
      LogicExecutor executor,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.queue = queue;
    this.consumer = consumer;
    this.properties = properties;
    this.executor = executor;
    this.clock = clock;
    this.backoff =
        new BackoffCalculator(
            Math.max(1L, properties.retry().baseDelay().toMillis()),
            Math.max(1L, properties.quietPeriod().toMillis()),
            properties.retry().jitterFactor());

    this.loopExecutor =
        Executors.newSingleThreadExecutor(new CustomizableThreadFactory("ingestion-dispatcher-"));
    this.drainPool =
        Executors.newFixedThreadPool(
            properties.maxConcurrentTenants(), new CustomizableThreadFactory("ingestion-drain-"));

    Gauge.builder("ingestion.queue.tenants", tenantsWithItems, AtomicInteger::get)
        .description("마지막 틱에서 항목이 있던 테넌트 수")
        .register(meterRegistry);
    this.batchSuccessCounter =
        Counter.builder("ingestion.dispatcher.batches")
            .tag("result", "success")
            .register(meterRegistry);
    this.batchFailureCounter =
        Counter.builder("ingestion.dispatcher.batches")
            .tag("result", "failure")
            .register(meterRegistry);
    this.itemsCounter =
        Counter.builder("ingestion.dispatcher.items")
            .description("consumer에 넘긴 항목 수")
            .register(meterRegistry);
    this.retryCounters =
        Map.of(
            OP_LIST, retryCounter(meterRegistry, OP_LIST),
            OP_POP, retryCounter(meterRegistry, OP_POP));
    this.tickTimer = Timer.builder("ingestion.dispatcher.tick").register(meterRegistry);
  }

  // ==================== 루프 제어 ====================

  /** 루프 시작. 첫 틱은 즉시 실행된다. */
  public synchronized void start() {
    if (loopContext != null) {
      return;
    }
    CancellationContext ctx = CancellationContext.background();
    loopContext = ctx;
    loopFuture = loopExecutor.submit(() -> runLoop(ctx));
    log.info(
        "[IngestionDispatcher] 시작: quietPeriod={}, tickInterval={}, batchLimit={}, maxConcurrentTenants={}",
        properties.quietPeriod(),
        properties.effectiveTickInterval(),
        properties.batchLimit(),
        properties.maxConcurrentTenants());
  }

  /**
   * 새 틱을 멈추고 진행 중인 배치를 최대 consumerTimeout까지 기다린다.
   *
   * @return 제한 시간 안에 루프가 끝났으면 true
   */
  public boolean stop() {
    CancellationContext ctx;
    Future<?> loop;
    synchronized (this) {
      if (loopContext == null) {
        return true;
      }
      ctx = loopContext;
      loop = loopFuture;
      loopContext = null;
      loopFuture = null;
    }

    ctx.cancel();
    Duration timeout = properties.effectiveConsumerTimeout();
    boolean finished = awaitLoop(loop, timeout);
    if (finished) {
      log.info("[IngestionDispatcher] 정지 완료");
    } else {
      log.warn("[IngestionDispatcher] {} 안에 진행 중인 배치가 끝나지 않음 - 대기 중단", timeout);
    }
    return finished;
  }

  public synchronized boolean isRunning() {
    return loopContext != null;
  }

  /** 루프를 멈추고 스레드 풀을 정리한다. 아직 처리 중인 consumer 컨텍스트도 취소된다. */
  @Override
  public void close() {
    stop();
    consumerRoot.cancel();
    loopExecutor.shutdownNow();
    drainPool.shutdownNow();
  }

  private void runLoop(CancellationContext ctx) {
    Duration tickInterval = properties.effectiveTickInterval();
    while (!ctx.isCancelled()) {
      DispatchTickResult result =
          executor.executeOrDefault(
              () -> tick(ctx), DispatchTickResult.EMPTY, TaskContext.of(COMPONENT, "Tick"));

      if (result.shouldRedrainImmediately()) {
        continue;
      }
      if (!ctx.sleep(tickInterval)) {
        break;
      }
    }
  }

  // ==================== 틱 ====================

  /**
   * 디스패처 한 번 반복 (동기)
   *
   * <p>모든 테넌트 작업이 끝날 때까지 반환하지 않는다.
   */
  public DispatchTickResult tick(CancellationContext ctx) {
    return tickTimer.record(() -> runTick(ctx));
  }

  private DispatchTickResult runTick(CancellationContext ctx) {
    Instant stableAt = clock.instant().minus(properties.quietPeriod());
    int storeFailures = 0;

    List<UUID> listed = listTenants(ctx);
    if (listed == null) {
      storeFailures++;
    } else {
      tenantsWithItems.set(listed.size());
    }

    // 직전 틱에서 가득 찼던 테넌트가 먼저 제출된다
    Set<UUID> tenants = new LinkedHashSet<>(pendingRedrain);
    if (listed != null) {
      tenants.addAll(listed);
    }

    Map<UUID, Future<TenantDrainResult>> futures = new LinkedHashMap<>();
    for (UUID tenant : tenants) {
      futures.put(tenant, drainPool.submit(() -> drainOnce(ctx, tenant, stableAt)));
    }

    int batches = 0;
    long items = 0;
    for (Map.Entry<UUID, Future<TenantDrainResult>> entry : futures.entrySet()) {
      TenantDrainResult result = await(entry.getKey(), entry.getValue());
      if (result.storeFailed()) {
        storeFailures++;
      }
      if (result.items() > 0) {
        batches++;
        items += result.items();
      }
    }

    DispatchTickResult result =
        new DispatchTickResult(
            listed == null ? 0 : listed.size(),
            batches,
            items,
            pendingRedrain.size(),
            storeFailures);
    if (batches > 0 || storeFailures > 0) {
      log.info("[IngestionDispatcher] 틱 완료: {}", result);
    } else {
      log.debug("[IngestionDispatcher] 틱 완료: {}", result);
    }
    return result;
  }

  private TenantDrainResult drainOnce(CancellationContext ctx, UUID tenant, Instant stableAt) {
    if (ctx.isCancelled()) {
      return TenantDrainResult.SKIPPED;
    }

    int limit = properties.batchLimit();
    List<QueueItem> batch =
        executor.executeOrDefault(
            () -> withRetry(ctx, OP_POP, tenant, () -> popIfLive(ctx, tenant, stableAt, limit)),
            null,
            TaskContext.of(COMPONENT, "PopStable", tenant.toString()));

    if (batch == null) {
      // 표시 상태는 그대로 둔다. 다음 틱에 다시 시도한다.
      return TenantDrainResult.STORE_FAILED;
    }
    if (batch.size() >= limit) {
      pendingRedrain.add(tenant);
    } else {
      pendingRedrain.remove(tenant);
    }
    if (batch.isEmpty()) {
      return TenantDrainResult.SKIPPED;
    }

    handOff(tenant, batch);
    return new TenantDrainResult(batch.size(), false);
  }

  // ==================== Drain ====================

  /**
   * 모든 테넌트를 cutoff 없이 비운다 (종료 시 사용).
   *
   * <p>테넌트마다 배치가 가득 차 있는 동안 반복해서 꺼내고, 모든 consumer 호출이 끝날 때까지 기다린다.
   *
   * @return consumer에 넘긴 항목 수
   */
  public long drain(CancellationContext ctx) {
    Set<UUID> tenants = new LinkedHashSet<>(pendingRedrain);
    tenants.addAll(withRetry(ctx, OP_LIST, null, () -> queue.listTenantsWithItems(ctx)));

    Map<UUID, Future<Long>> futures = new LinkedHashMap<>();
    for (UUID tenant : tenants) {
      futures.put(tenant, drainPool.submit(() -> drainFully(ctx, tenant)));
    }

    long total = 0;
    for (Map.Entry<UUID, Future<Long>> entry : futures.entrySet()) {
      total += awaitDrained(entry.getKey(), entry.getValue());
    }
    log.info("[IngestionDispatcher] Drain 완료: tenants={}, items={}", tenants.size(), total);
    return total;
  }

  private long drainFully(CancellationContext ctx, UUID tenant) {
    int limit = properties.batchLimit();
    long handed = 0;

    while (!ctx.isCancelled()) {
      List<QueueItem> batch =
          executor.executeOrDefault(
              () ->
                  withRetry(
                      ctx,
                      OP_POP,
                      tenant,
                      () -> popIfLive(ctx, tenant, IngestionQueue.DRAIN_ALL, limit)),
              null,
              TaskContext.of(COMPONENT, "Drain", tenant.toString()));
      if (batch == null || batch.isEmpty()) {
        break;
      }

      handOff(tenant, batch);
      handed += batch.size();
      if (batch.size() < limit) {
        pendingRedrain.remove(tenant);
        break;
      }
    }
    return handed;
  }

  /**
   * 호출자 컨텍스트가 살아 있을 때만 pop을 보낸다.
   *
   * <p>pop 자체는 종료로 취소되지 않는 컨텍스트(consumerTimeout 제한)로 실행하므로 응답을 기다리는 중에 stop이 와도 꺼낸 배치는 그대로
   * 반환된다.
   */
  private List<QueueItem> popIfLive(
      CancellationContext ctx, UUID tenant, Instant stableAt, int limit) {
    ctx.throwIfCancelled(COMPONENT + ":PopStable");
    CancellationContext popCtx = consumerRoot.withTimeout(properties.effectiveConsumerTimeout());
    return queue.popStable(popCtx, tenant, stableAt, limit);
  }

  // ==================== Consumer 전달 ====================

  private void handOff(UUID tenant, List<QueueItem> batch) {
    Duration timeout = properties.effectiveConsumerTimeout();
    CancellationContext consumerCtx = consumerRoot.withTimeout(timeout);
    long startNanos = System.nanoTime();
    itemsCounter.increment(batch.size());

    boolean succeeded =
        executor.executeOrCatch(
            () -> {
              consumer.consume(consumerCtx, tenant, batch);
              return Boolean.TRUE;
            },
            e -> Boolean.FALSE,
            TaskContext.of(COMPONENT, "Consume", tenant.toString()));

    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    if (consumerCtx.isDeadlineExceeded()) {
      log.warn(
          "[IngestionDispatcher] consumer가 제한 시간을 넘겨 반환: tenant={}, items={}, elapsed={}ms, timeout={}",
          tenant,
          batch.size(),
          elapsedMs,
          timeout);
    }

    if (succeeded) {
      batchSuccessCounter.increment();
      log.info(
          "[IngestionDispatcher] 배치 전달: tenant={}, items={}, elapsed={}ms",
          tenant,
          batch.size(),
          elapsedMs);
    } else {
      // 꺼낸 항목은 되돌리지 않는다
      batchFailureCounter.increment();
      log.error(
          "[IngestionDispatcher] 배치 처리 실패 (항목은 소비됨): tenant={}, items={}",
          tenant,
          batch.size());
    }
  }

  // ==================== 재시도 ====================

  /**
   * 재시도 가능한 저장소 장애만 BackoffCalculator 간격으로 재시도한다.
   *
   * <p>InvalidArgument, Cancelled 등 재시도 불가 예외는 즉시 전파된다.
   */
  private <T> T withRetry(
      CancellationContext ctx, String operation, UUID tenant, Supplier<T> call) {
    int maxAttempts = properties.retry().maxAttempts();
    for (int attempt = 1; ; attempt++) {
      try {
        return call.get();
      } catch (BaseException e) {
        if (!e.isRetryable()) {
          throw e;
        }
        if (attempt >= maxAttempts) {
          log.error(
              "[IngestionDispatcher] {} 재시도 소진 ({}회): tenant={}, cause={}",
              operation,
              attempt,
              tenant,
              e.getMessage());
          throw e;
        }

        long delayMs = backoff.calculate(attempt);
        retryCounters.get(operation).increment();
        log.warn(
            "[IngestionDispatcher] {} 재시도 {}/{} ({}ms 후): tenant={}, cause={}",
            operation,
            attempt,
            maxAttempts - 1,
            delayMs,
            tenant,
            e.getMessage());
        if (!ctx.sleep(Duration.ofMillis(delayMs))) {
          QueueOperationCancelledException cancelled =
              new QueueOperationCancelledException(operation + " retry backoff");
          cancelled.addSuppressed(e);
          throw cancelled;
        }
      }
    }
  }

  private List<UUID> listTenants(CancellationContext ctx) {
    return executor.executeOrDefault(
        () -> withRetry(ctx, OP_LIST, null, () -> queue.listTenantsWithItems(ctx)),
        null,
        TaskContext.of(COMPONENT, "ListTenants"));
  }

  // ==================== 대기 ====================

  private TenantDrainResult await(UUID tenant, Future<TenantDrainResult> future) {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      return TenantDrainResult.SKIPPED;
    } catch (ExecutionException e) {
      log.error("[IngestionDispatcher] 테넌트 처리 중 예외: tenant={}", tenant, e.getCause());
      return TenantDrainResult.SKIPPED;
    }
  }

  private long awaitDrained(UUID tenant, Future<Long> future) {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      return 0L;
    } catch (ExecutionException e) {
      log.error("[IngestionDispatcher] Drain 중 예외: tenant={}", tenant, e.getCause());
      return 0L;
    }
  }

  private static boolean awaitLoop(Future<?> loop, Duration timeout) {
    try {
      loop.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      return true;
    } catch (TimeoutException e) {
      return false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    } catch (ExecutionException e) {
      log.error("[IngestionDispatcher] 루프가 예외로 종료됨", e.getCause());
      return true;
    }
  }

  private static Counter retryCounter(MeterRegistry meterRegistry, String operation) {
    return Counter.builder("ingestion.dispatcher.retries")
        .tag("operation", operation)
        .register(meterRegistry);
  }

  /** 현재 즉시 재처리 대상으로 표시된 테넌트 (테스트/진단용 스냅샷) */
  Set<UUID> pendingRedrainSnapshot() {
    return Set.copyOf(pendingRedrain);
  }

  private record TenantDrainResult(int items, boolean storeFailed) {

    static final TenantDrainResult SKIPPED = new TenantDrainResult(0, false);
    static final TenantDrainResult STORE_FAILED = new TenantDrainResult(0, true);
  }
}
