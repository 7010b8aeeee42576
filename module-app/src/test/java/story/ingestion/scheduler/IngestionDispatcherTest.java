package story.ingestion.scheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.redisson.api.RFuture;
import org.redisson.api.RKeys;
import org.redisson.api.RScript;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.Codec;
import org.slf4j.LoggerFactory;
import story.ingestion.config.DispatcherProperties;
import story.ingestion.core.context.CancellationContext;
import story.ingestion.core.domain.model.QueueItem;
import story.ingestion.core.port.in.IngestionQueue;
import story.ingestion.core.port.out.IngestionConsumer;
import story.ingestion.core.queue.DebounceIngestionQueue;
import story.ingestion.error.exception.InvalidQueueArgumentException;
import story.ingestion.error.exception.QueueStoreUnavailableException;
import story.ingestion.infrastructure.executor.DefaultLogicExecutor;
import story.ingestion.infrastructure.executor.LogicExecutor;
import story.ingestion.infrastructure.memory.InMemorySortedSetStore;
import story.ingestion.infrastructure.redis.IngestionRedisKeys;
import story.ingestion.infrastructure.redis.RedisSortedSetStore;
import story.ingestion.infrastructure.redis.script.QueueScriptProvider;
import story.ingestion.support.TestClock;

/**
 * IngestionDispatcher 테스트
 *
 * <p>틱을 직접 호출해 결정적으로 검증한다. 저장소는 in-memory, 시간은 {@link TestClock}.
 */
@Tag("unit")
@DisplayName("IngestionDispatcher 테스트")
class IngestionDispatcherTest {

  private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
  private static final Duration QUIET_PERIOD = Duration.ofSeconds(30);
  private static final UUID TENANT_A = UUID.fromString("a0000000-0000-4000-8000-00000000000a");
  private static final UUID TENANT_B = UUID.fromString("b0000000-0000-4000-8000-00000000000b");

  private final CancellationContext ctx = CancellationContext.background();
  private final List<List<QueueItem>> batches = new CopyOnWriteArrayList<>();
  private final IngestionConsumer recordingConsumer = (c, tenant, items) -> batches.add(items);

  private TestClock clock;
  private InMemorySortedSetStore store;
  private IngestionQueue queue;
  private SimpleMeterRegistry meterRegistry;
  private IngestionDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    clock = new TestClock(T0);
    store = new InMemorySortedSetStore();
    queue = new DebounceIngestionQueue(store, clock);
    meterRegistry = new SimpleMeterRegistry();
  }

  @AfterEach
  void tearDown() {
    if (dispatcher != null) {
      dispatcher.close();
    }
  }

  private static DispatcherProperties properties(int batchLimit, Duration consumerTimeout) {
    return new DispatcherProperties(
        true,
        QUIET_PERIOD,
        Duration.ofSeconds(1),
        batchLimit,
        2,
        consumerTimeout,
        false,
        new DispatcherProperties.Retry(3, Duration.ofMillis(1), 0.0));
  }

  private IngestionDispatcher dispatcher(
      IngestionQueue queue, IngestionConsumer consumer, DispatcherProperties properties) {
    dispatcher =
        new IngestionDispatcher(
            queue, consumer, properties, new DefaultLogicExecutor(), clock, meterRegistry);
    return dispatcher;
  }

  private void pushCharacters(UUID tenant, int count) {
    for (int i = 0; i < count; i++) {
      queue.push(ctx, tenant, "character", sourceId(i));
    }
  }

  private static UUID sourceId(int i) {
    return UUID.fromString(String.format("00000000-0000-4000-8000-%012d", i + 1));
  }

  private double counter(String name, String tagKey, String tagValue) {
    return meterRegistry.get(name).tag(tagKey, tagValue).counter().count();
  }

  @Nested
  @DisplayName("tick")
  class TickTest {

    @Test
    @DisplayName("조용한 구간이 지나지 않은 항목은 전달하지 않는다")
    void unstableItemsStayQueued() {
      // given
      IngestionDispatcher dispatcher = dispatcher(queue, recordingConsumer, properties(100, null));
      pushCharacters(TENANT_A, 1);
      clock.plusSeconds(10);

      // when
      DispatchTickResult result = dispatcher.tick(ctx);

      // then
      assertThat(result.tenantsSeen()).isEqualTo(1);
      assertThat(result.batches()).isZero();
      assertThat(batches).isEmpty();
      assertThat(store.size(TENANT_A)).isEqualTo(1);
    }

    @Test
    @DisplayName("250건, batchLimit 100이면 틱마다 100/100/50/0건을 중복 없이 전달한다")
    void drainsBacklogAcrossTicks() {
      // given
      IngestionDispatcher dispatcher = dispatcher(queue, recordingConsumer, properties(100, null));
      pushCharacters(TENANT_A, 250);
      clock.plusSeconds(31);

      // when
      DispatchTickResult first = dispatcher.tick(ctx);
      DispatchTickResult second = dispatcher.tick(ctx);
      DispatchTickResult third = dispatcher.tick(ctx);
      DispatchTickResult fourth = dispatcher.tick(ctx);

      // then
      assertThat(List.of(first.items(), second.items(), third.items(), fourth.items()))
          .containsExactly(100L, 100L, 50L, 0L);
      assertThat(first.shouldRedrainImmediately()).isTrue();
      assertThat(second.shouldRedrainImmediately()).isTrue();
      assertThat(third.pendingRedrain()).isZero();
      assertThat(fourth.batches()).isZero();

      Set<UUID> delivered =
          batches.stream()
              .flatMap(List::stream)
              .map(QueueItem::sourceId)
              .collect(Collectors.toSet());
      assertThat(delivered).hasSize(250);
      assertThat(batches.stream().mapToInt(List::size).sum()).isEqualTo(250);
    }

    @Test
    @DisplayName("한 틱에서 모든 테넌트를 처리하고 테넌트 게이지를 갱신한다")
    void drainsEveryTenantInOneTick() {
      // given
      IngestionDispatcher dispatcher = dispatcher(queue, recordingConsumer, properties(100, null));
      pushCharacters(TENANT_A, 3);
      pushCharacters(TENANT_B, 2);
      clock.plusSeconds(31);

      // when
      DispatchTickResult result = dispatcher.tick(ctx);

      // then
      assertThat(result.tenantsSeen()).isEqualTo(2);
      assertThat(result.batches()).isEqualTo(2);
      assertThat(result.items()).isEqualTo(5);
      assertThat(meterRegistry.get("ingestion.queue.tenants").gauge().value()).isEqualTo(2.0);
      assertThat(counter("ingestion.dispatcher.batches", "result", "success")).isEqualTo(2.0);
      assertThat(meterRegistry.get("ingestion.dispatcher.items").counter().count())
          .isEqualTo(5.0);
      assertThat(meterRegistry.get("ingestion.dispatcher.tick").timer().count()).isEqualTo(1);
    }

    @Test
    @DisplayName("consumer가 실패해도 꺼낸 항목은 큐로 돌아가지 않는다")
    void consumerFailureDoesNotRollBack() {
      // given
      IngestionConsumer failing =
          (c, tenant, items) -> {
            throw new IllegalStateException("index unavailable");
          };
      IngestionDispatcher dispatcher = dispatcher(queue, failing, properties(100, null));
      pushCharacters(TENANT_A, 4);
      clock.plusSeconds(31);

      // when
      DispatchTickResult result = dispatcher.tick(ctx);

      // then
      assertThat(result.items()).isEqualTo(4);
      assertThat(store.size(TENANT_A)).isZero();
      assertThat(queue.listTenantsWithItems(ctx)).isEmpty();
      assertThat(counter("ingestion.dispatcher.batches", "result", "failure")).isEqualTo(1.0);
      assertThat(counter("ingestion.dispatcher.batches", "result", "success")).isZero();
    }

    @Test
    @DisplayName("consumer 컨텍스트는 틱 컨텍스트가 취소되어도 취소되지 않는다")
    void consumerContextOutlivesLoopCancellation() {
      // given
      CancellationContext tickCtx = CancellationContext.background();
      AtomicBoolean consumerCancelled = new AtomicBoolean(true);
      AtomicBoolean consumerHasDeadline = new AtomicBoolean(false);
      IngestionConsumer consumer =
          (c, tenant, items) -> {
            tickCtx.cancel();
            consumerCancelled.set(c.isCancelled());
            consumerHasDeadline.set(c.hasDeadline());
          };
      IngestionDispatcher dispatcher = dispatcher(queue, consumer, properties(100, null));
      pushCharacters(TENANT_A, 1);
      clock.plusSeconds(31);

      // when
      dispatcher.tick(tickCtx);

      // then
      assertThat(consumerCancelled).isFalse();
      assertThat(consumerHasDeadline).isTrue();
    }

    @Test
    @DisplayName("손상 멤버가 섞여 있어도 정상 항목으로 배치가 가득 차면 테넌트를 다시 비우도록 표시한다")
    void corruptMemberDoesNotHideFullBatch() {
      // given
      IngestionDispatcher dispatcher = dispatcher(queue, recordingConsumer, properties(2, null));
      store.addOrUpdate(ctx, TENANT_A, "garbage-member", T0.getEpochSecond() - 100);
      pushCharacters(TENANT_A, 3);
      clock.plusSeconds(31);

      // when
      DispatchTickResult first = dispatcher.tick(ctx);
      DispatchTickResult second = dispatcher.tick(ctx);

      // then
      assertThat(first.items()).isEqualTo(2);
      assertThat(first.shouldRedrainImmediately()).isTrue();
      assertThat(second.items()).isEqualTo(1);
      assertThat(second.pendingRedrain()).isZero();
      assertThat(store.size(TENANT_A)).isEqualTo(1);
    }
  }

  @Nested
  @DisplayName("종료 중 진행 중인 pop")
  class StopDuringPopTest {

    private final IngestionQueue mockQueue = mock(IngestionQueue.class);

    @Test
    @DisplayName("pop 응답을 기다리는 중 틱 컨텍스트가 취소되어도 꺼낸 배치는 consumer에 전달된다")
    void poppedBatchSurvivesTickCancellation() {
      // given
      CancellationContext tickCtx = CancellationContext.background();
      AtomicBoolean popCtxCancelled = new AtomicBoolean(true);
      when(mockQueue.listTenantsWithItems(any())).thenReturn(List.of(TENANT_A));
      when(mockQueue.popStable(any(), eq(TENANT_A), any(), eq(100)))
          .thenAnswer(
              invocation -> {
                tickCtx.cancel();
                CancellationContext popCtx = invocation.getArgument(0);
                popCtxCancelled.set(popCtx.isCancelled());
                return List.of(new QueueItem(TENANT_A, "character", sourceId(0), T0));
              });
      IngestionDispatcher dispatcher =
          dispatcher(mockQueue, recordingConsumer, properties(100, null));

      // when
      DispatchTickResult result = dispatcher.tick(tickCtx);

      // then
      assertThat(popCtxCancelled).isFalse();
      assertThat(result.items()).isEqualTo(1);
      assertThat(batches).hasSize(1);
    }

    @Test
    @DisplayName("이미 취소된 틱은 새 pop을 보내지 않는다")
    void cancelledTickIssuesNoPop() {
      // given
      CancellationContext tickCtx = CancellationContext.background();
      tickCtx.cancel();
      when(mockQueue.listTenantsWithItems(any())).thenReturn(List.of(TENANT_A));
      IngestionDispatcher dispatcher =
          dispatcher(mockQueue, recordingConsumer, properties(100, null));

      // when
      DispatchTickResult result = dispatcher.tick(tickCtx);

      // then
      assertThat(result.items()).isZero();
      verify(mockQueue, never()).popStable(any(), any(), any(), eq(100));
    }

    @Test
    @DisplayName("stop 이후에 도착한 Redis pop 응답도 consumer에 전달된다")
    @SuppressWarnings("unchecked")
    void redisReplyArrivingAfterStopIsHandedOff() throws Exception {
      // given
      RedissonClient redissonClient = mock(RedissonClient.class);
      RScript script = mock(RScript.class);
      RKeys rKeys = mock(RKeys.class);
      RFuture<Object> reply = mock(RFuture.class);
      when(redissonClient.getScript(any(Codec.class))).thenReturn(script);
      when(redissonClient.getKeys()).thenReturn(rKeys);
      when(rKeys.getKeysByPattern("ingestion:queue:*", 100))
          .thenReturn(List.of("ingestion:queue:" + TENANT_A));
      when(script.scriptLoad(anyString())).thenReturn("sha-1");
      when(script.evalShaAsync(
              eq(RScript.Mode.READ_WRITE),
              eq("sha-1"),
              eq(RScript.ReturnType.MULTI),
              anyList(),
              any(Object[].class)))
          .thenReturn(reply);

      LogicExecutor executor = new DefaultLogicExecutor();
      RedisSortedSetStore redisStore =
          new RedisSortedSetStore(
              redissonClient,
              new QueueScriptProvider(redissonClient, executor),
              executor,
              new IngestionRedisKeys("ingestion:queue"),
              100);
      IngestionDispatcher dispatcher =
          dispatcher(
              new DebounceIngestionQueue(redisStore, clock),
              recordingConsumer,
              properties(100, null));

      // 첫 대기에서 stop을 시작하고, 루프 컨텍스트가 취소된 뒤에야 응답이 도착한다
      AtomicReference<CompletableFuture<Boolean>> stopping = new AtomicReference<>();
      AtomicLong replyAt = new AtomicLong();
      when(reply.get(anyLong(), any(TimeUnit.class)))
          .thenAnswer(
              invocation -> {
                if (stopping.get() == null) {
                  replyAt.set(System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(300));
                  stopping.set(CompletableFuture.supplyAsync(dispatcher::stop));
                }
                if (System.nanoTime() < replyAt.get()) {
                  Thread.sleep(10);
                  throw new TimeoutException();
                }
                return List.of(1L, "character:" + sourceId(0), "100");
              });

      // when
      dispatcher.start();
      await().atMost(Duration.ofSeconds(5)).until(() -> stopping.get() != null);
      boolean stopped = stopping.get().get(5, TimeUnit.SECONDS);

      // then
      assertThat(stopped).isTrue();
      assertThat(dispatcher.isRunning()).isFalse();
      assertThat(batches).hasSize(1);
      assertThat(batches.get(0)).extracting(QueueItem::sourceId).containsExactly(sourceId(0));
    }
  }

  @Nested
  @DisplayName("저장소 장애 재시도")
  class RetryTest {

    private final IngestionQueue mockQueue = mock(IngestionQueue.class);

    private QueueItem item(int i) {
      return new QueueItem(TENANT_A, "character", sourceId(i), T0);
    }

    @Test
    @DisplayName("StoreUnavailable은 backoff 후 재시도한다")
    void retriesStoreUnavailable() {
      // given
      when(mockQueue.listTenantsWithItems(any()))
          .thenThrow(new QueueStoreUnavailableException("list"))
          .thenThrow(new QueueStoreUnavailableException("list"))
          .thenReturn(List.of(TENANT_A));
      when(mockQueue.popStable(any(), eq(TENANT_A), any(), eq(100))).thenReturn(List.of(item(0)));
      IngestionDispatcher dispatcher =
          dispatcher(mockQueue, recordingConsumer, properties(100, null));

      // when
      DispatchTickResult result = dispatcher.tick(ctx);

      // then
      assertThat(result.storeFailures()).isZero();
      assertThat(result.items()).isEqualTo(1);
      verify(mockQueue, times(3)).listTenantsWithItems(any());
      assertThat(counter("ingestion.dispatcher.retries", "operation", "list")).isEqualTo(2.0);
    }

    @Test
    @DisplayName("재시도를 모두 소진하면 틱은 실패를 기록하고 즉시 재실행하지 않는다")
    void exhaustedRetriesAreReported() {
      // given
      when(mockQueue.listTenantsWithItems(any()))
          .thenThrow(new QueueStoreUnavailableException("list"));
      IngestionDispatcher dispatcher =
          dispatcher(mockQueue, recordingConsumer, properties(100, null));

      // when
      DispatchTickResult result = dispatcher.tick(ctx);

      // then
      assertThat(result.storeFailures()).isEqualTo(1);
      assertThat(result.tenantsSeen()).isZero();
      assertThat(result.shouldRedrainImmediately()).isFalse();
      verify(mockQueue, times(3)).listTenantsWithItems(any());
    }

    @Test
    @DisplayName("InvalidArgument는 재시도하지 않는다")
    void invalidArgumentIsNotRetried() {
      // given
      when(mockQueue.listTenantsWithItems(any())).thenReturn(List.of(TENANT_A));
      when(mockQueue.popStable(any(), eq(TENANT_A), any(), eq(100)))
          .thenThrow(new InvalidQueueArgumentException("limit"));
      IngestionDispatcher dispatcher =
          dispatcher(mockQueue, recordingConsumer, properties(100, null));

      // when
      DispatchTickResult result = dispatcher.tick(ctx);

      // then
      assertThat(result.storeFailures()).isEqualTo(1);
      verify(mockQueue, times(1)).popStable(any(), eq(TENANT_A), any(), eq(100));
      assertThat(counter("ingestion.dispatcher.retries", "operation", "pop")).isZero();
    }

    @Test
    @DisplayName("가득 찬 배치를 낸 테넌트는 조회 결과에 없어도 다음 틱에 다시 비운다")
    void markedTenantIsRedrainedEvenIfListingOmitsIt() {
      // given
      when(mockQueue.listTenantsWithItems(any()))
          .thenReturn(List.of(TENANT_A))
          .thenReturn(List.of());
      when(mockQueue.popStable(any(), eq(TENANT_A), any(), eq(2)))
          .thenReturn(List.of(item(0), item(1)))
          .thenReturn(List.of(item(2)));
      IngestionDispatcher dispatcher =
          dispatcher(mockQueue, recordingConsumer, properties(2, null));

      // when
      DispatchTickResult first = dispatcher.tick(ctx);
      DispatchTickResult second = dispatcher.tick(ctx);

      // then
      assertThat(first.pendingRedrain()).isEqualTo(1);
      assertThat(second.tenantsSeen()).isZero();
      assertThat(second.items()).isEqualTo(1);
      assertThat(second.pendingRedrain()).isZero();
      assertThat(dispatcher.pendingRedrainSnapshot()).isEmpty();
      verify(mockQueue, times(2)).popStable(any(), eq(TENANT_A), any(), eq(2));
    }
  }

  @Nested
  @DisplayName("consumer 타임아웃")
  class ConsumerTimeoutTest {

    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    @BeforeEach
    void attachAppender() {
      logger = (Logger) LoggerFactory.getLogger(IngestionDispatcher.class);
      logAppender = new ListAppender<>();
      logAppender.start();
      logger.addAppender(logAppender);
    }

    @AfterEach
    void detachAppender() {
      logger.detachAppender(logAppender);
    }

    @Test
    @DisplayName("제한 시간을 넘겨 반환한 consumer는 WARN으로 남긴다")
    void lateConsumerIsLogged() {
      // given
      IngestionConsumer slow =
          (c, tenant, items) -> CancellationContext.background().sleep(Duration.ofMillis(200));
      IngestionDispatcher dispatcher =
          dispatcher(queue, slow, properties(100, Duration.ofMillis(50)));
      pushCharacters(TENANT_A, 1);
      clock.plusSeconds(31);

      // when
      dispatcher.tick(ctx);

      // then
      assertThat(logAppender.list)
          .anySatisfy(
              event -> {
                assertThat(event.getLevel()).isEqualTo(Level.WARN);
                assertThat(event.getFormattedMessage())
                    .contains("제한 시간")
                    .contains(TENANT_A.toString());
              });
    }
  }

  @Nested
  @DisplayName("drain")
  class DrainTest {

    @Test
    @DisplayName("안정화 여부와 상관없이 모든 테넌트를 끝까지 비운다")
    void drainsEverythingRegardlessOfStability() {
      // given
      IngestionDispatcher dispatcher = dispatcher(queue, recordingConsumer, properties(100, null));
      pushCharacters(TENANT_A, 150);
      pushCharacters(TENANT_B, 1);

      // when
      long drained = dispatcher.drain(ctx);

      // then
      assertThat(drained).isEqualTo(151);
      assertThat(queue.listTenantsWithItems(ctx)).isEmpty();
      assertThat(batches.stream().map(List::size).collect(Collectors.toList()))
          .containsExactlyInAnyOrder(100, 50, 1);
    }
  }

  @Nested
  @DisplayName("루프")
  class LoopTest {

    @Test
    @DisplayName("시작하면 첫 틱을 바로 실행하고 stop은 루프를 멈춘다")
    void startRunsFirstTickImmediately() {
      // given
      IngestionDispatcher dispatcher = dispatcher(queue, recordingConsumer, properties(100, null));
      pushCharacters(TENANT_A, 3);
      clock.plusSeconds(31);

      // when
      dispatcher.start();

      // then
      await()
          .atMost(Duration.ofSeconds(5))
          .untilAsserted(
              () -> assertThat(batches.stream().mapToInt(List::size).sum()).isEqualTo(3));
      assertThat(dispatcher.isRunning()).isTrue();

      assertThat(dispatcher.stop()).isTrue();
      assertThat(dispatcher.isRunning()).isFalse();
    }

    @Test
    @DisplayName("루프는 새로 안정화된 항목을 다음 틱에 전달한다")
    void laterItemsArePickedUpByLaterTicks() {
      // given
      IngestionDispatcher dispatcher = dispatcher(queue, recordingConsumer, properties(100, null));
      dispatcher.start();
      IntStream.range(0, 2).forEach(i -> queue.push(ctx, TENANT_B, "scene", sourceId(i)));

      // when
      clock.plusSeconds(31);

      // then
      await()
          .atMost(Duration.ofSeconds(5))
          .untilAsserted(
              () -> assertThat(batches.stream().mapToInt(List::size).sum()).isEqualTo(2));
      dispatcher.stop();
    }
  }
}
