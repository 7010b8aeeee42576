package story.ingestion.consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import story.ingestion.core.context.CancellationContext;
import story.ingestion.core.domain.model.QueueItem;
import story.ingestion.core.domain.model.SourceType;
import story.ingestion.error.exception.IngestionConsumerException;
import story.ingestion.error.exception.QueueOperationCancelledException;
import story.ingestion.infrastructure.executor.LogicExecutor;
import story.ingestion.infrastructure.executor.TaskContext;
import story.ingestion.support.TestLogicExecutors;

@Tag("unit")
@DisplayName("SourceTypeRoutingConsumer 테스트")
class SourceTypeRoutingConsumerTest {

  private static final UUID TENANT = UUID.fromString("10000000-0000-4000-8000-000000000001");
  private static final Instant AT = Instant.parse("2026-01-01T00:00:00Z");

  private final CancellationContext ctx = CancellationContext.background();
  private final LogicExecutor executor = TestLogicExecutors.passThrough();

  private static QueueItem item(String sourceType, int n) {
    return new QueueItem(
        TENANT,
        sourceType,
        UUID.fromString(String.format("00000000-0000-4000-8000-%012d", n)),
        AT);
  }

  /** 받은 항목을 기록하고, failOn에 해당하는 sourceId는 실패시키는 핸들러 */
  private static final class RecordingHandler implements SourceIngestionHandler {

    private final Set<SourceType> types;
    private final Set<UUID> failOn;
    private final List<QueueItem> handled = new ArrayList<>();

    RecordingHandler(Set<SourceType> types, Set<UUID> failOn) {
      this.types = types;
      this.failOn = failOn;
    }

    @Override
    public Set<SourceType> supportedTypes() {
      return types;
    }

    @Override
    public void handle(CancellationContext ctx, QueueItem item) {
      if (failOn.contains(item.sourceId())) {
        throw new IllegalStateException("embedding failed: " + item.sourceId());
      }
      handled.add(item);
    }
  }

  @Test
  @DisplayName("항목을 소스 타입에 맞는 핸들러로 보낸다")
  void routesByType() {
    // given
    RecordingHandler characterHandler =
        new RecordingHandler(EnumSet.of(SourceType.CHARACTER), Set.of());
    RecordingHandler narrativeHandler =
        new RecordingHandler(EnumSet.of(SourceType.SCENE, SourceType.CHAPTER), Set.of());
    SourceTypeRoutingConsumer consumer =
        new SourceTypeRoutingConsumer(List.of(characterHandler, narrativeHandler), executor);

    // when
    consumer.consume(
        ctx, TENANT, List.of(item("character", 1), item("scene", 2), item("chapter", 3)));

    // then
    assertThat(characterHandler.handled)
        .extracting(QueueItem::sourceType)
        .containsExactly("character");
    assertThat(narrativeHandler.handled)
        .extracting(QueueItem::sourceType)
        .containsExactly("scene", "chapter");
  }

  @Test
  @DisplayName("핸들러가 없거나 어휘에 없는 타입은 건너뛴다")
  void skipsUnroutableItems() {
    // given
    RecordingHandler handler = new RecordingHandler(EnumSet.of(SourceType.CHARACTER), Set.of());
    SourceTypeRoutingConsumer consumer = new SourceTypeRoutingConsumer(List.of(handler), executor);

    // when
    consumer.consume(
        ctx, TENANT, List.of(item("lore", 1), item("legacy_type", 2), item("character", 3)));

    // then
    assertThat(handler.handled).hasSize(1);
  }

  @Test
  @DisplayName("실패한 항목이 있어도 나머지를 처리한 뒤 실패를 하나로 모아 던진다")
  void aggregatesFailuresAfterWholeBatch() {
    // given
    QueueItem bad1 = item("character", 1);
    QueueItem good = item("character", 2);
    QueueItem bad2 = item("character", 3);
    RecordingHandler handler =
        new RecordingHandler(
            EnumSet.of(SourceType.CHARACTER), Set.of(bad1.sourceId(), bad2.sourceId()));
    SourceTypeRoutingConsumer consumer = new SourceTypeRoutingConsumer(List.of(handler), executor);

    // when & then
    assertThatThrownBy(() -> consumer.consume(ctx, TENANT, List.of(bad1, good, bad2)))
        .isInstanceOfSatisfying(
            IngestionConsumerException.class,
            e -> {
              assertThat(e.getFailedCount()).isEqualTo(2);
              assertThat(e.getBatchSize()).isEqualTo(3);
              assertThat(e.getSuppressed()).hasSize(2);
            });
    assertThat(handler.handled).containsExactly(good);
    verify(executor, times(3)).executeOrCatch(any(), any(), any(TaskContext.class));
  }

  @Test
  @DisplayName("취소된 컨텍스트에서는 남은 항목을 시도하지 않는다")
  void stopsWhenCancelled() {
    // given
    RecordingHandler handler = new RecordingHandler(EnumSet.of(SourceType.CHARACTER), Set.of());
    SourceTypeRoutingConsumer consumer = new SourceTypeRoutingConsumer(List.of(handler), executor);
    CancellationContext cancelled = CancellationContext.background();
    cancelled.cancel();

    // when & then
    assertThatThrownBy(
            () -> consumer.consume(cancelled, TENANT, List.of(item("character", 1))))
        .isInstanceOf(QueueOperationCancelledException.class);
    assertThat(handler.handled).isEmpty();
  }

  @Test
  @DisplayName("한 타입에 핸들러를 두 개 등록할 수 없다")
  void rejectsDuplicateRegistration() {
    RecordingHandler first = new RecordingHandler(EnumSet.of(SourceType.LORE), Set.of());
    RecordingHandler second =
        new RecordingHandler(EnumSet.of(SourceType.LORE, SourceType.EVENT), Set.of());

    assertThatThrownBy(
            () -> new SourceTypeRoutingConsumer(List.of(first, second), executor))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("lore");
  }

  @Test
  @DisplayName("로깅 핸들러는 모든 소스 타입을 받는다")
  void loggingHandlerCoversVocabulary() {
    SourceTypeRoutingConsumer consumer =
        new SourceTypeRoutingConsumer(List.of(new LoggingSourceIngestionHandler()), executor);

    assertThat(consumer.getHandlers().keySet()).containsExactlyInAnyOrder(SourceType.values());
  }
}
