package story.ingestion.scheduler;

/**
 * 디스패처 한 틱의 결과
 *
 * @param tenantsSeen 이번 틱 조회에서 항목이 있던 테넌트 수 (조회 실패 시 0)
 * @param batches consumer에 넘긴 배치 수
 * @param items consumer에 넘긴 항목 수
 * @param pendingRedrain 다음 틱에 즉시 다시 비울 테넌트 수
 * @param storeFailures 재시도 후에도 실패한 저장소 호출 수
 */
public record DispatchTickResult(
    int tenantsSeen, int batches, long items, int pendingRedrain, int storeFailures) {

  public static final DispatchTickResult EMPTY = new DispatchTickResult(0, 0, 0, 0, 0);

  /** 남은 테넌트가 있고 저장소가 정상이면 대기 없이 다음 틱을 돈다. */
  public boolean shouldRedrainImmediately() {
    return pendingRedrain > 0 && storeFailures == 0;
  }
}
