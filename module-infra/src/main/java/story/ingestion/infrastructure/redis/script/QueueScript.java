package story.ingestion.infrastructure.redis.script;

/** SHA 캐싱 대상 스크립트 */
public enum QueueScript {
  POP_BY_SCORE(QueueLuaScripts.POP_BY_SCORE);

  private final String source;

  QueueScript(String source) {
    this.source = source;
  }

  public String getSource() {
    return source;
  }
}
