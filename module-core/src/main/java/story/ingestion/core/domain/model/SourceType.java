package story.ingestion.core.domain.model;

import java.util.Optional;

/**
 * 수집 대상 소스 종류 어휘
 *
 * <p>큐 자체는 sourceType을 불투명 문자열로 취급합니다. 이 어휘는 디스패처와 컨슈머 사이의 계약입니다.
 */
public enum SourceType {
  STORY("story"),
  CHAPTER("chapter"),
  SCENE("scene"),
  BEAT("beat"),
  CONTENT_BLOCK("content_block"),
  PROSE_BLOCK("prose_block"),
  WORLD("world"),
  CHARACTER("character"),
  LOCATION("location"),
  FACTION("faction"),
  LORE("lore"),
  EVENT("event"),
  ARTIFACT("artifact"),
  RELATION("relation");

  private final String wireValue;

  SourceType(String wireValue) {
    this.wireValue = wireValue;
  }

  /**
   * 저장소 멤버 문자열에 사용되는 값
   *
   * @return 와이어 값 (예: content_block)
   */
  public String getWireValue() {
    return wireValue;
  }

  /**
   * 와이어 값으로 SourceType 조회
   *
   * @param wireValue 와이어 값
   * @return 일치하는 SourceType (없으면 empty)
   */
  public static Optional<SourceType> fromWireValue(String wireValue) {
    for (SourceType type : values()) {
      if (type.wireValue.equals(wireValue)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
