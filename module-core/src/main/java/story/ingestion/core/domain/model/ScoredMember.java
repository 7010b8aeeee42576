package story.ingestion.core.domain.model;

import java.util.Objects;

/**
 * 정렬 집합의 (member, score) 한 쌍
 *
 * @param member 인코딩된 멤버 문자열
 * @param score 마지막 Push 시각 (epoch seconds)
 */
public record ScoredMember(String member, long score) {

  public ScoredMember {
    Objects.requireNonNull(member, "member");
  }
}
