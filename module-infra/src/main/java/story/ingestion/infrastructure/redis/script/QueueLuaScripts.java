package story.ingestion.infrastructure.redis.script;

/**
 * 큐 Lua Script 상수 클래스
 *
 * <p>Redis 싱글 스레드 특성으로 조회와 삭제가 하나의 원자 단위로 실행됩니다. 동시에 pop하는 두 워커가 같은 멤버를 받지 않습니다.
 *
 * <pre>
 * Key: {prefix}:{tenantId} (ZSET: member = "{sourceType}:{sourceId}", score = epoch seconds)
 * </pre>
 */
public final class QueueLuaScripts {

  private QueueLuaScripts() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Script: PopByScore
   *
   * <p>score ≤ maxScore 구간을 페이지 단위로 읽으며 접두어가 일치하고 형식이 올바른 멤버만 limit개까지 꺼냅니다. 접두어가 다르거나 형식이
   * 잘못된 멤버는 limit에 세지 않고 그대로 남깁니다. 모든 페이지를 읽은 뒤에 ZREM 하므로 페이지 offset이 밀리지 않습니다.
   *
   * <p>형식 규칙은 {@code QueueMemberCodec#isWellFormed}와 같습니다: {@code [A-Za-z0-9_]{1,64}}, ':', nil이 아닌 정규
   * UUID.
   *
   * <pre>
   * KEYS[1] = queue key
   * ARGV[1] = maxScore (inclusive)
   * ARGV[2] = limit
   * ARGV[3] = member prefix (선택, 예: "character:")
   *
   * 반환: [n, member1, score1, ..., memberN, scoreN, 형식오류멤버1, score1, ...]
   *        n = 꺼낸 멤버 수, 형식 오류 멤버는 최대 16개
   * </pre>
   */
  public static final String POP_BY_SCORE =
      """
      local limit = tonumber(ARGV[2])
      local prefix = ARGV[3] or ''
      local plen = string.len(prefix)
      local page = math.max(limit, 100)
      local pattern = '^([%w_]+):(%x%x%x%x%x%x%x%x%-%x%x%x%x%-%x%x%x%x%-%x%x%x%x%-%x%x%x%x%x%x%x%x%x%x%x%x)$'
      local function wellFormed(member)
        local sourceType, id = string.match(member, pattern)
        return sourceType ~= nil and string.len(sourceType) <= 64
          and id ~= '00000000-0000-0000-0000-000000000000'
      end
      local taken = {}
      local malformed = {}
      local offset = 0
      while #taken < limit * 2 do
        local rows = redis.call('ZRANGEBYSCORE', KEYS[1], '-inf', ARGV[1], 'WITHSCORES', 'LIMIT', offset, page)
        for i = 1, #rows, 2 do
          if string.sub(rows[i], 1, plen) == prefix then
            if wellFormed(rows[i]) then
              taken[#taken + 1] = rows[i]
              taken[#taken + 1] = rows[i + 1]
              if #taken >= limit * 2 then
                break
              end
            elseif #malformed < 32 then
              malformed[#malformed + 1] = rows[i]
              malformed[#malformed + 1] = rows[i + 1]
            end
          end
        end
        if #rows < page * 2 then
          break
        end
        offset = offset + page
      end
      local reply = { #taken / 2 }
      for i = 1, #taken, 2 do
        redis.call('ZREM', KEYS[1], taken[i])
        reply[#reply + 1] = taken[i]
        reply[#reply + 1] = taken[i + 1]
      end
      for i = 1, #malformed do
        reply[#reply + 1] = malformed[i]
      end
      return reply
      """;
}
