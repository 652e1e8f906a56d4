/*
 * どこで: 共通イベント定義
 * 何を: マッチングラウンド完了イベントの JSON ペイロードを定義する
 * なぜ: publish 側と購読側で同じ構造を共有するため
 */
package com.anorby.common.event;

import java.util.List;

public record MatchRoundEventPayload(
    String eventId,
    String eventType,
    String occurredAt,
    String roundId,
    String strategy,
    int participantCount,
    List<MatchedPair> pairs,
    List<Long> unmatchedUserIds,
    String traceId) {

  public MatchRoundEventPayload {
    pairs = pairs == null ? List.of() : List.copyOf(pairs);
    unmatchedUserIds = unmatchedUserIds == null ? List.of() : List.copyOf(unmatchedUserIds);
  }

  public record MatchedPair(long userId, long partnerId) {}
}
