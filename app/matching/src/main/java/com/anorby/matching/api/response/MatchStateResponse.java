/*
 * どこで: Matching API レスポンス DTO
 * 何を: ラウンド状態のスナップショットを返す
 * なぜ: 時刻を ISO-8601 文字列で固定し、未設定は null で表すため
 */
package com.anorby.matching.api.response;

import com.anorby.matching.model.MatchStateSnapshot;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MatchStateResponse(
    String status, String lastCompletedAt, String lastFailedAt, String runningSince) {

  public static MatchStateResponse from(MatchStateSnapshot snapshot) {
    return new MatchStateResponse(
        snapshot.status().name(),
        toIsoOrNull(snapshot.lastCompletedAt()),
        toIsoOrNull(snapshot.lastFailedAt()),
        toIsoOrNull(snapshot.runningSince()));
  }

  private static String toIsoOrNull(Instant instant) {
    return instant == null ? null : instant.toString();
  }
}
