/*
 * どこで: Matching API レスポンス DTO
 * 何を: ユーザーのマッチ履歴 (新しい順) を返す
 * なぜ: API レスポンスの構造を固定するため
 */
package com.anorby.matching.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MatchHistoryResponse(long userId, List<MatchSummary> matches) {
  public MatchHistoryResponse {
    matches = matches == null ? List.of() : List.copyOf(matches);
  }
}
