/*
 * どこで: Matching API
 * 何を: ラウンド状態とユーザーのマッチ履歴を公開する
 * なぜ: 運用確認とクライアントからの履歴参照の入口を提供するため
 */
package com.anorby.matching.api;

import com.anorby.matching.api.response.MatchHistoryResponse;
import com.anorby.matching.api.response.MatchStateResponse;
import com.anorby.matching.service.MatchHistoryService;
import com.anorby.matching.state.MatchTrigger;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/matching")
@RequiredArgsConstructor
public class MatchingController {

  private final MatchTrigger matchTrigger;
  private final MatchHistoryService matchHistoryService;

  @GetMapping("/state")
  public ResponseEntity<MatchStateResponse> state() {
    return ResponseEntity.ok(MatchStateResponse.from(matchTrigger.currentStatus()));
  }

  @GetMapping("/users/{userId}/matches")
  public ResponseEntity<MatchHistoryResponse> matches(@PathVariable("userId") long userId) {
    return ResponseEntity.ok(matchHistoryService.findMatches(userId));
  }
}
