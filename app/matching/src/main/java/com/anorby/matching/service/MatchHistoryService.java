/*
 * どこで: Matching サービス層
 * 何を: ユーザーのマッチ履歴を API 応答へ変換する
 * なぜ: 入力検証と件数上限を Controller から切り離すため
 */
package com.anorby.matching.service;

import com.anorby.matching.api.InvalidMatchingRequestException;
import com.anorby.matching.api.response.MatchHistoryResponse;
import com.anorby.matching.api.response.MatchSummary;
import com.anorby.matching.config.MatchingProperties;
import com.anorby.matching.model.MatchRecord;
import com.anorby.matching.repository.MatchRecordRepository;
import java.util.List;
import org.springframework.stereotype.Service;

@Service
public class MatchHistoryService {

  private final MatchRecordRepository matchRecordRepository;
  private final int historyLimit;

  public MatchHistoryService(
      MatchRecordRepository matchRecordRepository, MatchingProperties properties) {
    this.matchRecordRepository = matchRecordRepository;
    this.historyLimit = properties.historyLimit();
  }

  public MatchHistoryResponse findMatches(long userId) {
    if (userId <= 0) {
      throw new InvalidMatchingRequestException("userId must be positive");
    }
    final List<MatchSummary> matches =
        matchRecordRepository.findByUserId(userId, historyLimit).stream()
            .map(MatchHistoryService::toSummary)
            .toList();
    return new MatchHistoryResponse(userId, matches);
  }

  private static MatchSummary toSummary(MatchRecord record) {
    return new MatchSummary(
        record.targetId(), record.matchedOn() == null ? null : record.matchedOn().toString());
  }
}
