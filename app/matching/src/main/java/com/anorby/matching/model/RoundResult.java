package com.anorby.matching.model;

import java.time.Instant;
import java.util.List;

public record RoundResult(
    String roundId,
    StrategyName strategy,
    Instant startedAt,
    int participantCount,
    List<MatchPair> pairs,
    List<Long> unmatchedUserIds) {

  public RoundResult {
    pairs = List.copyOf(pairs);
    unmatchedUserIds = List.copyOf(unmatchedUserIds);
  }

  public int pairCount() {
    return pairs.size();
  }
}
