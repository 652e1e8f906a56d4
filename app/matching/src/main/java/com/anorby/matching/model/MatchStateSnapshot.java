package com.anorby.matching.model;

import java.time.Instant;

/** MatchState をロック下で一括して読み出した値。 */
public record MatchStateSnapshot(
    MatchStatus status, Instant lastCompletedAt, Instant lastFailedAt, Instant runningSince) {

  public static MatchStateSnapshot initial() {
    return new MatchStateSnapshot(MatchStatus.IDLE, null, null, null);
  }
}
