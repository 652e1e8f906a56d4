/*
 * どこで: Matching ワーカー
 * 何を: 一定間隔でラウンド状態をログへ出し、起動判定を行う
 * なぜ: リクエストが来ない時間帯でも期限到来後のラウンドを始めるため
 */
package com.anorby.matching.worker;

import com.anorby.matching.model.MatchStateSnapshot;
import com.anorby.matching.state.MatchTrigger;
import com.anorby.matching.state.TriggerDecision;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "matching.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class MatchStateReporter {

  private static final Logger logger = LoggerFactory.getLogger(MatchStateReporter.class);

  private final MatchTrigger matchTrigger;
  private final Clock clock;

  @Scheduled(
      initialDelayString = "${matching.state-report-interval}",
      fixedDelayString = "${matching.state-report-interval}")
  public void run() {
    final MatchStateSnapshot snapshot = matchTrigger.currentStatus();
    logger.info(
        "match state status={} lastCompletedAt={} lastFailedAt={} runningSince={}",
        snapshot.status(),
        snapshot.lastCompletedAt(),
        snapshot.lastFailedAt(),
        snapshot.runningSince());
    try {
      final TriggerDecision decision = matchTrigger.checkAndTrigger(Instant.now(clock));
      if (decision == TriggerDecision.STARTED) {
        logger.info("match round started by state reporter");
      }
    } catch (RuntimeException ex) {
      logger.warn("match state report trigger failed", ex);
    }
  }
}
