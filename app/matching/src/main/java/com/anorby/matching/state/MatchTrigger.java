package com.anorby.matching.state;

import com.anorby.matching.config.MatchingProperties;
import com.anorby.matching.model.MatchStateSnapshot;
import com.anorby.matching.service.MatchRoundService;
import com.anorby.matching.service.MatchingMetrics;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

/**
 * ラウンド起動の入口。全リクエストから呼ばれるため、期限外なら状態ロックを一瞬取るだけで戻る。
 *
 * <p>起動が決まったラウンドは専用 executor で実行し、完了処理は成否に関わらず finally で行う。
 */
@Component
public class MatchTrigger {

  private static final Logger logger = LoggerFactory.getLogger(MatchTrigger.class);

  private final MatchState state;
  private final MatchRoundService roundService;
  private final TaskExecutor roundExecutor;
  private final MatchingMetrics metrics;
  private final Clock clock;
  private final boolean enabled;
  private final Duration interval;
  private final Duration failureRetryBackoff;

  public MatchTrigger(
      MatchState state,
      MatchRoundService roundService,
      @Qualifier("matchRoundExecutor") TaskExecutor roundExecutor,
      MatchingMetrics metrics,
      MatchingProperties properties,
      Clock clock) {
    this.state = state;
    this.roundService = roundService;
    this.roundExecutor = roundExecutor;
    this.metrics = metrics;
    this.clock = clock;
    this.enabled = properties.enabled();
    this.interval = properties.interval();
    this.failureRetryBackoff = properties.failureRetryBackoff();
  }

  /**
   * 役割: 期限が来ていればラウンドを 1 つだけ起動する。
   * 動作: 同時に何度呼ばれても IDLE → RUNNING の遷移は 1 回。executor が受け付けなければ即座に失敗として戻す。
   * 前提: now は呼び出し時点の現在時刻。
   */
  public TriggerDecision checkAndTrigger(Instant now) {
    if (!enabled) {
      return TriggerDecision.NOT_DUE;
    }
    final TriggerDecision decision = state.tryBegin(now, interval, failureRetryBackoff);
    if (decision != TriggerDecision.STARTED) {
      if (decision != TriggerDecision.NOT_DUE) {
        metrics.recordTriggerSkipped(decision.value());
      }
      return decision;
    }
    logger.info("match round triggered startedAt={}", now);
    try {
      roundExecutor.execute(() -> runRound(now));
    } catch (TaskRejectedException ex) {
      logger.error("match round rejected by executor startedAt={}", now, ex);
      metrics.recordRoundResult("rejected");
      state.complete(now, false, Instant.now(clock));
    }
    return decision;
  }

  public MatchStateSnapshot currentStatus() {
    return state.snapshot();
  }

  @VisibleForTesting
  void runRound(Instant startedAt) {
    boolean success = false;
    try {
      roundService.runRound(startedAt);
      success = true;
      metrics.recordRoundResult("completed");
    } catch (RuntimeException ex) {
      logger.error("match round failed startedAt={}", startedAt, ex);
      metrics.recordRoundResult("failed");
    } finally {
      state.complete(startedAt, success, Instant.now(clock));
    }
  }
}
