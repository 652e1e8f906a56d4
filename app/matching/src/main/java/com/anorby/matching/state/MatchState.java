package com.anorby.matching.state;

import com.anorby.matching.model.MatchStateSnapshot;
import com.anorby.matching.model.MatchStatus;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * プロセスで 1 つのラウンド状態。読み書きはすべて同じロックの下で行い、(status, 時刻) の組を一括で扱う。
 *
 * <p>IDLE → RUNNING は {@link #tryBegin} だけが行い、RUNNING → IDLE は {@link #complete} だけが行う。
 */
@Component
public class MatchState {

  private static final Logger logger = LoggerFactory.getLogger(MatchState.class);

  private final ReentrantLock lock = new ReentrantLock();

  private MatchStatus status = MatchStatus.IDLE;
  private Instant lastCompletedAt;
  private Instant lastFailedAt;
  private Instant runningSince;

  /**
   * 役割: 期限到来時に IDLE から RUNNING へ原子的に遷移する。
   * 動作: IDLE かつ前回成功から interval 以上経過 (未実行なら常に) かつ前回失敗から failureBackoff 以上経過して
   * いれば RUNNING にして STARTED を返す。それ以外は状態を変えずに理由を返す。
   * 前提: now はラウンド開始時刻として complete にもそのまま渡す。
   */
  public TriggerDecision tryBegin(Instant now, Duration interval, Duration failureBackoff) {
    lock.lock();
    try {
      if (status == MatchStatus.RUNNING) {
        return TriggerDecision.ALREADY_RUNNING;
      }
      if (lastCompletedAt != null && Duration.between(lastCompletedAt, now).compareTo(interval) < 0) {
        return TriggerDecision.NOT_DUE;
      }
      if (lastFailedAt != null
          && Duration.between(lastFailedAt, now).compareTo(failureBackoff) < 0) {
        return TriggerDecision.BACKING_OFF;
      }
      status = MatchStatus.RUNNING;
      runningSince = now;
      return TriggerDecision.STARTED;
    } finally {
      lock.unlock();
    }
  }

  /**
   * 役割: ラウンド終了時に IDLE へ戻す。成否に関わらず必ず呼ぶ。
   * 動作: 成功なら lastCompletedAt をラウンド開始時刻へ進め lastFailedAt を消す。失敗なら lastCompletedAt は
   * 据え置き、lastFailedAt を finishedAt にする。
   * 前提: startedAt は tryBegin に渡した now と同じ値。
   */
  public void complete(Instant startedAt, boolean success, Instant finishedAt) {
    lock.lock();
    try {
      if (status != MatchStatus.RUNNING || !startedAt.equals(runningSince)) {
        logger.warn(
            "match state completion ignored status={} runningSince={} startedAt={}",
            status,
            runningSince,
            startedAt);
        return;
      }
      if (success) {
        lastCompletedAt = startedAt;
        lastFailedAt = null;
      } else {
        lastFailedAt = finishedAt;
      }
      status = MatchStatus.IDLE;
      runningSince = null;
    } finally {
      lock.unlock();
    }
  }

  public MatchStateSnapshot snapshot() {
    lock.lock();
    try {
      return new MatchStateSnapshot(status, lastCompletedAt, lastFailedAt, runningSince);
    } finally {
      lock.unlock();
    }
  }
}
