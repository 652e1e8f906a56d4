/*
 * どこで: Matching アルゴリズム層
 * 何を: スナップショットからペアリングを作る割当戦略を抽象化する
 * なぜ: 安定マッチングと局所探索を設定で差し替え、個別にテストできるようにするため
 */
package com.anorby.matching.matcher;

import com.anorby.matching.model.Marriage;
import com.anorby.matching.model.RecencyExclusion;
import com.anorby.matching.model.StrategyName;
import com.anorby.matching.model.Submissions;

public interface AssignmentStrategy {

  /**
   * 役割: 1 ラウンド分のペアリングを作る。
   * 動作: submissions の全参加者を対象にし、相手が見つからない参加者は未マッチのまま返す。
   * 前提: シャドウを使う場合は submissions に振り直し済みのシャドウが含まれていること。
   */
  Marriage assign(Submissions submissions, RecencyExclusion recency);

  StrategyName name();

  default boolean supports(StrategyName strategyName) {
    return name() == strategyName;
  }
}
