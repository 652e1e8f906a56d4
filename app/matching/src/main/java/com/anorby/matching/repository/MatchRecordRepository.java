/*
 * どこで: Matching データアクセス
 * 何を: マッチ履歴 (matched テーブル) の読み書きを行う
 * なぜ: 直近マッチの除外・ラウンド結果の保存・履歴参照を 1 か所に集めるため
 */
package com.anorby.matching.repository;

import com.anorby.matching.model.Marriage;
import com.anorby.matching.model.MatchRecord;
import com.anorby.matching.model.RecencyExclusion;
import java.time.Instant;
import java.util.List;

public interface MatchRecordRepository {

  /** now から windowDays 日以内にマッチしたユーザー同士を返す。 */
  RecencyExclusion fetchRecencyExclusion(int windowDays, Instant now);

  /**
   * 役割: ラウンドのペアリングを保存する。
   * 動作: 成立ペアごとに両方向の 2 行を、同じ matchedOn で 1 トランザクション内に挿入する。
   * 失敗時は全行がロールバックされ DataAccessException が伝播する。
   * 前提: marriage は検証済みであること。
   */
  int persistMarriage(Marriage marriage, Instant matchedOn);

  /** ユーザー視点のマッチ履歴を新しい順に最大 limit 件返す。 */
  List<MatchRecord> findByUserId(long userId, int limit);
}
