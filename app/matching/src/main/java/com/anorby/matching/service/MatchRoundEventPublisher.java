/*
 * どこで: Matching サービス層
 * 何を: ラウンド完了イベントの送信口を抽象化する
 * なぜ: NATS の有効/無効で実装を差し替え、ラウンド処理側を変えずに済ませるため
 */
package com.anorby.matching.service;

import com.anorby.matching.model.RoundResult;

public interface MatchRoundEventPublisher {

  /**
   * 役割: 保存済みラウンドの結果を下流へ通知する。
   * 動作: 送信に失敗した場合は IllegalStateException を送出する。
   * 前提: 呼び出し時点で matched への保存はコミット済み。
   */
  void publishRoundCompleted(RoundResult result);
}
