/*
 * どこで: Matching データアクセス
 * 何を: ラウンド入力 (質問バンクと適格ユーザーの回答) を取得する
 * なぜ: matcher を DB から切り離し、テストではインメモリの入力を渡せるようにするため
 */
package com.anorby.matching.repository;

import com.anorby.matching.model.Submissions;
import java.time.Instant;

public interface SubmissionRepository {

  /**
   * 役割: ラウンド開始時点の入力スナップショットを作る。
   * 動作: activeSince 以降に minAnsweredQuestions 件以上回答したユーザーと、質問バンクを全問回答済みの
   * ユーザーを合わせ、ユーザー ID 昇順で返す。excludedUserId (シャドウ) は含めない。
   * 前提: 質問バンクが空なら空のスナップショットを返す。activeSince は通常ラウンド開始日の 0 時 (UTC)。
   */
  Submissions fetchSubmissions(int minAnsweredQuestions, long excludedUserId, Instant activeSince);
}
