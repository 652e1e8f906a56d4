/*
 * どこで: Matching アルゴリズム層
 * 何を: シャドウ参加者の回答をラウンドごとに振り直す
 * なぜ: 人数の偶奇や陣営の偏りで余るユーザーの受け皿を用意するため
 */
package com.anorby.matching.matcher;

import com.anorby.matching.config.MatchingProperties;
import com.anorby.matching.model.Answer;
import com.anorby.matching.model.AnswerVector;
import com.anorby.matching.model.AssociationScheme;
import com.anorby.matching.model.Question;
import com.anorby.matching.model.Submission;
import com.anorby.matching.model.Submissions;
import java.time.Instant;
import java.util.Map;
import java.util.SplittableRandom;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

@Component
public class ShadowProfile {

  private final long shadowUserId;
  private final long seed;

  public ShadowProfile(MatchingProperties properties) {
    this.shadowUserId = properties.shadow().userId();
    this.seed = properties.shadow().seed();
  }

  public long shadowUserId() {
    return shadowUserId;
  }

  public boolean isShadow(long userId) {
    return userId == shadowUserId;
  }

  /**
   * 役割: 今回ラウンド用のシャドウ回答を生成する。
   * 動作: 各質問を確率 mean で B、それ以外を A とする。乱数は seed とラウンド開始時刻から決まる。
   * 前提: submissions にはシャドウ自身の回答が含まれていないこと。
   */
  public Submission roll(Submissions submissions, Instant roundStartedAt) {
    final SplittableRandom random = new SplittableRandom(seed ^ roundStartedAt.toEpochMilli());
    final Map<Long, Answer> answers = new TreeMap<>();
    for (Question question : submissions.questions().values()) {
      answers.put(question.id(), random.nextDouble() < question.mean() ? Answer.B : Answer.A);
    }
    final long primaryQuestionId =
        submissions.questions().isEmpty() ? 0L : submissions.questions().keySet().iterator().next();
    return new Submission(
        shadowUserId, AnswerVector.of(answers), primaryQuestionId, AssociationScheme.SEEK_SIMILAR);
  }
}
