package com.anorby.matching.matcher;

import com.anorby.matching.config.MatchingProperties;
import com.anorby.matching.model.Answer;
import com.anorby.matching.model.AnswerVector;
import com.anorby.matching.model.AssociationScheme;
import com.anorby.matching.model.Question;
import com.anorby.matching.model.Submission;
import java.util.Map;
import java.util.OptionalDouble;
import org.springframework.stereotype.Component;

/**
 * 2 ユーザー間の相性スコアを計算する。
 *
 * <p>共通回答した質問ごとに、方針上の一致なら +分散、不一致なら -分散を加え、共通回答数で割る。
 * 分散は p(1-p) なので賛否の割れる質問ほど効く。スコアは呼び出し側が渡す方針に依存する有向値。
 */
@Component
public class SimilarityScorer {

  /** 非適格ペアの番兵。実スコアは [-0.25, 0.25] に収まるため必ずこれより大きい。 */
  public static final double MIN_SCORE = -1.0;

  private final int minSharedAnswers;

  public SimilarityScorer(MatchingProperties properties) {
    this.minSharedAnswers = properties.minSharedAnswers();
  }

  /**
   * 役割: subject から見た candidate のスコアを返す。
   * 動作: 共通回答が min-shared-answers 未満なら empty (非適格)、それ以外は平均寄与を返す。
   * 前提: questions は今回のスナップショットの質問バンク。バンクに無い質問は無視する。
   */
  public OptionalDouble score(
      AnswerVector subject,
      AnswerVector candidate,
      AssociationScheme directive,
      Map<Long, Question> questions) {
    final AnswerVector smaller = subject.size() <= candidate.size() ? subject : candidate;
    final AnswerVector larger = smaller == subject ? candidate : subject;
    int shared = 0;
    double sum = 0.0;
    for (Map.Entry<Long, Answer> entry : smaller.asMap().entrySet()) {
      final Question question = questions.get(entry.getKey());
      if (question == null) {
        continue;
      }
      final Answer other = larger.answerTo(entry.getKey()).orElse(null);
      if (other == null) {
        continue;
      }
      shared++;
      final double variance = question.variance();
      sum += directive.agrees(entry.getValue(), other) ? variance : -variance;
    }
    if (shared < minSharedAnswers) {
      return OptionalDouble.empty();
    }
    return OptionalDouble.of(sum / shared);
  }

  /** subject 自身の方針で candidate を評価する。ランキングはこちらを使う。 */
  public OptionalDouble scoreFor(
      Submission subject, Submission candidate, Map<Long, Question> questions) {
    return score(subject.answers(), candidate.answers(), subject.scheme(), questions);
  }

  /**
   * 無向ペアの重み。両者それぞれの方針で評価した値の平均を取るため、常に対称になる。
   * どちらか一方でも非適格なら empty。
   */
  public OptionalDouble pairScore(Submission left, Submission right, Map<Long, Question> questions) {
    final OptionalDouble forward = scoreFor(left, right, questions);
    if (forward.isEmpty()) {
      return OptionalDouble.empty();
    }
    final OptionalDouble backward = scoreFor(right, left, questions);
    if (backward.isEmpty()) {
      return OptionalDouble.empty();
    }
    return OptionalDouble.of((forward.getAsDouble() + backward.getAsDouble()) / 2.0);
  }
}
