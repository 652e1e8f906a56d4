/*
 * どこで: Matching ドメインモデル
 * 何を: 1 ユーザー分のマッチング入力を表現する
 * なぜ: 回答・主質問・相性方針を Repository から matcher へ一括で渡すため
 */
package com.anorby.matching.model;

import java.util.Objects;
import java.util.Optional;

public record Submission(
    long userId, AnswerVector answers, long primaryQuestionId, AssociationScheme scheme) {

  public Submission {
    answers = answers == null ? AnswerVector.empty() : answers;
    Objects.requireNonNull(scheme, "scheme");
  }

  /** 主質問への自分の回答。二部マッチングの陣営を決める。 */
  public Optional<Answer> side() {
    return answers.answerTo(primaryQuestionId);
  }
}
