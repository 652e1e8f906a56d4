package com.anorby.matching.model;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/** ユーザー 1 人分の回答。未回答の質問はキーとして存在しない。 */
public final class AnswerVector {

  private static final AnswerVector EMPTY = new AnswerVector(Map.of());

  private final Map<Long, Answer> answers;

  private AnswerVector(Map<Long, Answer> answers) {
    this.answers = Collections.unmodifiableMap(new TreeMap<>(answers));
  }

  public static AnswerVector of(Map<Long, Answer> answers) {
    return answers == null || answers.isEmpty() ? EMPTY : new AnswerVector(answers);
  }

  public static AnswerVector empty() {
    return EMPTY;
  }

  public Optional<Answer> answerTo(long questionId) {
    return Optional.ofNullable(answers.get(questionId));
  }

  public Set<Long> answeredQuestionIds() {
    return answers.keySet();
  }

  public int size() {
    return answers.size();
  }

  public Map<Long, Answer> asMap() {
    return answers;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof AnswerVector other && answers.equals(other.answers);
  }

  @Override
  public int hashCode() {
    return answers.hashCode();
  }

  @Override
  public String toString() {
    return "AnswerVector" + answers;
  }
}
