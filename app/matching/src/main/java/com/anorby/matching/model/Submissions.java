package com.anorby.matching.model;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * ラウンド開始時点の入力スナップショット。ユーザー ID 昇順で保持し、質問バンクも同梱する。
 *
 * <p>不変オブジェクト。シャドウの追加は {@link #withParticipant(Submission)} でコピーを作る。
 */
public final class Submissions {

  private final Map<Long, Submission> byUserId;
  private final Map<Long, Question> questions;

  private Submissions(Map<Long, Submission> byUserId, Map<Long, Question> questions) {
    this.byUserId = Collections.unmodifiableMap(byUserId);
    this.questions = Collections.unmodifiableMap(questions);
  }

  public static Submissions of(Collection<Submission> submissions, Collection<Question> questions) {
    final Map<Long, Submission> users = new TreeMap<>();
    for (Submission submission : submissions) {
      if (users.put(submission.userId(), submission) != null) {
        throw new IllegalArgumentException("duplicate submission userId=" + submission.userId());
      }
    }
    final Map<Long, Question> bank = new TreeMap<>();
    for (Question question : questions) {
      bank.put(question.id(), question);
    }
    return new Submissions(users, bank);
  }

  public Submissions withParticipant(Submission submission) {
    final Map<Long, Submission> users = new TreeMap<>(byUserId);
    users.put(submission.userId(), submission);
    return new Submissions(users, new TreeMap<>(questions));
  }

  public Submission require(long userId) {
    final Submission submission = byUserId.get(userId);
    if (submission == null) {
      throw new IllegalArgumentException("unknown userId=" + userId);
    }
    return submission;
  }

  public boolean contains(long userId) {
    return byUserId.containsKey(userId);
  }

  public List<Long> userIds() {
    return List.copyOf(byUserId.keySet());
  }

  public Collection<Submission> all() {
    return byUserId.values();
  }

  public Map<Long, Question> questions() {
    return questions;
  }

  public int size() {
    return byUserId.size();
  }

  public boolean isEmpty() {
    return byUserId.isEmpty();
  }
}
