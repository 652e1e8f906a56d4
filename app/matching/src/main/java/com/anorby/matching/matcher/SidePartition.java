package com.anorby.matching.matcher;

import com.anorby.matching.model.Answer;
import com.anorby.matching.model.Submission;
import com.anorby.matching.model.Submissions;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 主質問への回答で実ユーザーを A/B の 2 陣営に分ける。主質問が未回答のユーザーは ID 順に小さい側へ入れる。
 * シャドウはここでは扱わない。
 */
record SidePartition(List<Long> sideA, List<Long> sideB) {

  SidePartition {
    sideA = List.copyOf(sideA);
    sideB = List.copyOf(sideB);
  }

  static SidePartition of(Submissions submissions, long shadowUserId) {
    final List<Long> sideA = new ArrayList<>();
    final List<Long> sideB = new ArrayList<>();
    final List<Long> undecided = new ArrayList<>();
    for (Submission submission : submissions.all()) {
      if (submission.userId() == shadowUserId) {
        continue;
      }
      final Optional<Answer> side = submission.side();
      if (side.isEmpty()) {
        undecided.add(submission.userId());
      } else if (side.get() == Answer.A) {
        sideA.add(submission.userId());
      } else {
        sideB.add(submission.userId());
      }
    }
    for (Long userId : undecided) {
      if (sideA.size() <= sideB.size()) {
        sideA.add(userId);
      } else {
        sideB.add(userId);
      }
    }
    return new SidePartition(sideA, sideB);
  }

  int population() {
    return sideA.size() + sideB.size();
  }

  int smallerSize() {
    return Math.min(sideA.size(), sideB.size());
  }

  boolean isBalanced() {
    return sideA.size() == sideB.size();
  }

  boolean sideAIsSmaller() {
    return sideA.size() < sideB.size();
  }
}
