/*
 * どこで: Matching ドメインモデル
 * 何を: 1 ユーザーの候補順位を表現する
 * なぜ: StableMatcher の提案順と受理判定を同じ順位から引くため
 */
package com.anorby.matching.model;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

public final class PreferenceList {

  private final long userId;
  private final List<Candidate> candidates;
  private final Map<Long, Integer> rankByUserId;

  public PreferenceList(long userId, List<Candidate> candidates) {
    this.userId = userId;
    this.candidates = List.copyOf(candidates);
    this.rankByUserId = new HashMap<>();
    for (int i = 0; i < this.candidates.size(); i++) {
      rankByUserId.putIfAbsent(this.candidates.get(i).userId(), i);
    }
  }

  public long userId() {
    return userId;
  }

  public List<Candidate> candidates() {
    return candidates;
  }

  public List<Long> candidateIds() {
    final List<Long> ids = new ArrayList<>(candidates.size());
    for (Candidate candidate : candidates) {
      ids.add(candidate.userId());
    }
    return ids;
  }

  /** 順位 (0 が最上位)。リストに無い相手は empty。 */
  public OptionalInt rankOf(long candidateId) {
    final Integer rank = rankByUserId.get(candidateId);
    return rank == null ? OptionalInt.empty() : OptionalInt.of(rank);
  }

  public boolean contains(long candidateId) {
    return rankByUserId.containsKey(candidateId);
  }

  /** left を right より好むか。リスト外は常に最下位扱い。 */
  public boolean prefers(long left, long right) {
    final OptionalInt leftRank = rankOf(left);
    if (leftRank.isEmpty()) {
      return false;
    }
    final OptionalInt rightRank = rankOf(right);
    return rightRank.isEmpty() || leftRank.getAsInt() < rightRank.getAsInt();
  }

  public boolean isEmpty() {
    return candidates.isEmpty();
  }

  public int size() {
    return candidates.size();
  }

  /** 条件に合う候補だけを残した新しいリストを返す。順序は保つ。 */
  public PreferenceList restrictTo(Set<Long> allowed) {
    final List<Candidate> kept = new ArrayList<>();
    for (Candidate candidate : candidates) {
      if (allowed.contains(candidate.userId())) {
        kept.add(candidate);
      }
    }
    return new PreferenceList(userId, kept);
  }

  /** 末尾 (最下位) に候補を追加した新しいリストを返す。既にあればそのまま。 */
  public PreferenceList withLowestPriority(Candidate candidate) {
    if (contains(candidate.userId())) {
      return this;
    }
    final List<Candidate> extended = new ArrayList<>(candidates);
    extended.add(candidate);
    return new PreferenceList(userId, extended);
  }

  @Override
  public String toString() {
    return "PreferenceList{userId=" + userId + ", candidates=" + candidateIds() + "}";
  }
}
