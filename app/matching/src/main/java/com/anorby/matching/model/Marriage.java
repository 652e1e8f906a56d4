package com.anorby.matching.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * ラウンド結果のペアリング。参加者ごとに相手 (無ければ empty) を持つ。
 *
 * <p>{@link Builder} 経由で作る限り相互参照・自己マッチ無し・二重割当無しが構造的に保証される。
 * 任意の割当を受け取る {@link #of(Collection, Map)} は検証用で、{@code MarriageValidator} を通す前提。
 */
public final class Marriage {

  private final Set<Long> participants;
  private final Map<Long, Long> partners;

  private Marriage(Set<Long> participants, Map<Long, Long> partners) {
    this.participants = Collections.unmodifiableSet(new TreeSet<>(participants));
    this.partners = Collections.unmodifiableMap(new TreeMap<>(partners));
  }

  public static Builder builder(Collection<Long> participants) {
    return new Builder(participants);
  }

  public static Marriage of(Collection<Long> participants, Map<Long, Long> assignments) {
    return new Marriage(new TreeSet<>(participants), assignments);
  }

  public static Marriage empty(Collection<Long> participants) {
    return new Marriage(new TreeSet<>(participants), Map.of());
  }

  public Optional<Long> partnerOf(long userId) {
    return Optional.ofNullable(partners.get(userId));
  }

  public Set<Long> participants() {
    return participants;
  }

  public Map<Long, Long> assignments() {
    return partners;
  }

  /** 成立ペアを (小さい ID, 大きい ID) 昇順で返す。 */
  public List<MatchPair> pairs() {
    final Set<MatchPair> pairs = new LinkedHashSet<>();
    for (Map.Entry<Long, Long> entry : partners.entrySet()) {
      pairs.add(MatchPair.canonical(entry.getKey(), entry.getValue()));
    }
    final List<MatchPair> sorted = new ArrayList<>(pairs);
    sorted.sort(MatchPair.ORDER);
    return sorted;
  }

  public List<Long> unmatched() {
    final List<Long> unmatched = new ArrayList<>();
    for (Long userId : participants) {
      if (!partners.containsKey(userId)) {
        unmatched.add(userId);
      }
    }
    return unmatched;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Marriage other
        && participants.equals(other.participants)
        && partners.equals(other.partners);
  }

  @Override
  public int hashCode() {
    return 31 * participants.hashCode() + partners.hashCode();
  }

  @Override
  public String toString() {
    return "Marriage{pairs=" + pairs() + ", unmatched=" + unmatched() + "}";
  }

  public static final class Builder {

    private final Set<Long> participants;
    private final Map<Long, Long> partners = new TreeMap<>();

    private Builder(Collection<Long> participants) {
      this.participants = new TreeSet<>(participants);
    }

    /** 両方向の割当を同時に登録する。既に相手がいる参加者を含む場合は例外。 */
    public Builder pair(long left, long right) {
      if (left == right) {
        throw new IllegalArgumentException("self match userId=" + left);
      }
      requireParticipant(left);
      requireParticipant(right);
      if (partners.containsKey(left) || partners.containsKey(right)) {
        throw new IllegalStateException("already paired left=" + left + " right=" + right);
      }
      partners.put(left, right);
      partners.put(right, left);
      return this;
    }

    public boolean isFree(long userId) {
      return !partners.containsKey(userId);
    }

    public Marriage build() {
      return new Marriage(participants, partners);
    }

    private void requireParticipant(long userId) {
      if (!participants.contains(userId)) {
        throw new IllegalArgumentException("not a participant userId=" + userId);
      }
    }
  }
}
