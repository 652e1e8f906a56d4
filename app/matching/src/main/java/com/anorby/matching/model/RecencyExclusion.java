package com.anorby.matching.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/** 直近ウィンドウ内にマッチ済みの相手。今回のラウンドでは候補から除外する。 */
public final class RecencyExclusion {

  private static final RecencyExclusion NONE = new RecencyExclusion(Map.of());

  private final Map<Long, Set<Long>> recentPartners;

  private RecencyExclusion(Map<Long, Set<Long>> recentPartners) {
    final Map<Long, Set<Long>> copy = new HashMap<>();
    recentPartners.forEach((userId, partners) -> copy.put(userId, Set.copyOf(partners)));
    this.recentPartners = Collections.unmodifiableMap(copy);
  }

  public static RecencyExclusion of(Map<Long, ? extends Set<Long>> recentPartners) {
    if (recentPartners == null || recentPartners.isEmpty()) {
      return NONE;
    }
    final Map<Long, Set<Long>> copy = new HashMap<>();
    recentPartners.forEach((userId, partners) -> copy.put(userId, new HashSet<>(partners)));
    return new RecencyExclusion(copy);
  }

  public static RecencyExclusion none() {
    return NONE;
  }

  public Set<Long> partnersOf(long userId) {
    return recentPartners.getOrDefault(userId, Set.of());
  }

  public boolean excludes(long userId, long candidateId) {
    return partnersOf(userId).contains(candidateId);
  }

  /** どちらか一方の記録にあれば除外する。 */
  public boolean excludesEither(long left, long right) {
    return excludes(left, right) || excludes(right, left);
  }
}
