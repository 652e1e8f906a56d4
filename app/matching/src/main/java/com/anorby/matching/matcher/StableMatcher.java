package com.anorby.matching.matcher;

import com.anorby.matching.model.Candidate;
import com.anorby.matching.model.Marriage;
import com.anorby.matching.model.PreferenceList;
import com.anorby.matching.model.RecencyExclusion;
import com.anorby.matching.model.StrategyName;
import com.anorby.matching.model.Submissions;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 主質問の回答で 2 陣営に分け、A 側から提案する deferred acceptance で安定マッチングを作る。
 *
 * <p>陣営の人数が異なりシャドウがいる場合は、シャドウを少ない側へ入れ、反対側全員のリスト末尾に付ける。
 * 候補を使い切った提案者は今回ラウンドでは未マッチ。
 */
@Component
public class StableMatcher implements AssignmentStrategy {

  private static final Logger logger = LoggerFactory.getLogger(StableMatcher.class);

  private final PreferenceRanker ranker;
  private final ShadowProfile shadowProfile;

  public StableMatcher(PreferenceRanker ranker, ShadowProfile shadowProfile) {
    this.ranker = ranker;
    this.shadowProfile = shadowProfile;
  }

  @Override
  public StrategyName name() {
    return StrategyName.STABLE;
  }

  @Override
  public Marriage assign(Submissions submissions, RecencyExclusion recency) {
    final long shadowId = shadowProfile.shadowUserId();
    final SidePartition partition = SidePartition.of(submissions, shadowId);
    final List<Long> sideA = new ArrayList<>(partition.sideA());
    final List<Long> sideB = new ArrayList<>(partition.sideB());
    final boolean shadowPatched = !partition.isBalanced() && submissions.contains(shadowId);
    if (shadowPatched) {
      (partition.sideAIsSmaller() ? sideA : sideB).add(shadowId);
    }
    logger.debug(
        "stable matching partition sideA={} sideB={} shadowPatched={}",
        sideA.size(),
        sideB.size(),
        shadowPatched);

    final Marriage.Builder builder = Marriage.builder(submissions.userIds());
    if (sideA.isEmpty() || sideB.isEmpty()) {
      return builder.build();
    }

    final Set<Long> setA = new HashSet<>(sideA);
    final Set<Long> setB = new HashSet<>(sideB);
    final Map<Long, PreferenceList> all = ranker.rankAll(submissions, recency);
    final Map<Long, PreferenceList> proposers = restrict(sideA, setB, all, shadowPatched, shadowId);
    final Map<Long, PreferenceList> receivers = restrict(sideB, setA, all, shadowPatched, shadowId);

    final Map<Long, Long> held = propose(proposers, receivers);
    held.forEach((receiver, proposer) -> builder.pair(proposer, receiver));
    return builder.build();
  }

  /**
   * 役割: deferred acceptance 本体。
   * 動作: 受け手 ID → 保持中の提案者 ID を返す。提案回数は高々 |A|×|B|。
   * 前提: 各リストは反対陣営だけに絞り込み済み。
   */
  private Map<Long, Long> propose(
      Map<Long, PreferenceList> proposers, Map<Long, PreferenceList> receivers) {
    final Deque<Long> free = new ArrayDeque<>(proposers.keySet());
    final Map<Long, Integer> nextIndex = new HashMap<>();
    final Map<Long, Long> held = new TreeMap<>();
    while (!free.isEmpty()) {
      final long proposer = free.pollFirst();
      final List<Candidate> candidates = proposers.get(proposer).candidates();
      final int index = nextIndex.getOrDefault(proposer, 0);
      if (index >= candidates.size()) {
        continue;
      }
      nextIndex.put(proposer, index + 1);
      final long receiver = candidates.get(index).userId();
      final PreferenceList receiverList = receivers.get(receiver);
      if (receiverList == null || !receiverList.contains(proposer)) {
        free.addFirst(proposer);
        continue;
      }
      final Long current = held.get(receiver);
      if (current == null) {
        held.put(receiver, proposer);
      } else if (receiverList.prefers(proposer, current)) {
        held.put(receiver, proposer);
        free.addLast(current);
      } else {
        free.addFirst(proposer);
      }
    }
    return held;
  }

  private Map<Long, PreferenceList> restrict(
      List<Long> side,
      Set<Long> opposite,
      Map<Long, PreferenceList> all,
      boolean shadowPatched,
      long shadowId) {
    final Map<Long, PreferenceList> restricted = new TreeMap<>();
    for (Long userId : side) {
      PreferenceList list = all.get(userId).restrictTo(opposite);
      if (shadowPatched && opposite.contains(shadowId)) {
        list = list.withLowestPriority(new Candidate(shadowId, SimilarityScorer.MIN_SCORE));
      }
      restricted.put(userId, list);
    }
    return restricted;
  }
}
