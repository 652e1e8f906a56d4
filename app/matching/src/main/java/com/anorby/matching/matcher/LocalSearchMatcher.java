package com.anorby.matching.matcher;

import com.anorby.matching.config.MatchingProperties;
import com.anorby.matching.model.Marriage;
import com.anorby.matching.model.MatchPair;
import com.anorby.matching.model.RecencyExclusion;
import com.anorby.matching.model.StrategyName;
import com.anorby.matching.model.Submission;
import com.anorby.matching.model.Submissions;
import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 貪欲初期化 + 2 ペア間スワップの局所探索でペアリングを作る。
 *
 * <p>重みは {@link SimilarityScorer#pairScore} (対称)。全体最適は保証しない。陣営分けが偏っているときや
 * 母集団が大きいときに StableMatcher の代わりに使う。
 */
@Component
public class LocalSearchMatcher implements AssignmentStrategy {

  private static final Logger logger = LoggerFactory.getLogger(LocalSearchMatcher.class);
  private static final double EPSILON = 1e-12;

  private final SimilarityScorer scorer;
  private final ShadowProfile shadowProfile;
  private final int maxPasses;

  public LocalSearchMatcher(
      SimilarityScorer scorer, ShadowProfile shadowProfile, MatchingProperties properties) {
    this.scorer = scorer;
    this.shadowProfile = shadowProfile;
    this.maxPasses = properties.localSearch().maxPasses();
  }

  @Override
  public StrategyName name() {
    return StrategyName.LOCAL_SEARCH;
  }

  @Override
  public Marriage assign(Submissions submissions, RecencyExclusion recency) {
    return search(submissions, recency).marriage();
  }

  public LocalSearchOutcome search(Submissions submissions, RecencyExclusion recency) {
    final long shadowId = shadowProfile.shadowUserId();
    final List<Long> realUsers = new ArrayList<>();
    for (Long userId : submissions.userIds()) {
      if (userId != shadowId) {
        realUsers.add(userId);
      }
    }
    final Map<MatchPair, Double> weights = eligibleWeights(submissions, recency, realUsers);

    final List<long[]> pairs = greedy(weights);
    final double initialWeight = totalWeight(pairs, weights);

    int passes = 0;
    int swaps = 0;
    boolean improved = true;
    while (improved && passes < maxPasses) {
      improved = false;
      passes++;
      for (int i = 0; i < pairs.size(); i++) {
        for (int j = i + 1; j < pairs.size(); j++) {
          if (trySwap(pairs, i, j, weights)) {
            improved = true;
            swaps++;
          }
        }
      }
    }
    final double finalWeight = totalWeight(pairs, weights);

    final Marriage.Builder builder = Marriage.builder(submissions.userIds());
    for (long[] pair : pairs) {
      builder.pair(pair[0], pair[1]);
    }
    if (submissions.contains(shadowId)) {
      for (Long userId : realUsers) {
        if (builder.isFree(userId)) {
          builder.pair(userId, shadowId);
          break;
        }
      }
    }
    logger.debug(
        "local search finished eligiblePairs={} pairs={} passes={} swaps={} weight={}->{}",
        weights.size(),
        pairs.size(),
        passes,
        swaps,
        initialWeight,
        finalWeight);
    return new LocalSearchOutcome(
        builder.build(), initialWeight, finalWeight, passes, swaps, !improved);
  }

  private Map<MatchPair, Double> eligibleWeights(
      Submissions submissions, RecencyExclusion recency, List<Long> realUsers) {
    final Map<MatchPair, Double> weights = new HashMap<>();
    for (int i = 0; i < realUsers.size(); i++) {
      final Submission left = submissions.require(realUsers.get(i));
      for (int j = i + 1; j < realUsers.size(); j++) {
        final Submission right = submissions.require(realUsers.get(j));
        if (recency.excludesEither(left.userId(), right.userId())) {
          continue;
        }
        final OptionalDouble weight = scorer.pairScore(left, right, submissions.questions());
        if (weight.isPresent()) {
          weights.put(MatchPair.canonical(left.userId(), right.userId()), weight.getAsDouble());
        }
      }
    }
    return weights;
  }

  // 重み降順 (同点はペア ID 昇順) に、両者とも未確定のペアを確定していく。
  private List<long[]> greedy(Map<MatchPair, Double> weights) {
    final List<Map.Entry<MatchPair, Double>> ordered = new ArrayList<>(weights.entrySet());
    ordered.sort(
        Comparator.<Map.Entry<MatchPair, Double>>comparingDouble(Map.Entry::getValue)
            .reversed()
            .thenComparing(Map.Entry::getKey, MatchPair.ORDER));
    final Set<Long> committed = new HashSet<>();
    final List<long[]> pairs = new ArrayList<>();
    for (Map.Entry<MatchPair, Double> entry : ordered) {
      final MatchPair pair = entry.getKey();
      if (committed.contains(pair.userId()) || committed.contains(pair.partnerId())) {
        continue;
      }
      committed.add(pair.userId());
      committed.add(pair.partnerId());
      pairs.add(new long[] {pair.userId(), pair.partnerId()});
    }
    return pairs;
  }

  /**
   * (a,b)+(c,d) を (a,c)+(b,d) か (a,d)+(b,c) へ組み替えて合計が厳密に増えるなら、増分の大きい方を適用する。
   * 非適格な組み替えは候補にしない。
   */
  @VisibleForTesting
  static boolean trySwap(List<long[]> pairs, int i, int j, Map<MatchPair, Double> weights) {
    final long a = pairs.get(i)[0];
    final long b = pairs.get(i)[1];
    final long c = pairs.get(j)[0];
    final long d = pairs.get(j)[1];
    final double current = weight(a, b, weights) + weight(c, d, weights);
    final long[][][] options = {
      {{a, c}, {b, d}},
      {{a, d}, {b, c}},
    };

    double bestGain = EPSILON;
    long[][] best = null;
    for (long[][] option : options) {
      final long[] first = option[0];
      final long[] second = option[1];
      if (!eligible(first[0], first[1], weights) || !eligible(second[0], second[1], weights)) {
        continue;
      }
      final double gain =
          weight(first[0], first[1], weights) + weight(second[0], second[1], weights) - current;
      if (gain > bestGain) {
        bestGain = gain;
        best = option;
      }
    }
    if (best == null) {
      return false;
    }
    pairs.set(i, best[0]);
    pairs.set(j, best[1]);
    return true;
  }

  private static boolean eligible(long left, long right, Map<MatchPair, Double> weights) {
    return weights.containsKey(MatchPair.canonical(left, right));
  }

  private static double weight(long left, long right, Map<MatchPair, Double> weights) {
    return weights.get(MatchPair.canonical(left, right));
  }

  private static double totalWeight(List<long[]> pairs, Map<MatchPair, Double> weights) {
    double total = 0.0;
    for (long[] pair : pairs) {
      total += weight(pair[0], pair[1], weights);
    }
    return total;
  }
}
