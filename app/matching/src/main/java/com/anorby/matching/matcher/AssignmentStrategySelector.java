package com.anorby.matching.matcher;

import com.anorby.matching.config.MatchingProperties;
import com.anorby.matching.model.StrategyName;
import com.anorby.matching.model.Submissions;
import com.google.common.annotations.VisibleForTesting;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 設定に従って割当戦略を選ぶ。AUTO のときは陣営の偏りと母集団サイズで STABLE / LOCAL_SEARCH を決める。
 */
@Component
public class AssignmentStrategySelector {

  private static final Logger logger = LoggerFactory.getLogger(AssignmentStrategySelector.class);

  private final List<AssignmentStrategy> strategies;
  private final ShadowProfile shadowProfile;
  private final StrategyName configured;
  private final double skewThreshold;
  private final int populationThreshold;

  public AssignmentStrategySelector(
      List<AssignmentStrategy> strategies,
      ShadowProfile shadowProfile,
      MatchingProperties properties) {
    this.strategies = List.copyOf(strategies);
    this.shadowProfile = shadowProfile;
    this.configured = properties.strategy();
    this.skewThreshold = properties.skewThreshold();
    this.populationThreshold = properties.localSearch().populationThreshold();
  }

  public AssignmentStrategy select(Submissions submissions) {
    final StrategyName resolved = resolve(submissions);
    for (AssignmentStrategy strategy : strategies) {
      if (strategy.supports(resolved)) {
        return strategy;
      }
    }
    throw new IllegalStateException("no assignment strategy registered for " + resolved);
  }

  @VisibleForTesting
  StrategyName resolve(Submissions submissions) {
    if (configured != StrategyName.AUTO) {
      return configured;
    }
    final SidePartition partition = SidePartition.of(submissions, shadowProfile.shadowUserId());
    final int population = partition.population();
    if (population == 0) {
      return StrategyName.STABLE;
    }
    if (population > populationThreshold) {
      logger.info(
          "assignment strategy auto-selected LOCAL_SEARCH population={} threshold={}",
          population,
          populationThreshold);
      return StrategyName.LOCAL_SEARCH;
    }
    final double smallerShare = (double) partition.smallerSize() / population;
    if (smallerShare < skewThreshold) {
      logger.info(
          "assignment strategy auto-selected LOCAL_SEARCH sideA={} sideB={} skewThreshold={}",
          partition.sideA().size(),
          partition.sideB().size(),
          skewThreshold);
      return StrategyName.LOCAL_SEARCH;
    }
    return StrategyName.STABLE;
  }
}
