package com.anorby.matching.matcher;

import static com.anorby.matching.MatchingTestFixtures.SHADOW_ID;
import static com.anorby.matching.MatchingTestFixtures.controversialQuestions;
import static com.anorby.matching.MatchingTestFixtures.properties;
import static com.anorby.matching.MatchingTestFixtures.submission;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.anorby.matching.config.MatchingProperties;
import com.anorby.matching.model.AssociationScheme;
import com.anorby.matching.model.StrategyName;
import com.anorby.matching.model.Submission;
import com.anorby.matching.model.Submissions;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class AssignmentStrategySelectorTest {

  private static AssignmentStrategySelector selector(MatchingProperties properties) {
    final SimilarityScorer scorer = new SimilarityScorer(properties);
    final ShadowProfile shadowProfile = new ShadowProfile(properties);
    final PreferenceRanker ranker = new PreferenceRanker(scorer, shadowProfile, properties);
    return new AssignmentStrategySelector(
        List.of(
            new StableMatcher(ranker, shadowProfile),
            new LocalSearchMatcher(scorer, shadowProfile, properties)),
        shadowProfile,
        properties);
  }

  /** sideA 人が A、sideB 人が B を主質問に答えた母集団。シャドウは B 側に置く。 */
  private static Submissions population(int sideA, int sideB) {
    final List<Submission> submissions = new ArrayList<>();
    long id = 10;
    for (int i = 0; i < sideA; i++) {
      submissions.add(submission(id++, AssociationScheme.SEEK_SIMILAR, 0, 0));
    }
    for (int i = 0; i < sideB; i++) {
      submissions.add(submission(id++, AssociationScheme.SEEK_SIMILAR, 1, 0));
    }
    submissions.add(submission(SHADOW_ID, AssociationScheme.SEEK_SIMILAR, 1, 1));
    return Submissions.of(submissions, controversialQuestions(2));
  }

  @Test
  void configuredStrategyWinsOverAuto() {
    final AssignmentStrategySelector selector =
        selector(properties(StrategyName.LOCAL_SEARCH, 1, 50));

    assertThat(selector.select(population(3, 3)).name()).isEqualTo(StrategyName.LOCAL_SEARCH);
  }

  @Test
  void autoPicksStableForBalancedPopulation() {
    assertThat(selector(properties()).select(population(3, 2)).name())
        .isEqualTo(StrategyName.STABLE);
  }

  @Test
  void autoPicksLocalSearchWhenSidesAreSkewed() {
    assertThat(selector(properties()).select(population(1, 9)).name())
        .isEqualTo(StrategyName.LOCAL_SEARCH);
  }

  @Test
  void autoPicksLocalSearchForLargePopulation() {
    final MatchingProperties properties =
        properties(StrategyName.AUTO, new MatchingProperties.LocalSearch(null, 4));

    assertThat(selector(properties).resolve(population(3, 2))).isEqualTo(StrategyName.LOCAL_SEARCH);
    assertThat(selector(properties).resolve(population(2, 2))).isEqualTo(StrategyName.STABLE);
  }

  @Test
  void emptyPopulationFallsBackToStable() {
    final Submissions empty = Submissions.of(List.of(), controversialQuestions(2));

    assertThat(selector(properties()).resolve(empty)).isEqualTo(StrategyName.STABLE);
  }

  @Test
  void throwsWhenNoStrategySupportsTheResolvedName() {
    final MatchingProperties properties = properties(StrategyName.LOCAL_SEARCH, 1, 50);
    final ShadowProfile shadowProfile = new ShadowProfile(properties);
    final AssignmentStrategySelector selector =
        new AssignmentStrategySelector(
            List.of(
                new StableMatcher(
                    new PreferenceRanker(
                        new SimilarityScorer(properties), shadowProfile, properties),
                    shadowProfile)),
            shadowProfile,
            properties);

    assertThatThrownBy(() -> selector.select(population(2, 2)))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("LOCAL_SEARCH");
  }
}
