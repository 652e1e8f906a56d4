package com.anorby.matching.matcher;

import static com.anorby.matching.MatchingTestFixtures.SHADOW_ID;
import static com.anorby.matching.MatchingTestFixtures.controversialQuestions;
import static com.anorby.matching.MatchingTestFixtures.properties;
import static com.anorby.matching.MatchingTestFixtures.randomPopulation;
import static com.anorby.matching.MatchingTestFixtures.submission;
import static com.anorby.matching.MatchingTestFixtures.submissions;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import com.anorby.matching.config.MatchingProperties;
import com.anorby.matching.model.Answer;
import com.anorby.matching.model.AssociationScheme;
import com.anorby.matching.model.Marriage;
import com.anorby.matching.model.MatchPair;
import com.anorby.matching.model.PreferenceList;
import com.anorby.matching.model.RecencyExclusion;
import com.anorby.matching.model.StrategyName;
import com.anorby.matching.model.Submission;
import com.anorby.matching.model.Submissions;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class StableMatcherTest {

  private final MatchingProperties properties = properties();
  private final ShadowProfile shadowProfile = new ShadowProfile(properties);
  private final PreferenceRanker ranker =
      new PreferenceRanker(new SimilarityScorer(properties), shadowProfile, properties);
  private final StableMatcher matcher = new StableMatcher(ranker, shadowProfile);
  private final MarriageValidator validator = new MarriageValidator(shadowProfile);

  @Test
  void fourUsersSplitTwoAndTwoProduceTwoMutualCrossSidePairs() {
    final Submissions input =
        submissions(
            controversialQuestions(3),
            submission(10, AssociationScheme.SEEK_SIMILAR, 0, 0, 0),
            submission(11, AssociationScheme.SEEK_SIMILAR, 0, 1, 1),
            submission(12, AssociationScheme.SEEK_SIMILAR, 1, 0, 0),
            submission(13, AssociationScheme.SEEK_SIMILAR, 1, 1, 1));

    final Marriage first = matcher.assign(input, RecencyExclusion.none());
    final Marriage second = matcher.assign(input, RecencyExclusion.none());

    assertThat(first.pairs()).containsExactly(new MatchPair(10, 12), new MatchPair(11, 13));
    assertThat(first.partnerOf(12)).contains(10L);
    assertThat(first.partnerOf(13)).contains(11L);
    assertThat(first).isEqualTo(second);
  }

  @Test
  void resultIsStableOnRandomPopulations() {
    for (long seed = 1; seed <= 25; seed++) {
      final Submissions real = randomPopulation(seed, 5 + (int) (seed % 7), 6);
      final Submissions input =
          real.withParticipant(shadowProfile.roll(real, Instant.ofEpochSecond(seed)));

      final Marriage marriage = matcher.assign(input, RecencyExclusion.none());

      assertThatCode(() -> validator.validate(marriage)).doesNotThrowAnyException();
      assertNoBlockingPair(real, ranker.rankAll(input, RecencyExclusion.none()), marriage);
    }
  }

  @Test
  void usersWithoutEligibleCandidatesStayUnmatched() {
    final MatchingProperties strict = properties(StrategyName.STABLE, 2, 50);
    final ShadowProfile strictShadow = new ShadowProfile(strict);
    final StableMatcher strictMatcher =
        new StableMatcher(
            new PreferenceRanker(new SimilarityScorer(strict), strictShadow, strict), strictShadow);
    final Submissions input =
        submissions(
            controversialQuestions(3),
            submission(10, AssociationScheme.SEEK_SIMILAR, 0, 1, 1),
            submission(11, AssociationScheme.SEEK_SIMILAR, 1, 1, 1),
            submission(12, AssociationScheme.SEEK_SIMILAR, 1, -1, -1));

    final Marriage marriage = strictMatcher.assign(input, RecencyExclusion.none());

    assertThat(marriage.pairs()).containsExactly(new MatchPair(10, 11));
    assertThat(marriage.unmatched()).containsExactly(12L);
  }

  @Test
  void recentPartnersAreNeverPairedAgain() {
    final Submissions input =
        submissions(
            controversialQuestions(3),
            submission(10, AssociationScheme.SEEK_SIMILAR, 0, 0, 0),
            submission(12, AssociationScheme.SEEK_SIMILAR, 1, 0, 0));
    final RecencyExclusion recency = RecencyExclusion.of(Map.of(12L, Set.of(10L)));

    final Marriage marriage = matcher.assign(input, recency);

    assertThat(marriage.pairs()).isEmpty();
    assertThat(marriage.unmatched()).containsExactly(10L, 12L);
  }

  @Test
  void oneSidedPopulationLeansOnShadow() {
    final Submissions real =
        submissions(
            controversialQuestions(2),
            submission(10, AssociationScheme.SEEK_SIMILAR, 0, 0),
            submission(11, AssociationScheme.SEEK_SIMILAR, 0, 1),
            submission(12, AssociationScheme.SEEK_SIMILAR, 0, 0));
    final Submissions input =
        real.withParticipant(submission(SHADOW_ID, AssociationScheme.SEEK_SIMILAR, 1, 0));

    final Marriage marriage = matcher.assign(input, RecencyExclusion.none());

    assertThat(marriage.pairs()).hasSize(1);
    assertThat(marriage.pairs().get(0).contains(SHADOW_ID)).isTrue();
    assertThatCode(() -> validator.validate(marriage)).doesNotThrowAnyException();
  }

  @Test
  void oneSidedPopulationWithoutShadowLeavesEveryoneUnmatched() {
    final Submissions input =
        submissions(
            controversialQuestions(2),
            submission(10, AssociationScheme.SEEK_SIMILAR, 0, 0),
            submission(11, AssociationScheme.SEEK_SIMILAR, 0, 1));

    final Marriage marriage = matcher.assign(input, RecencyExclusion.none());

    assertThat(marriage.pairs()).isEmpty();
    assertThat(marriage.unmatched()).containsExactly(10L, 11L);
  }

  private static void assertNoBlockingPair(
      Submissions real, Map<Long, PreferenceList> lists, Marriage marriage) {
    final List<Long> sideA = new ArrayList<>();
    final List<Long> sideB = new ArrayList<>();
    for (Submission submission : real.all()) {
      (submission.side().orElseThrow() == Answer.A ? sideA : sideB).add(submission.userId());
    }
    for (Long u : sideA) {
      for (Long v : sideB) {
        final PreferenceList listU = lists.get(u);
        final PreferenceList listV = lists.get(v);
        if (!listU.contains(v) || !listV.contains(u)) {
          continue;
        }
        final boolean uPrefersV = listU.rankOf(v).getAsInt() < rankOfPartner(listU, marriage, u);
        final boolean vPrefersU = listV.rankOf(u).getAsInt() < rankOfPartner(listV, marriage, v);
        assertThat(uPrefersV && vPrefersU)
            .as("blocking pair u=%d v=%d in %s", u, v, marriage)
            .isFalse();
      }
    }
  }

  // 未マッチとシャドウは実ユーザーのどの候補よりも下位
  private static int rankOfPartner(PreferenceList list, Marriage marriage, long userId) {
    final Optional<Long> partner = marriage.partnerOf(userId);
    if (partner.isEmpty() || partner.get() == SHADOW_ID) {
      return Integer.MAX_VALUE;
    }
    return list.rankOf(partner.get()).orElse(Integer.MAX_VALUE);
  }
}
