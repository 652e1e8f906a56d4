package com.anorby.matching.matcher;

import com.anorby.matching.config.MatchingProperties;
import com.anorby.matching.model.Candidate;
import com.anorby.matching.model.PreferenceList;
import com.anorby.matching.model.RecencyExclusion;
import com.anorby.matching.model.Submission;
import com.anorby.matching.model.Submissions;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import org.springframework.stereotype.Component;

/**
 * ユーザーごとの候補順位を作る。
 *
 * <p>候補は自分・直近マッチ相手・非適格ペアを除いた全員。スコア降順、同点は ID 昇順。シャドウは実候補が
 * candidate-threshold 未満のときだけ最下位に付ける。
 */
@Component
public class PreferenceRanker {

  static final Comparator<Candidate> ORDER =
      Comparator.comparingDouble(Candidate::score)
          .reversed()
          .thenComparingLong(Candidate::userId);

  private final SimilarityScorer scorer;
  private final ShadowProfile shadowProfile;
  private final int shadowCandidateThreshold;

  public PreferenceRanker(
      SimilarityScorer scorer, ShadowProfile shadowProfile, MatchingProperties properties) {
    this.scorer = scorer;
    this.shadowProfile = shadowProfile;
    this.shadowCandidateThreshold = properties.shadow().candidateThreshold();
  }

  public PreferenceList rank(Submissions submissions, RecencyExclusion recency, long subjectId) {
    final Submission subject = submissions.require(subjectId);
    if (shadowProfile.isShadow(subjectId)) {
      return rankForShadow(submissions, subject);
    }
    final List<Candidate> candidates = new ArrayList<>();
    for (Submission other : submissions.all()) {
      final long otherId = other.userId();
      if (otherId == subjectId
          || shadowProfile.isShadow(otherId)
          || recency.excludes(subjectId, otherId)) {
        continue;
      }
      final OptionalDouble score = scorer.scoreFor(subject, other, submissions.questions());
      if (score.isPresent()) {
        candidates.add(new Candidate(otherId, score.getAsDouble()));
      }
    }
    candidates.sort(ORDER);
    final long shadowId = shadowProfile.shadowUserId();
    if (submissions.contains(shadowId) && candidates.size() < shadowCandidateThreshold) {
      final OptionalDouble shadowScore =
          scorer.scoreFor(subject, submissions.require(shadowId), submissions.questions());
      candidates.add(new Candidate(shadowId, shadowScore.orElse(SimilarityScorer.MIN_SCORE)));
    }
    return new PreferenceList(subjectId, candidates);
  }

  public Map<Long, PreferenceList> rankAll(Submissions submissions, RecencyExclusion recency) {
    final Map<Long, PreferenceList> lists = new LinkedHashMap<>();
    for (Long userId : submissions.userIds()) {
      lists.put(userId, rank(submissions, recency, userId));
    }
    return lists;
  }

  // シャドウは直近除外も閾値も持たず、実ユーザー全員を順位付けする。
  private PreferenceList rankForShadow(Submissions submissions, Submission shadow) {
    final List<Candidate> candidates = new ArrayList<>();
    for (Submission other : submissions.all()) {
      if (other.userId() == shadow.userId()) {
        continue;
      }
      final OptionalDouble score = scorer.scoreFor(shadow, other, submissions.questions());
      candidates.add(new Candidate(other.userId(), score.orElse(SimilarityScorer.MIN_SCORE)));
    }
    candidates.sort(ORDER);
    return new PreferenceList(shadow.userId(), candidates);
  }
}
