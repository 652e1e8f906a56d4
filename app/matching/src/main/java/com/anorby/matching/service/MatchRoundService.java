package com.anorby.matching.service;

import com.anorby.common.TraceIds;
import com.anorby.matching.config.MatchingProperties;
import com.anorby.matching.matcher.AssignmentStrategy;
import com.anorby.matching.matcher.AssignmentStrategySelector;
import com.anorby.matching.matcher.MarriageValidator;
import com.anorby.matching.matcher.ShadowProfile;
import com.anorby.matching.model.Marriage;
import com.anorby.matching.model.RecencyExclusion;
import com.anorby.matching.model.RoundResult;
import com.anorby.matching.model.Submissions;
import com.anorby.matching.repository.MatchRecordRepository;
import com.anorby.matching.repository.ShadowUserRepository;
import com.anorby.matching.repository.SubmissionRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * 1 ラウンドを最初から最後まで実行する。状態遷移は呼び出し側 ({@code MatchTrigger}) が持つ。
 *
 * <p>保存までの失敗は例外として呼び出し側へ伝播する。保存後のイベント送信失敗はラウンドの成否に影響しない。
 */
@Service
public class MatchRoundService {

  private static final Logger logger = LoggerFactory.getLogger(MatchRoundService.class);
  private static final String MDC_ROUND_ID = "round_id";

  private final SubmissionRepository submissionRepository;
  private final MatchRecordRepository matchRecordRepository;
  private final ShadowUserRepository shadowUserRepository;
  private final ShadowProfile shadowProfile;
  private final AssignmentStrategySelector strategySelector;
  private final MarriageValidator marriageValidator;
  private final MatchRoundEventPublisher eventPublisher;
  private final MatchingMetrics metrics;
  private final MatchingProperties properties;
  private final Clock clock;

  public MatchRoundService(
      SubmissionRepository submissionRepository,
      MatchRecordRepository matchRecordRepository,
      ShadowUserRepository shadowUserRepository,
      ShadowProfile shadowProfile,
      AssignmentStrategySelector strategySelector,
      MarriageValidator marriageValidator,
      MatchRoundEventPublisher eventPublisher,
      MatchingMetrics metrics,
      MatchingProperties properties,
      Clock clock) {
    this.submissionRepository = submissionRepository;
    this.matchRecordRepository = matchRecordRepository;
    this.shadowUserRepository = shadowUserRepository;
    this.shadowProfile = shadowProfile;
    this.strategySelector = strategySelector;
    this.marriageValidator = marriageValidator;
    this.eventPublisher = eventPublisher;
    this.metrics = metrics;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * 役割: 入力取得からペアリング・検証・保存・イベント送信までを 1 回行う。
   * 動作: シャドウ行を用意し、適格ユーザーと直近マッチを読み、シャドウを振り直して戦略を選ぶ。
   * 検証を通ったペアリングだけを 1 トランザクションで保存する。
   * 前提: 同時に 2 本以上呼ばれないこと (MatchState が保証する)。
   */
  public RoundResult runRound(Instant startedAt) {
    final String roundId = TraceIds.newRoundId(startedAt);
    MDC.put(MDC_ROUND_ID, roundId);
    try {
      final long shadowUserId = shadowProfile.shadowUserId();
      if (shadowUserRepository.ensureShadowUser(shadowUserId)) {
        logger.info("shadow user created shadowUserId={}", shadowUserId);
      }

      final Submissions realUsers =
          submissionRepository.fetchSubmissions(
              properties.minAnsweredQuestions(),
              shadowUserId,
              startedAt.truncatedTo(ChronoUnit.DAYS));
      final RecencyExclusion recency =
          matchRecordRepository.fetchRecencyExclusion(properties.recencyWindowDays(), startedAt);
      final Submissions submissions =
          realUsers.isEmpty()
              ? realUsers
              : realUsers.withParticipant(shadowProfile.roll(realUsers, startedAt));

      final AssignmentStrategy strategy = strategySelector.select(submissions);
      logger.info(
          "match round started roundId={} strategy={} participants={} questions={}",
          roundId,
          strategy.name(),
          realUsers.size(),
          submissions.questions().size());

      final Marriage marriage = strategy.assign(submissions, recency);
      marriageValidator.validate(marriage);

      final Instant matchedOn = Instant.now(clock);
      final int rows = matchRecordRepository.persistMarriage(marriage, matchedOn);

      final List<Long> unmatched =
          marriage.unmatched().stream().filter(userId -> !shadowProfile.isShadow(userId)).toList();
      final RoundResult result =
          new RoundResult(
              roundId, strategy.name(), startedAt, realUsers.size(), marriage.pairs(), unmatched);
      metrics.updateLastRound(result.pairCount(), unmatched.size());
      metrics.recordRoundDuration(Duration.between(startedAt, Instant.now(clock)));
      logger.info(
          "match round completed roundId={} strategy={} pairs={} unmatched={} rows={}",
          roundId,
          strategy.name(),
          result.pairCount(),
          unmatched.size(),
          rows);

      publish(result);
      return result;
    } finally {
      MDC.remove(MDC_ROUND_ID);
    }
  }

  private void publish(RoundResult result) {
    try {
      eventPublisher.publishRoundCompleted(result);
    } catch (RuntimeException ex) {
      // 保存はコミット済みなのでラウンドは成功扱いのまま残す
      logger.warn("match round event publish failed roundId={}", result.roundId(), ex);
      metrics.recordDependencyError("event_publish");
    }
  }
}
