/*
 * どこで: Matching 設定
 * 何を: ラウンド間隔・適格条件・アルゴリズム選択・シャドウ設定を保持する
 * なぜ: 環境差分をコード外へ出し、テストで上書きしやすくするため
 */
package com.anorby.matching.config;

import com.anorby.matching.model.StrategyName;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "matching")
public record MatchingProperties(
    Boolean enabled,
    Duration interval,
    @PositiveOrZero Integer recencyWindowDays,
    Integer minSharedAnswers,
    @PositiveOrZero Integer minAnsweredQuestions,
    StrategyName strategy,
    @DecimalMin("0.0") @DecimalMax("0.5") Double skewThreshold,
    Duration failureRetryBackoff,
    Duration stateReportInterval,
    Integer historyLimit,
    Shadow shadow,
    LocalSearch localSearch) {

  public MatchingProperties {
    enabled = enabled == null ? Boolean.TRUE : enabled;
    interval = interval == null ? Duration.ofHours(24) : interval;
    recencyWindowDays = recencyWindowDays == null ? 28 : recencyWindowDays;
    minSharedAnswers = minSharedAnswers == null ? 1 : Math.max(1, minSharedAnswers);
    minAnsweredQuestions = minAnsweredQuestions == null ? 10 : minAnsweredQuestions;
    strategy = strategy == null ? StrategyName.AUTO : strategy;
    skewThreshold = skewThreshold == null ? 0.2 : skewThreshold;
    failureRetryBackoff =
        failureRetryBackoff == null ? Duration.ofMinutes(5) : failureRetryBackoff;
    stateReportInterval = stateReportInterval == null ? Duration.ofHours(1) : stateReportInterval;
    historyLimit = historyLimit == null ? 50 : Math.max(1, historyLimit);
    shadow = shadow == null ? new Shadow(null, null, null) : shadow;
    localSearch = localSearch == null ? new LocalSearch(null, null) : localSearch;
  }

  @AssertTrue(message = "matching.interval must be positive")
  public boolean isIntervalPositive() {
    return isPositiveDuration(interval);
  }

  @AssertTrue(message = "matching.state-report-interval must be positive")
  public boolean isStateReportIntervalPositive() {
    // @Scheduled の fixedDelay に使うため 0 以下は起動時に弾く
    return isPositiveDuration(stateReportInterval);
  }

  private static boolean isPositiveDuration(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }

  /**
   * シャドウ参加者の設定。user-id は管理者 principal とは別の値として扱う。
   *
   * <p>users.id の identity 採番 (1 始まり) と衝突しないよう、既定値は負の ID にする。
   */
  public record Shadow(Long userId, Long seed, Integer candidateThreshold) {
    public Shadow {
      userId = userId == null ? -1L : userId;
      seed = seed == null ? 0x5eedL : seed;
      candidateThreshold = candidateThreshold == null ? 50 : candidateThreshold;
    }
  }

  public record LocalSearch(Integer maxPasses, Integer populationThreshold) {
    public LocalSearch {
      maxPasses = maxPasses == null ? 100 : Math.max(1, maxPasses);
      populationThreshold = populationThreshold == null ? 2000 : populationThreshold;
    }
  }
}
