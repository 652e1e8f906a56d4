/*
 * どこで: Matching サービス層
 * 何を: NATS 無効時のダミー publisher を提供する
 * なぜ: ローカルやテストで NATS なしでもラウンドを完走させるため
 */
package com.anorby.matching.service;

import com.anorby.matching.model.RoundResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "nats.enabled", havingValue = "false")
public class NoopMatchRoundEventPublisher implements MatchRoundEventPublisher {

  private static final Logger logger = LoggerFactory.getLogger(NoopMatchRoundEventPublisher.class);

  @Override
  public void publishRoundCompleted(RoundResult result) {
    logger.debug("nats disabled, round event dropped roundId={}", result.roundId());
  }
}
