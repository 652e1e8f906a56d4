package com.anorby.matching.service;

import com.anorby.common.TraceIds;
import com.anorby.common.event.MatchRoundEventPayload;
import com.anorby.matching.config.MatchingNatsProperties;
import com.anorby.matching.model.MatchPair;
import com.anorby.matching.model.RoundResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsMatchRoundEventPublisher implements MatchRoundEventPublisher {

  static final String EVENT_TYPE_ROUND_COMPLETED = "MATCH_ROUND_COMPLETED";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "JetStream は NATS 接続に紐づく共有コンポーネントで防御的コピーが不可能なため")
  private final JetStream jetStream;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  private final MatchingNatsProperties properties;
  private final Clock clock;

  public NatsMatchRoundEventPublisher(
      JetStream jetStream,
      ObjectMapper objectMapper,
      MatchingNatsProperties properties,
      Clock clock) {
    this.jetStream = jetStream;
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.clock = clock;
  }

  @Override
  public void publishRoundCompleted(RoundResult result) {
    if (result == null || result.roundId() == null || result.roundId().isBlank()) {
      throw new IllegalArgumentException("roundId is required");
    }
    final String eventId = UUID.randomUUID().toString();
    final List<MatchRoundEventPayload.MatchedPair> pairs =
        result.pairs().stream().map(NatsMatchRoundEventPublisher::toMatchedPair).toList();
    final MatchRoundEventPayload payload =
        new MatchRoundEventPayload(
            eventId,
            EVENT_TYPE_ROUND_COMPLETED,
            Instant.now(clock).toString(),
            result.roundId(),
            result.strategy().name(),
            result.participantCount(),
            pairs,
            result.unmatchedUserIds(),
            resolveTraceId());
    final byte[] body;
    try {
      body = objectMapper.writeValueAsBytes(payload);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize match round event", ex);
    }
    final Headers headers = new Headers();
    headers.add("Nats-Msg-Id", eventId);
    try {
      jetStream.publish(properties.subject(), headers, body);
    } catch (IOException | JetStreamApiException ex) {
      throw new IllegalStateException("failed to publish match round event", ex);
    }
  }

  private static MatchRoundEventPayload.MatchedPair toMatchedPair(MatchPair pair) {
    return new MatchRoundEventPayload.MatchedPair(pair.userId(), pair.partnerId());
  }

  private String resolveTraceId() {
    final String traceId = MDC.get("trace_id");
    if (traceId != null && !traceId.isBlank()) {
      return traceId;
    }
    return TraceIds.newTraceId();
  }
}
