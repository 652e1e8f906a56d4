package com.anorby.matching.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.anorby.matching.config.MatchingNatsProperties;
import com.anorby.matching.model.MatchPair;
import com.anorby.matching.model.RoundResult;
import com.anorby.matching.model.StrategyName;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nats.client.JetStream;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.slf4j.MDC;

class NatsMatchRoundEventPublisherTest {

  private static final Instant NOW = Instant.parse("2026-03-01T00:00:05Z");

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final MatchingNatsProperties properties =
      new MatchingNatsProperties("matching.events", "MATCHING_EVENTS", Duration.ofMinutes(2));
  private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

  @AfterEach
  void cleanup() {
    MDC.clear();
  }

  private static RoundResult result(String roundId) {
    return new RoundResult(
        roundId,
        StrategyName.STABLE,
        Instant.parse("2026-03-01T00:00:00Z"),
        5,
        List.of(new MatchPair(10, 12), new MatchPair(11, 13)),
        List.of(14L));
  }

  @Test
  void publishesRoundCompletedEventWithDedupHeader() throws Exception {
    final JetStream jetStream = Mockito.mock(JetStream.class);
    final NatsMatchRoundEventPublisher publisher =
        new NatsMatchRoundEventPublisher(jetStream, objectMapper, properties, clock);
    MDC.put("trace_id", "trace-1");

    publisher.publishRoundCompleted(result("round-1"));

    final ArgumentCaptor<Headers> headers = ArgumentCaptor.forClass(Headers.class);
    final ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
    verify(jetStream).publish(eq("matching.events"), headers.capture(), body.capture());

    final JsonNode event = objectMapper.readTree(body.getValue());
    assertThat(event.get("eventType").asText()).isEqualTo("MATCH_ROUND_COMPLETED");
    assertThat(event.get("roundId").asText()).isEqualTo("round-1");
    assertThat(event.get("strategy").asText()).isEqualTo("STABLE");
    assertThat(event.get("occurredAt").asText()).isEqualTo("2026-03-01T00:00:05Z");
    assertThat(event.get("participantCount").asInt()).isEqualTo(5);
    assertThat(event.get("pairs")).hasSize(2);
    assertThat(event.get("pairs").get(0).get("partnerId").asLong()).isEqualTo(12L);
    assertThat(event.get("unmatchedUserIds").get(0).asLong()).isEqualTo(14L);
    assertThat(event.get("traceId").asText()).isEqualTo("trace-1");
    assertThat(headers.getValue().getFirst("Nats-Msg-Id"))
        .isEqualTo(event.get("eventId").asText());
  }

  @Test
  void throwsWhenRoundIdMissing() {
    final NatsMatchRoundEventPublisher publisher =
        new NatsMatchRoundEventPublisher(
            Mockito.mock(JetStream.class), objectMapper, properties, clock);

    assertThatThrownBy(() -> publisher.publishRoundCompleted(result(" ")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void wrapsIOException() throws Exception {
    final JetStream jetStream = Mockito.mock(JetStream.class);
    when(jetStream.publish(any(String.class), any(Headers.class), any(byte[].class)))
        .thenThrow(new IOException("boom"));
    final NatsMatchRoundEventPublisher publisher =
        new NatsMatchRoundEventPublisher(jetStream, objectMapper, properties, clock);

    assertThatThrownBy(() -> publisher.publishRoundCompleted(result("round-1")))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("failed to publish");
  }

  @Test
  void noopPublisherDoesNothing() {
    final NoopMatchRoundEventPublisher publisher = new NoopMatchRoundEventPublisher();

    publisher.publishRoundCompleted(result("round-1"));
  }
}
