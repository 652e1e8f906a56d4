package com.anorby.matching.service;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class MatchingMetricsTest {

  @Test
  void updatesRoundGaugesAndCounters() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final MatchingMetrics metrics = new MatchingMetrics(registry);

    metrics.recordRoundResult("completed");
    metrics.recordRoundDuration(Duration.ofSeconds(2));
    metrics.updateLastRound(7, 3);
    metrics.recordTriggerSkipped("already_running");
    metrics.recordDependencyError("event_publish");

    assertThat(registry.get("mm.round.total").tag("result", "completed").counter().count())
        .isEqualTo(1.0);
    assertThat(registry.get("mm.round.duration").timer().count()).isEqualTo(1L);
    assertThat(registry.get("mm.round.pairs").gauge().value()).isEqualTo(7.0);
    assertThat(registry.get("mm.round.unmatched").gauge().value()).isEqualTo(3.0);
    assertThat(
            registry
                .get("mm.trigger.skipped.total")
                .tag("reason", "already_running")
                .counter()
                .count())
        .isEqualTo(1.0);
    assertThat(
            registry.get("mm.dependency.error.total").tag("type", "event_publish").counter().count())
        .isEqualTo(1.0);
  }

  @Test
  void ignoresNegativeDurationAndClampsGauges() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final MatchingMetrics metrics = new MatchingMetrics(registry);

    metrics.recordRoundDuration(Duration.ofSeconds(-1));
    metrics.updateLastRound(-5, -1);

    assertThat(registry.get("mm.round.duration").timer().count()).isZero();
    assertThat(registry.get("mm.round.pairs").gauge().value()).isZero();
    assertThat(registry.get("mm.round.unmatched").gauge().value()).isZero();
  }
}
