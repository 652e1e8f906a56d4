package com.anorby.matching.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

@Component
public class MatchingMetrics {

  private final MeterRegistry meterRegistry;
  private final Timer roundDurationTimer;
  private final AtomicLong lastRoundPairs = new AtomicLong(0);
  private final AtomicLong lastRoundUnmatched = new AtomicLong(0);
  private final ConcurrentMap<String, Counter> roundResultCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> triggerSkippedCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> dependencyErrorCounters = new ConcurrentHashMap<>();

  public MatchingMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.roundDurationTimer =
        Timer.builder("mm.round.duration")
            .description("Wall time of one matching round")
            .register(meterRegistry);
    Gauge.builder("mm.round.pairs", lastRoundPairs, AtomicLong::get)
        .description("Pairs produced by the last completed round")
        .register(meterRegistry);
    Gauge.builder("mm.round.unmatched", lastRoundUnmatched, AtomicLong::get)
        .description("Real users left unmatched by the last completed round")
        .register(meterRegistry);
  }

  public void recordRoundResult(String result) {
    roundResultCounters.computeIfAbsent(result, this::registerRoundResultCounter).increment();
  }

  public void recordRoundDuration(Duration duration) {
    if (duration.isNegative()) {
      return;
    }
    roundDurationTimer.record(duration);
  }

  public void updateLastRound(long pairs, long unmatched) {
    lastRoundPairs.set(Math.max(0, pairs));
    lastRoundUnmatched.set(Math.max(0, unmatched));
  }

  public void recordTriggerSkipped(String reason) {
    triggerSkippedCounters.computeIfAbsent(reason, this::registerTriggerSkippedCounter).increment();
  }

  public void recordDependencyError(String errorType) {
    dependencyErrorCounters
        .computeIfAbsent(errorType, this::registerDependencyErrorCounter)
        .increment();
  }

  private Counter registerRoundResultCounter(String result) {
    return Counter.builder("mm.round.total")
        .tags(Tags.of("result", result))
        .register(meterRegistry);
  }

  private Counter registerTriggerSkippedCounter(String reason) {
    return Counter.builder("mm.trigger.skipped.total")
        .tags(Tags.of("reason", reason))
        .register(meterRegistry);
  }

  private Counter registerDependencyErrorCounter(String errorType) {
    return Counter.builder("mm.dependency.error.total")
        .tags(Tags.of("type", errorType))
        .register(meterRegistry);
  }
}
