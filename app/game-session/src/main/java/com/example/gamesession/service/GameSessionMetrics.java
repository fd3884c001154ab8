package com.example.gamesession.service;

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
public class GameSessionMetrics {

  private final MeterRegistry meterRegistry;
  private final Timer matchDurationTimer;
  private final AtomicLong queueDepth = new AtomicLong(0);
  private final AtomicLong liveTimers = new AtomicLong(0);
  private final ConcurrentMap<String, AtomicLong> matchesByStatus = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> roundCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> finishCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> settlementCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> dependencyErrorCounters = new ConcurrentHashMap<>();
  private final Counter autoMoveCounter;
  private final Counter reconciliationCounter;

  public GameSessionMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.matchDurationTimer =
        Timer.builder("game.match.duration")
            .description("Time from match creation to finish")
            .register(meterRegistry);
    this.autoMoveCounter =
        Counter.builder("game.round.auto_move.total")
            .description("Moves assigned by the round timer")
            .register(meterRegistry);
    this.reconciliationCounter =
        Counter.builder("game.registry.reconciliation.total")
            .description("Moves located by scanning instead of the player map")
            .register(meterRegistry);
    Gauge.builder("game.queue.depth", queueDepth, AtomicLong::get).register(meterRegistry);
    Gauge.builder("game.timer.live", liveTimers, AtomicLong::get).register(meterRegistry);
  }

  public void updateMatchCount(String status, long count) {
    final AtomicLong value = matchesByStatus.computeIfAbsent(status, this::registerMatchGauge);
    value.set(Math.max(0, count));
  }

  public void updateQueueDepth(long depth) {
    queueDepth.set(Math.max(0, depth));
  }

  public void updateLiveTimers(long count) {
    liveTimers.set(Math.max(0, count));
  }

  public void recordRoundResolved(String outcome) {
    roundCounters.computeIfAbsent(outcome, this::registerRoundCounter).increment();
  }

  public void recordAutoMoves(int count) {
    if (count <= 0) {
      return;
    }
    autoMoveCounter.increment(count);
  }

  public void recordMatchFinished(String reason, Duration duration) {
    finishCounters.computeIfAbsent(reason, this::registerFinishCounter).increment();
    if (duration != null && !duration.isNegative()) {
      matchDurationTimer.record(duration);
    }
  }

  public void recordSettlement(String result) {
    settlementCounters.computeIfAbsent(result, this::registerSettlementCounter).increment();
  }

  public void recordReconciliation() {
    reconciliationCounter.increment();
  }

  public void recordDependencyError(String errorType) {
    dependencyErrorCounters
        .computeIfAbsent(errorType, this::registerDependencyErrorCounter)
        .increment();
  }

  private AtomicLong registerMatchGauge(String status) {
    final AtomicLong value = new AtomicLong(0);
    Gauge.builder("game.matches", value, AtomicLong::get)
        .tags(Tags.of("status", status))
        .register(meterRegistry);
    return value;
  }

  private Counter registerRoundCounter(String outcome) {
    return Counter.builder("game.round.resolved.total")
        .tags(Tags.of("outcome", outcome))
        .register(meterRegistry);
  }

  private Counter registerFinishCounter(String reason) {
    return Counter.builder("game.match.finished.total")
        .tags(Tags.of("reason", reason))
        .register(meterRegistry);
  }

  private Counter registerSettlementCounter(String result) {
    return Counter.builder("game.settlement.total")
        .tags(Tags.of("result", result))
        .register(meterRegistry);
  }

  private Counter registerDependencyErrorCounter(String errorType) {
    return Counter.builder("game.dependency.error.total")
        .tags(Tags.of("type", errorType))
        .register(meterRegistry);
  }
}
