package com.example.gamesession.service;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class GameSessionMetricsTest {

  @Test
  void updatesGaugesAndCounters() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final GameSessionMetrics metrics = new GameSessionMetrics(registry);

    metrics.updateMatchCount("ACTIVE", 4);
    metrics.updateQueueDepth(2);
    metrics.updateLiveTimers(3);
    metrics.recordRoundResolved("player1");
    metrics.recordRoundResolved("player1");
    metrics.recordAutoMoves(2);
    metrics.recordMatchFinished("THREE_WINS", Duration.ofSeconds(40));
    metrics.recordSettlement("success");
    metrics.recordReconciliation();
    metrics.recordDependencyError("profile");

    assertThat(registry.get("game.matches").tag("status", "ACTIVE").gauge().value())
        .isEqualTo(4.0);
    assertThat(registry.get("game.queue.depth").gauge().value()).isEqualTo(2.0);
    assertThat(registry.get("game.timer.live").gauge().value()).isEqualTo(3.0);
    assertThat(
            registry.get("game.round.resolved.total").tag("outcome", "player1").counter().count())
        .isEqualTo(2.0);
    assertThat(registry.get("game.round.auto_move.total").counter().count()).isEqualTo(2.0);
    assertThat(
            registry
                .get("game.match.finished.total")
                .tag("reason", "THREE_WINS")
                .counter()
                .count())
        .isEqualTo(1.0);
    assertThat(registry.get("game.match.duration").timer().count()).isEqualTo(1L);
    assertThat(registry.get("game.settlement.total").tag("result", "success").counter().count())
        .isEqualTo(1.0);
    assertThat(registry.get("game.registry.reconciliation.total").counter().count())
        .isEqualTo(1.0);
    assertThat(
            registry.get("game.dependency.error.total").tag("type", "profile").counter().count())
        .isEqualTo(1.0);
  }

  @Test
  void clampsNegativeValuesAndIgnoresMissingDuration() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final GameSessionMetrics metrics = new GameSessionMetrics(registry);

    metrics.updateQueueDepth(-5);
    metrics.updateMatchCount("FINISHED", -1);
    metrics.recordAutoMoves(0);
    metrics.recordMatchFinished("FORFEIT", null);
    metrics.recordMatchFinished("FORFEIT", Duration.ofSeconds(-1));

    assertThat(registry.get("game.queue.depth").gauge().value()).isZero();
    assertThat(registry.get("game.matches").tag("status", "FINISHED").gauge().value()).isZero();
    assertThat(registry.get("game.round.auto_move.total").counter().count()).isZero();
    assertThat(
            registry.get("game.match.finished.total").tag("reason", "FORFEIT").counter().count())
        .isEqualTo(2.0);
    assertThat(registry.get("game.match.duration").timer().count()).isZero();
  }
}
