package com.example.gamesession.engine;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.gamesession.model.Currency;
import com.example.gamesession.model.MatchmakingTicket;
import java.math.BigDecimal;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class MatchmakingQueueTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  @Test
  void pollMatchingReturnsOldestCompatibleTicket() {
    final MatchmakingQueue queue = new MatchmakingQueue();
    queue.enqueue(ticket("p1", Currency.SOL, "0.05"));
    queue.enqueue(ticket("p2", Currency.POINTS, "100"));
    queue.enqueue(ticket("p3", Currency.POINTS, "100"));

    assertThat(queue.pollMatching(Currency.POINTS, new BigDecimal("100.0"), "p9"))
        .get()
        .extracting(MatchmakingTicket::playerId)
        .isEqualTo("p2");
    assertThat(queue.size()).isEqualTo(2);
  }

  @Test
  void neverPairsTicketWithItsOwner() {
    final MatchmakingQueue queue = new MatchmakingQueue();
    queue.enqueue(ticket("p1", Currency.POINTS, "100"));

    assertThat(queue.pollMatching(Currency.POINTS, BigDecimal.valueOf(100), "p1")).isEmpty();
    assertThat(queue.contains("p1")).isTrue();
  }

  @Test
  void enqueueReplacesExistingTicketAndMovesItToTail() {
    final MatchmakingQueue queue = new MatchmakingQueue();
    queue.enqueue(ticket("p1", Currency.POINTS, "100"));
    queue.enqueue(ticket("p2", Currency.POINTS, "100"));
    queue.enqueue(ticket("p1", Currency.SOL, "0.01"));

    assertThat(queue.size()).isEqualTo(2);
    assertThat(queue.snapshot())
        .extracting(MatchmakingTicket::playerId)
        .containsExactly("p2", "p1");
    assertThat(queue.snapshot().get(1).currency()).isEqualTo(Currency.SOL);
  }

  @Test
  void removeReportsWhetherTicketExisted() {
    final MatchmakingQueue queue = new MatchmakingQueue();
    queue.enqueue(ticket("p1", Currency.POINTS, "100"));

    assertThat(queue.remove("p1")).isTrue();
    assertThat(queue.remove("p1")).isFalse();
  }

  private static MatchmakingTicket ticket(String playerId, Currency currency, String stake) {
    return new MatchmakingTicket(
        playerId, "s-" + playerId, new BigDecimal(stake), currency, null, NOW);
  }
}
