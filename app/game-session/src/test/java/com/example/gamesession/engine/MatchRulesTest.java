package com.example.gamesession.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.gamesession.model.Currency;
import com.example.gamesession.model.FinishReason;
import com.example.gamesession.model.Match;
import com.example.gamesession.model.MatchKind;
import com.example.gamesession.model.MatchStatus;
import com.example.gamesession.model.Move;
import com.example.gamesession.model.RoundOutcome;
import com.example.gamesession.model.RoundResult;
import com.example.gamesession.model.SlotPosition;
import java.math.BigDecimal;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class MatchRulesTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
  private final StakePolicy stakePolicy = new StakePolicy(BigDecimal.valueOf(100));

  @Test
  void seatFillsSlotsInOrderAndActivatesWhenFull() {
    final Match match = pointsMatch();

    assertThat(MatchRules.seat(match, "p1", "s1", "a1")).isEqualTo(SlotPosition.PLAYER1);
    assertThat(match.status()).isEqualTo(MatchStatus.WAITING_FOR_OPPONENT);
    assertThat(MatchRules.seat(match, "p2", "s2", "a2")).isEqualTo(SlotPosition.PLAYER2);
    assertThat(match.status()).isEqualTo(MatchStatus.ACTIVE);
    assertThat(match.currentRound()).isEqualTo(1);
  }

  @Test
  void seatRejectsThirdPlayer() {
    final Match match = pointsMatch();
    MatchRules.seat(match, "p1", "s1", "a1");
    MatchRules.seat(match, "p2", "s2", "a2");

    assertThatThrownBy(() -> MatchRules.seat(match, "p3", "s3", "a3"))
        .isInstanceOf(GameSessionException.class)
        .extracting("code")
        .isEqualTo(GameErrorCode.MATCH_FULL);
  }

  @Test
  void reseatingKeepsPositionAndWinsButClearsPendingMove() {
    final Match match = pointsMatch();
    MatchRules.seat(match, "p1", "s1", "a1");
    MatchRules.seat(match, "p2", "s2", "a2");
    playRound(match, Move.ROCK, Move.SCISSORS);
    MatchRules.advanceRound(match);
    MatchRules.recordMove(match, SlotPosition.PLAYER1, Move.PAPER);

    final SlotPosition position = MatchRules.seat(match, "p1", "s1-new", null);

    assertThat(position).isEqualTo(SlotPosition.PLAYER1);
    assertThat(match.slot(position).wins()).isEqualTo(1);
    assertThat(match.slot(position).hasMove()).isFalse();
    assertThat(match.slot(position).sessionHandle()).isEqualTo("s1-new");
    assertThat(match.slot(position).account()).isEqualTo("a1");
  }

  @Test
  void solSeatMarksStakeDeposited() {
    final Match match =
        new Match(
            "sol-1",
            MatchKind.PUBLIC,
            stakePolicy.terms(Currency.SOL, new BigDecimal("0.01")),
            NOW);

    MatchRules.seat(match, "p1", "s1", "a1");

    assertThat(match.slot(SlotPosition.PLAYER1).stakeDeposited()).isTrue();
  }

  @Test
  void recordMoveRequiresActiveMatch() {
    final Match match = pointsMatch();
    MatchRules.seat(match, "p1", "s1", "a1");

    assertThatThrownBy(() -> MatchRules.recordMove(match, SlotPosition.PLAYER1, Move.ROCK))
        .isInstanceOf(GameSessionException.class)
        .extracting("code")
        .isEqualTo(GameErrorCode.MATCH_NOT_STARTED);
  }

  @Test
  void drawDoesNotAwardWinsAndKeepsMovesUntilAdvance() {
    final Match match = activeMatch();

    final RoundResult result = playRound(match, Move.PAPER, Move.PAPER);

    assertThat(result.roundWinner()).isEqualTo(RoundOutcome.DRAW);
    assertThat(result.player1Wins()).isZero();
    assertThat(result.player2Wins()).isZero();
    assertThat(match.slot(SlotPosition.PLAYER1).currentMove()).isEqualTo(Move.PAPER);

    assertThat(MatchRules.advanceRound(match)).isTrue();
    assertThat(match.currentRound()).isEqualTo(2);
    assertThat(MatchRules.bothMovesSubmitted(match)).isFalse();
  }

  @Test
  void thirdWinFinishesMatch() {
    final Match match = activeMatch();
    RoundResult last = null;
    for (int i = 0; i < 3; i++) {
      last = playRound(match, Move.SCISSORS, Move.PAPER);
      MatchRules.advanceRound(match);
    }

    assertThat(last.matchFinished()).isTrue();
    assertThat(last.matchWinner()).isEqualTo(SlotPosition.PLAYER1);
    assertThat(last.round()).isEqualTo(3);
    assertThat(match.status()).isEqualTo(MatchStatus.FINISHED);
    assertThat(match.finishReason()).isEqualTo(FinishReason.COMPLETED);
    assertThat(match.winner()).isEqualTo("p1");
    assertThat(match.completedRounds()).isEqualTo(3);
    assertThat(match.currentRound()).isEqualTo(3);
  }

  @Test
  void advanceRoundIsNoOpAfterFinish() {
    final Match match = activeMatch();
    match.finish("p1", FinishReason.FORFEIT_LEFT, NOW);

    assertThat(MatchRules.advanceRound(match)).isFalse();
    assertThatThrownBy(() -> MatchRules.recordMove(match, SlotPosition.PLAYER2, Move.ROCK))
        .isInstanceOf(GameSessionException.class)
        .extracting("code")
        .isEqualTo(GameErrorCode.MATCH_FINISHED);
  }

  private Match pointsMatch() {
    return new Match(
        "m-1", MatchKind.PUBLIC, stakePolicy.terms(Currency.POINTS, BigDecimal.valueOf(100)), NOW);
  }

  private Match activeMatch() {
    final Match match = pointsMatch();
    MatchRules.seat(match, "p1", "s1", "a1");
    MatchRules.seat(match, "p2", "s2", "a2");
    return match;
  }

  private static RoundResult playRound(Match match, Move player1, Move player2) {
    MatchRules.recordMove(match, SlotPosition.PLAYER1, player1);
    MatchRules.recordMove(match, SlotPosition.PLAYER2, player2);
    return MatchRules.processRound(match, NOW);
  }
}
