/*
 * どこで: Game Session ドメインモデル
 * 何を: マッチ状態の不変スナップショットを定義する
 * なぜ: 排他区間の外（通知/応答/REST）へ可変な Match を漏らさないため
 */
package com.example.gamesession.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public record MatchView(
    String matchId,
    MatchKind kind,
    Currency currency,
    BigDecimal stake,
    BigDecimal totalPot,
    BigDecimal platformFee,
    BigDecimal winnerPayout,
    PlayerView player1,
    PlayerView player2,
    int currentRound,
    MatchStatus status,
    String winner,
    FinishReason finishReason,
    List<RoundRecord> history,
    Instant createdAt,
    Instant finishedAt,
    boolean settled) {

  public MatchView {
    history = history == null ? List.of() : List.copyOf(history);
  }

  public PlayerView player(SlotPosition position) {
    return position == SlotPosition.PLAYER1 ? player1 : player2;
  }

  /** playerId が占有しているスロットを返す。いなければ null。 */
  public SlotPosition positionOf(String playerId) {
    if (playerId == null) {
      return null;
    }
    if (playerId.equals(player1.playerId())) {
      return SlotPosition.PLAYER1;
    }
    if (playerId.equals(player2.playerId())) {
      return SlotPosition.PLAYER2;
    }
    return null;
  }

  /** ラウンド解決前の相手の手を伏せたスナップショットを返す。 */
  public MatchView withOpponentMoveHidden(String viewerId) {
    final SlotPosition viewer = positionOf(viewerId);
    if (status != MatchStatus.ACTIVE || viewer == null) {
      return this;
    }
    final PlayerView opponent = player(viewer.opponent());
    if (opponent.currentMove() == null) {
      return this;
    }
    final PlayerView hidden =
        new PlayerView(
            opponent.playerId(),
            opponent.account(),
            opponent.wins(),
            null,
            opponent.ready(),
            opponent.stakeDeposited(),
            opponent.connected());
    return new MatchView(
        matchId,
        kind,
        currency,
        stake,
        totalPot,
        platformFee,
        winnerPayout,
        viewer == SlotPosition.PLAYER1 ? player1 : hidden,
        viewer == SlotPosition.PLAYER2 ? player2 : hidden,
        currentRound,
        status,
        winner,
        finishReason,
        history,
        createdAt,
        finishedAt,
        settled);
  }

  public List<String> occupants() {
    final List<String> occupants = new ArrayList<>(2);
    if (player1.playerId() != null) {
      occupants.add(player1.playerId());
    }
    if (player2.playerId() != null) {
      occupants.add(player2.playerId());
    }
    return occupants;
  }

  public boolean bothMovesSubmitted() {
    return player1.currentMove() != null && player2.currentMove() != null;
  }
}
