/*
 * どこで: Game Session ドメインモデル
 * 何を: 1 マッチの可変状態（座席/ラウンド/勝敗/清算済みフラグ）を保持する
 * なぜ: 状態遷移の制約を 1 か所で強制するため
 */
package com.example.gamesession.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * マッチ集約。
 *
 * <p>スレッドセーフではない。SessionRegistry のロック保持中にのみ読み書きし、外部へは {@link #toView()} のスナップショットを渡す。
 */
public final class Match {

  private final String id;
  private final MatchKind kind;
  private final StakeTerms terms;
  private final Instant createdAt;
  private final PlayerSlot player1 = new PlayerSlot();
  private final PlayerSlot player2 = new PlayerSlot();
  private final List<RoundRecord> history = new ArrayList<>();

  private MatchStatus status = MatchStatus.WAITING_FOR_OPPONENT;
  private int currentRound = 1;
  private String winner;
  private FinishReason finishReason;
  private Instant finishedAt;
  private boolean settled;

  public Match(String id, MatchKind kind, StakeTerms terms, Instant createdAt) {
    this.id = id;
    this.kind = kind;
    this.terms = terms;
    this.createdAt = createdAt;
  }

  public PlayerSlot slot(SlotPosition position) {
    return position == SlotPosition.PLAYER1 ? player1 : player2;
  }

  public Optional<SlotPosition> positionOf(String playerId) {
    if (playerId == null) {
      return Optional.empty();
    }
    if (playerId.equals(player1.playerId())) {
      return Optional.of(SlotPosition.PLAYER1);
    }
    if (playerId.equals(player2.playerId())) {
      return Optional.of(SlotPosition.PLAYER2);
    }
    return Optional.empty();
  }

  public boolean contains(String playerId) {
    return positionOf(playerId).isPresent();
  }

  public boolean hasOpenSlot() {
    return !player1.isOccupied() || !player2.isOccupied();
  }

  public boolean isEmpty() {
    return !player1.isOccupied() && !player2.isOccupied();
  }

  public boolean isLive() {
    return status != MatchStatus.FINISHED;
  }

  public List<String> occupants() {
    final List<String> occupants = new ArrayList<>(2);
    if (player1.isOccupied()) {
      occupants.add(player1.playerId());
    }
    if (player2.isOccupied()) {
      occupants.add(player2.playerId());
    }
    return occupants;
  }

  /** WAITING_FOR_OPPONENT から ACTIVE へ遷移し、ラウンド 1 を開始状態にする。 */
  public void activate() {
    transitionTo(MatchStatus.ACTIVE);
    currentRound = 1;
  }

  public void finish(String winnerPlayerId, FinishReason reason, Instant now) {
    transitionTo(MatchStatus.FINISHED);
    this.winner = winnerPlayerId;
    this.finishReason = reason;
    this.finishedAt = now;
  }

  public void nextRound() {
    if (status != MatchStatus.ACTIVE) {
      throw new IllegalStateException("match is not active: " + id);
    }
    currentRound++;
    player1.resetRound();
    player2.resetRound();
  }

  public void appendHistory(RoundRecord record) {
    history.add(record);
  }

  /** 清算済みフラグを立てる。既に立っていれば false を返し、呼び出し側は清算を行わない。 */
  public boolean markSettled() {
    if (settled) {
      return false;
    }
    settled = true;
    return true;
  }

  private void transitionTo(MatchStatus next) {
    if (!status.canAdvanceTo(next)) {
      throw new IllegalStateException(
          "illegal status transition " + status + " -> " + next + " for match " + id);
    }
    status = next;
  }

  public String id() {
    return id;
  }

  public MatchKind kind() {
    return kind;
  }

  public Currency currency() {
    return terms.currency();
  }

  public BigDecimal stake() {
    return terms.stake();
  }

  public StakeTerms terms() {
    return terms;
  }

  public MatchStatus status() {
    return status;
  }

  public int currentRound() {
    return currentRound;
  }

  public String winner() {
    return winner;
  }

  public FinishReason finishReason() {
    return finishReason;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public Instant finishedAt() {
    return finishedAt;
  }

  public boolean settled() {
    return settled;
  }

  public int completedRounds() {
    return history.size();
  }

  public MatchView toView() {
    return new MatchView(
        id,
        kind,
        terms.currency(),
        terms.stake(),
        terms.totalPot(),
        terms.platformFee(),
        terms.winnerPayout(),
        player1.toView(),
        player2.toView(),
        currentRound,
        status,
        winner,
        finishReason,
        history,
        createdAt,
        finishedAt,
        settled);
  }
}
