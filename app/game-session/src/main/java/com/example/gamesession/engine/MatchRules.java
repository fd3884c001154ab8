/*
 * どこで: Game Session エンジン
 * 何を: Match の着席/手の記録/ラウンド処理/ラウンド進行の規則を実装する
 * なぜ: 状態遷移の規則をレジストリの排他制御から切り離して単体で検証するため
 */
package com.example.gamesession.engine;

import com.example.gamesession.model.Currency;
import com.example.gamesession.model.FinishReason;
import com.example.gamesession.model.Match;
import com.example.gamesession.model.MatchStatus;
import com.example.gamesession.model.Move;
import com.example.gamesession.model.PlayerSlot;
import com.example.gamesession.model.RoundOutcome;
import com.example.gamesession.model.RoundRecord;
import com.example.gamesession.model.RoundResult;
import com.example.gamesession.model.SlotPosition;
import java.time.Instant;
import java.util.Optional;

public final class MatchRules {

  public static final int WINNING_SCORE = 3;

  private MatchRules() {}

  /**
   * 役割: プレイヤーを空き座席へ着席させる。
   * 動作: 既に着席済みなら同じ座席を再取得し（手と ready はクリア）、そうでなければ player1、player2 の順に埋める。
   *       両座席が埋まった WAITING のマッチは ACTIVE へ遷移する。
   * 前提: 呼び出し側で FINISHED / ACTIVE の検証を済ませていること。
   */
  public static SlotPosition seat(
      Match match, String playerId, String sessionHandle, String account) {
    final Optional<SlotPosition> existing = match.positionOf(playerId);
    final SlotPosition position;
    if (existing.isPresent()) {
      position = existing.get();
      match.slot(position).reattach(sessionHandle, account);
    } else if (!match.slot(SlotPosition.PLAYER1).isOccupied()) {
      position = SlotPosition.PLAYER1;
      match.slot(position).occupy(playerId, sessionHandle, account);
    } else if (!match.slot(SlotPosition.PLAYER2).isOccupied()) {
      position = SlotPosition.PLAYER2;
      match.slot(position).occupy(playerId, sessionHandle, account);
    } else {
      throw new GameSessionException(GameErrorCode.MATCH_FULL, "match is full: " + match.id());
    }
    if (match.currency() == Currency.SOL) {
      match.slot(position).markStakeDeposited();
    }
    if (match.status() == MatchStatus.WAITING_FOR_OPPONENT && !match.hasOpenSlot()) {
      match.activate();
    }
    return position;
  }

  /** 手を記録する。同一ラウンド内の再投入は上書き。 */
  public static void recordMove(Match match, SlotPosition position, Move move) {
    requireActive(match);
    match.slot(position).submit(move);
  }

  public static boolean bothMovesSubmitted(Match match) {
    return match.slot(SlotPosition.PLAYER1).hasMove() && match.slot(SlotPosition.PLAYER2).hasMove();
  }

  /**
   * 役割: 現在ラウンドを解決する。
   * 動作: 現在のラウンド番号で履歴を追加し、勝者の勝数を加算する。WINNING_SCORE 到達で FINISHED へ遷移する。
   *       手はクリアしない（ラウンド進行時にクリアする）。
   * 前提: ACTIVE かつ両者の手が揃っていること。
   */
  public static RoundResult processRound(Match match, Instant now) {
    requireActive(match);
    final PlayerSlot player1 = match.slot(SlotPosition.PLAYER1);
    final PlayerSlot player2 = match.slot(SlotPosition.PLAYER2);
    if (!player1.hasMove() || !player2.hasMove()) {
      throw new IllegalStateException("both moves are required to process round of " + match.id());
    }
    final int round = match.currentRound();
    final RoundOutcome outcome = MoveResolver.resolve(player1.currentMove(), player2.currentMove());
    match.appendHistory(
        new RoundRecord(round, player1.currentMove(), player2.currentMove(), outcome, now));

    SlotPosition matchWinner = null;
    if (outcome != RoundOutcome.DRAW) {
      final SlotPosition roundWinner =
          outcome == RoundOutcome.PLAYER1 ? SlotPosition.PLAYER1 : SlotPosition.PLAYER2;
      final PlayerSlot winnerSlot = match.slot(roundWinner);
      winnerSlot.recordWin();
      if (winnerSlot.wins() >= WINNING_SCORE) {
        matchWinner = roundWinner;
        match.finish(winnerSlot.playerId(), FinishReason.COMPLETED, now);
      }
    }
    return new RoundResult(
        round,
        player1.currentMove(),
        player2.currentMove(),
        outcome,
        matchWinner,
        player1.wins(),
        player2.wins(),
        matchWinner != null);
  }

  /** 次ラウンドへ進める。ACTIVE 以外では何もしない。 */
  public static boolean advanceRound(Match match) {
    if (match.status() != MatchStatus.ACTIVE) {
      return false;
    }
    match.nextRound();
    return true;
  }

  private static void requireActive(Match match) {
    if (match.status() == MatchStatus.FINISHED) {
      throw new GameSessionException(
          GameErrorCode.MATCH_FINISHED, "match already finished: " + match.id());
    }
    if (match.status() != MatchStatus.ACTIVE) {
      throw new GameSessionException(
          GameErrorCode.MATCH_NOT_STARTED, "match has not started: " + match.id());
    }
  }
}
