/*
 * どこで: Game Session エンジン
 * 何を: 2 つの手から 1 ラウンドの勝敗を決める
 * なぜ: 直接投入とタイムアウト自動投入の両経路で同じ判定を使うため
 */
package com.example.gamesession.engine;

import com.example.gamesession.model.Move;
import com.example.gamesession.model.RoundOutcome;

public final class MoveResolver {

  private MoveResolver() {}

  /**
   * 役割: player1/player2 の手から勝者を返す。
   * 動作: 同じ手は DRAW、それ以外は rock > scissors > paper > rock の循環で判定する。
   * 前提: どちらかが null の場合は INVALID_MOVE を送出する。
   */
  public static RoundOutcome resolve(Move player1Move, Move player2Move) {
    if (player1Move == null || player2Move == null) {
      throw new GameSessionException(GameErrorCode.INVALID_MOVE, "both moves are required");
    }
    if (player1Move == player2Move) {
      return RoundOutcome.DRAW;
    }
    return player1Move.beats(player2Move) ? RoundOutcome.PLAYER1 : RoundOutcome.PLAYER2;
  }

  /** 文字列の手を解決する。正規形以外は INVALID_MOVE。 */
  public static RoundOutcome resolve(String player1Move, String player2Move) {
    return resolve(parse(player1Move), parse(player2Move));
  }

  public static Move parse(String move) {
    try {
      return Move.fromValue(move);
    } catch (IllegalArgumentException ex) {
      throw new GameSessionException(GameErrorCode.INVALID_MOVE, "invalid move: " + move);
    }
  }
}
