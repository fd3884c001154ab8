/*
 * どこで: Game Session ドメインモデル
 * 何を: マッチ状態を定義する
 * なぜ: WAITING_FOR_OPPONENT -> ACTIVE -> FINISHED の一方向遷移を表現するため
 */
package com.example.gamesession.model;

public enum MatchStatus {
  WAITING_FOR_OPPONENT,
  ACTIVE,
  FINISHED;

  public boolean canAdvanceTo(MatchStatus next) {
    return next.ordinal() > ordinal();
  }
}
