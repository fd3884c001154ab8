/*
 * どこで: Game Session ドメインモデル
 * 何を: ランダムマッチ待機中のチケットを表現する
 * なぜ: キュー内でのペアリング条件（stake/currency）を保持するため
 */
package com.example.gamesession.model;

import java.math.BigDecimal;
import java.time.Instant;

public record MatchmakingTicket(
    String playerId,
    String sessionHandle,
    BigDecimal stake,
    Currency currency,
    String account,
    Instant enqueuedAt) {

  public boolean pairsWith(Currency otherCurrency, BigDecimal otherStake, String otherPlayerId) {
    return !playerId.equals(otherPlayerId)
        && currency == otherCurrency
        && stake.compareTo(otherStake) == 0;
  }
}
