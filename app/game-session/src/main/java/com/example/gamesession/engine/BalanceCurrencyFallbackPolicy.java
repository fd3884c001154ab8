/*
 * どこで: Game Session エンジン
 * 何を: points の残高が足りない場合に sol の小額ステークへ切り替える
 * なぜ: 残高不足のプレイヤーもランダムマッチへ参加できるようにするため
 */
package com.example.gamesession.engine;

import com.example.gamesession.model.Currency;
import com.example.gamesession.model.StakeRequest;
import java.math.BigDecimal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class BalanceCurrencyFallbackPolicy implements CurrencyFallbackPolicy {

  private static final Logger logger = LoggerFactory.getLogger(BalanceCurrencyFallbackPolicy.class);

  private final BalanceGuard balanceGuard;
  private final BigDecimal pointsStake;
  private final BigDecimal fallbackSolStake;
  private final boolean fallbackEnabled;

  public BalanceCurrencyFallbackPolicy(
      BalanceGuard balanceGuard,
      BigDecimal pointsStake,
      BigDecimal fallbackSolStake,
      boolean fallbackEnabled) {
    this.balanceGuard = balanceGuard;
    this.pointsStake = pointsStake;
    this.fallbackSolStake = fallbackSolStake;
    this.fallbackEnabled = fallbackEnabled;
  }

  @Override
  public StakeRequest resolve(StakeRequest requested, String account) {
    if (requested.currency() != Currency.POINTS) {
      return requested;
    }
    // points のランダムマッチは常に固定額
    final StakeRequest points = new StakeRequest(Currency.POINTS, pointsStake);
    if (account == null || account.isBlank()) {
      return points;
    }
    if (balanceGuard.hasSufficientBalance(account, pointsStake)) {
      return points;
    }
    if (!fallbackEnabled) {
      throw new GameSessionException(
          GameErrorCode.INSUFFICIENT_BALANCE, "insufficient points balance");
    }
    logger.info(
        "points balance insufficient, falling back to sol account={} stake={}",
        account,
        fallbackSolStake);
    return new StakeRequest(Currency.SOL, fallbackSolStake);
  }
}
