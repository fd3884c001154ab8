/*
 * どこで: Game Session エンジン
 * 何を: 通貨ごとのステーク検証、ポット/手数料計算、マッチ ID 正規化を行う
 * なぜ: 作成経路とランダムマッチ経路で同じ規則を適用するため
 */
package com.example.gamesession.engine;

import com.example.gamesession.model.Currency;
import com.example.gamesession.model.StakeTerms;
import java.math.BigDecimal;
import java.util.UUID;

public class StakePolicy {

  static final int SOL_MATCH_ID_MAX_LENGTH = 32;

  private static final BigDecimal TWO = BigDecimal.valueOf(2);
  private static final BigDecimal SMALL_STAKE_LIMIT = new BigDecimal("0.01");
  private static final BigDecimal MEDIUM_STAKE_LIMIT = new BigDecimal("0.05");
  private static final BigDecimal SMALL_STAKE_RATE = new BigDecimal("0.05");
  private static final BigDecimal MEDIUM_STAKE_RATE = new BigDecimal("0.03");
  private static final BigDecimal LARGE_STAKE_RATE = new BigDecimal("0.02");

  private final BigDecimal pointsStake;

  public StakePolicy(BigDecimal pointsStake) {
    this.pointsStake = pointsStake;
  }

  public BigDecimal pointsStake() {
    return pointsStake;
  }

  /** points は固定額のみ、sol は正の値のみ許可する。 */
  public void requireValid(Currency currency, BigDecimal stake) {
    if (currency == null) {
      throw new GameSessionException(GameErrorCode.INVALID_STAKE, "currency is required");
    }
    if (stake == null) {
      throw new GameSessionException(GameErrorCode.INVALID_STAKE, "stake is required");
    }
    switch (currency) {
      case POINTS -> {
        if (stake.compareTo(pointsStake) != 0) {
          throw new GameSessionException(
              GameErrorCode.INVALID_STAKE, "points stake must be " + pointsStake.toPlainString());
        }
      }
      case SOL -> {
        if (stake.signum() <= 0) {
          throw new GameSessionException(GameErrorCode.INVALID_STAKE, "sol stake must be positive");
        }
      }
    }
  }

  /**
   * 役割: 検証済みステークからポット/手数料/勝者配当を確定する。
   * 動作: points は手数料 0。sol はステーク額に応じて 5%/3%/2% をポットに掛ける。
   */
  public StakeTerms terms(Currency currency, BigDecimal stake) {
    requireValid(currency, stake);
    final BigDecimal totalPot = stake.multiply(TWO);
    final BigDecimal platformFee =
        currency == Currency.SOL ? totalPot.multiply(solFeeRate(stake)) : BigDecimal.ZERO;
    return new StakeTerms(
        currency, stake, totalPot, platformFee, totalPot.subtract(platformFee));
  }

  /** 指定 ID が無ければ UUID を採番する。sol の長い ID はハイフンを除いて 32 文字へ切り詰める。 */
  public String resolveMatchId(String requestedId, Currency currency) {
    final String trimmed =
        requestedId == null || requestedId.isBlank()
            ? UUID.randomUUID().toString()
            : requestedId.trim();
    if (currency == Currency.SOL && trimmed.length() > SOL_MATCH_ID_MAX_LENGTH) {
      final String compact = trimmed.replace("-", "");
      return compact.length() > SOL_MATCH_ID_MAX_LENGTH
          ? compact.substring(0, SOL_MATCH_ID_MAX_LENGTH)
          : compact;
    }
    return trimmed;
  }

  private static BigDecimal solFeeRate(BigDecimal stake) {
    if (stake.compareTo(SMALL_STAKE_LIMIT) <= 0) {
      return SMALL_STAKE_RATE;
    }
    if (stake.compareTo(MEDIUM_STAKE_LIMIT) <= 0) {
      return MEDIUM_STAKE_RATE;
    }
    return LARGE_STAKE_RATE;
  }
}
