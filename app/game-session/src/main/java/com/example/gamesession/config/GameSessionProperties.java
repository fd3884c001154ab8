/*
 * どこで: Game Session 設定
 * 何を: ラウンド時間/切断猶予/ステーク/掃除間隔のドメイン設定を保持する
 * なぜ: 環境差分をコード外へ出し、テストで短い時間に上書きしやすくするため
 */
package com.example.gamesession.config;

import java.math.BigDecimal;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "game")
public record GameSessionProperties(
    Integer roundCountdownTicks,
    Duration tickInterval,
    Duration disconnectGrace,
    BigDecimal pointsStake,
    BigDecimal fallbackSolStake,
    Boolean currencyFallbackEnabled,
    Duration finishedRetention,
    Duration sweepInterval,
    Boolean sweepEnabled,
    Integer collaboratorThreads) {

  public GameSessionProperties {
    roundCountdownTicks =
        roundCountdownTicks == null || roundCountdownTicks <= 0 ? 15 : roundCountdownTicks;
    tickInterval = positiveOrDefault(tickInterval, Duration.ofSeconds(1));
    disconnectGrace = positiveOrDefault(disconnectGrace, Duration.ofSeconds(5));
    pointsStake = pointsStake == null ? BigDecimal.valueOf(100) : pointsStake;
    fallbackSolStake = fallbackSolStake == null ? new BigDecimal("0.01") : fallbackSolStake;
    currencyFallbackEnabled = currencyFallbackEnabled == null || currencyFallbackEnabled;
    finishedRetention = positiveOrDefault(finishedRetention, Duration.ofSeconds(30));
    sweepInterval = positiveOrDefault(sweepInterval, Duration.ofSeconds(10));
    sweepEnabled = sweepEnabled == null || sweepEnabled;
    collaboratorThreads =
        collaboratorThreads == null || collaboratorThreads <= 0 ? 4 : collaboratorThreads;
  }

  private static Duration positiveOrDefault(Duration value, Duration fallback) {
    return value == null || value.isZero() || value.isNegative() ? fallback : value;
  }
}
