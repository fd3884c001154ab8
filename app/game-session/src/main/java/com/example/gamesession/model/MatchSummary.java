/*
 * どこで: Game Session ドメインモデル
 * 何を: 終了したマッチの履歴記録用サマリを定義する
 * なぜ: ProfileStore.recordHistory へ渡す形を固定するため
 */
package com.example.gamesession.model;

import java.math.BigDecimal;
import java.time.Instant;

public record MatchSummary(
    String matchId,
    Currency currency,
    BigDecimal stake,
    BigDecimal totalPot,
    BigDecimal platformFee,
    BigDecimal winnerPayout,
    String player1Account,
    String player2Account,
    String winnerAccount,
    FinishReason finishReason,
    int rounds,
    Instant startedAt,
    Instant completedAt) {}
