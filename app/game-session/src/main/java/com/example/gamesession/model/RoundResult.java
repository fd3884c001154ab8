/*
 * どこで: Game Session ドメインモデル
 * 何を: 1 ラウンド解決の結果を表現する
 * なぜ: round_completed 通知と submitMove 応答で同じ構造を使うため
 */
package com.example.gamesession.model;

public record RoundResult(
    int round,
    Move player1Move,
    Move player2Move,
    RoundOutcome roundWinner,
    SlotPosition matchWinner,
    int player1Wins,
    int player2Wins,
    boolean matchFinished) {}
