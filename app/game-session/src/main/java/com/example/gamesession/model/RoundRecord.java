package com.example.gamesession.model;

import java.time.Instant;

public record RoundRecord(
    int round, Move player1Move, Move player2Move, RoundOutcome winner, Instant playedAt) {}
