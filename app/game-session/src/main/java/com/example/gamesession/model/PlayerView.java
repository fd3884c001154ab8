package com.example.gamesession.model;

public record PlayerView(
    String playerId,
    String account,
    int wins,
    Move currentMove,
    boolean ready,
    boolean stakeDeposited,
    boolean connected) {}
