package com.example.gamesession.engine;

public record JoinMatchCommand(
    String matchId, String playerId, String sessionHandle, String account) {}
