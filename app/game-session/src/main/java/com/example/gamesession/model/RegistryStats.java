package com.example.gamesession.model;

public record RegistryStats(
    int totalMatches,
    int activeMatches,
    int waitingMatches,
    int finishedMatches,
    int totalPlayers,
    int queuedTickets,
    int liveTimers) {}
