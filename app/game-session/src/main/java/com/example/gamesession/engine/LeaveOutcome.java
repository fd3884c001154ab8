package com.example.gamesession.engine;

import com.example.gamesession.model.MatchView;

public record LeaveOutcome(String matchId, MatchView match) {}
