package com.example.gamesession.engine;

import com.example.gamesession.model.MatchView;
import com.example.gamesession.model.RoundResult;

public record MoveOutcome(MatchView match, boolean roundComplete, RoundResult roundResult) {}
