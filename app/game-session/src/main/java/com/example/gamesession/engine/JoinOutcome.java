package com.example.gamesession.engine;

import com.example.gamesession.model.MatchView;
import com.example.gamesession.model.SlotPosition;

public record JoinOutcome(MatchView match, SlotPosition position, boolean started) {}
