package com.example.gamesession.engine;

import com.example.gamesession.model.Currency;
import com.example.gamesession.model.MatchKind;
import java.math.BigDecimal;

public record CreateMatchCommand(
    MatchKind kind,
    BigDecimal stake,
    Currency currency,
    String playerId,
    String sessionHandle,
    String account,
    String requestedMatchId) {}
