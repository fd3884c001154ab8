package com.example.gamesession.settlement;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MatchSettledEvent(
    String eventId,
    String eventType,
    String occurredAt,
    String matchId,
    String winnerAccount,
    String loserAccount,
    BigDecimal stake,
    String traceId) {}
