package com.example.gamesession.engine;

import com.example.gamesession.model.Currency;
import java.math.BigDecimal;

public record RandomMatchCommand(
    String playerId, String sessionHandle, BigDecimal stake, Currency currency, String account) {}
