package com.example.gamesession.profile.dto;

import java.math.BigDecimal;

public record BalanceCheckResponse(String account, Boolean sufficient, BigDecimal balance) {}
