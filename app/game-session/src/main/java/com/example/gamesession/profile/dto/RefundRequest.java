package com.example.gamesession.profile.dto;

import java.math.BigDecimal;

public record RefundRequest(String matchId, BigDecimal amount, String reason) {}
