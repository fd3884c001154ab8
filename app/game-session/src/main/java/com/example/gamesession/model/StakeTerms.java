package com.example.gamesession.model;

import java.math.BigDecimal;

/** ステーク額と、そこから確定するポット/手数料/勝者配当。 */
public record StakeTerms(
    Currency currency,
    BigDecimal stake,
    BigDecimal totalPot,
    BigDecimal platformFee,
    BigDecimal winnerPayout) {}
