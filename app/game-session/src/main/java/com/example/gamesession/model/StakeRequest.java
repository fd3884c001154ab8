package com.example.gamesession.model;

import java.math.BigDecimal;

public record StakeRequest(Currency currency, BigDecimal stake) {

  public boolean sameTermsAs(Currency otherCurrency, BigDecimal otherStake) {
    return currency == otherCurrency
        && stake != null
        && otherStake != null
        && stake.compareTo(otherStake) == 0;
  }
}
