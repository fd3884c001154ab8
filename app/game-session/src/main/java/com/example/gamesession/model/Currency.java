/*
 * どこで: Game Session ドメインモデル
 * 何を: ステークの通貨種別を定義する
 * なぜ: 通貨ごとのステーク規則と手数料計算を切り替えるため
 */
package com.example.gamesession.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Currency {
  POINTS("points"),
  SOL("sol");

  private final String value;

  Currency(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public static Currency fromValue(String currency) {
    for (Currency candidate : values()) {
      if (candidate.value.equalsIgnoreCase(currency)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("unsupported currency: " + currency);
  }
}
