/*
 * どこで: Game Session ドメインモデル
 * 何を: 公開マッチ/招待制マッチの種別を定義する
 * なぜ: ランダムマッチの探索対象を public に限定するため
 */
package com.example.gamesession.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MatchKind {
  PUBLIC("public"),
  PRIVATE("private");

  private final String value;

  MatchKind(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public static MatchKind fromValue(String kind) {
    for (MatchKind matchKind : values()) {
      if (matchKind.value.equalsIgnoreCase(kind)) {
        return matchKind;
      }
    }
    throw new IllegalArgumentException("unsupported kind: " + kind);
  }
}
