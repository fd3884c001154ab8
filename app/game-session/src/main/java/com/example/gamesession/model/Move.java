/*
 * どこで: Game Session ドメインモデル
 * 何を: じゃんけんの手（rock/paper/scissors）を定義する
 * なぜ: 受信文字列の妥当性と勝敗関係を列挙型に閉じ込めるため
 */
package com.example.gamesession.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Move {
  ROCK("rock"),
  PAPER("paper"),
  SCISSORS("scissors");

  private final String value;

  Move(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /** rock > scissors > paper > rock の循環で、この手が other に勝つかを返す。 */
  public boolean beats(Move other) {
    return switch (this) {
      case ROCK -> other == SCISSORS;
      case SCISSORS -> other == PAPER;
      case PAPER -> other == ROCK;
    };
  }

  /**
   * 役割: クライアントから受け取った move 文字列を内部列挙型へ変換する。
   * 動作: 大文字小文字を無視して一致判定を行い、未対応値は IllegalArgumentException を送出する。
   * 前提: null は未対応値として扱う。
   */
  public static Move fromValue(String move) {
    for (Move candidate : values()) {
      if (candidate.value.equalsIgnoreCase(move)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("unsupported move: " + move);
  }
}
