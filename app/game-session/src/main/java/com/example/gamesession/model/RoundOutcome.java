package com.example.gamesession.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RoundOutcome {
  PLAYER1("player1"),
  PLAYER2("player2"),
  DRAW("draw");

  private final String value;

  RoundOutcome(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }
}
