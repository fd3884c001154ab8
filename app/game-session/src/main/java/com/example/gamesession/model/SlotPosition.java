package com.example.gamesession.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SlotPosition {
  PLAYER1("player1"),
  PLAYER2("player2");

  private final String value;

  SlotPosition(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public SlotPosition opponent() {
    return this == PLAYER1 ? PLAYER2 : PLAYER1;
  }

  public RoundOutcome asOutcome() {
    return this == PLAYER1 ? RoundOutcome.PLAYER1 : RoundOutcome.PLAYER2;
  }
}
