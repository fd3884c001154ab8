package com.example.gamesession.ws;

import com.fasterxml.jackson.annotation.JsonValue;

public enum OutboundMessageType {
  MATCH_CREATED("match_created"),
  MATCH_JOINED("match_joined"),
  MATCH_FOUND("match_found"),
  PLAYER_JOINED("player_joined"),
  MATCH_STARTED("match_started"),
  ROUND_TICK("round_tick"),
  MOVE_SUBMITTED("move_submitted"),
  OPPONENT_MOVE_SUBMITTED("opponent_move_submitted"),
  ROUND_COMPLETED("round_completed"),
  NEXT_ROUND("next_round"),
  MATCH_FINISHED("match_finished"),
  PLAYER_LEFT("player_left"),
  PLAYER_DISCONNECTED("player_disconnected"),
  MATCH_STATE("match_state"),
  SERVER_STATS("server_stats"),
  ERROR("error");

  private final String value;

  OutboundMessageType(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }
}
