package com.example.gamesession.ws;

import java.util.Optional;

/** クライアントから受け付けるメッセージ種別。未知の type はエラー応答にする。 */
public enum InboundMessageType {
  CREATE_MATCH("create_match"),
  JOIN_MATCH("join_match"),
  FIND_RANDOM_MATCH("find_random_match"),
  SUBMIT_MOVE("submit_move"),
  LEAVE_MATCH("leave_match"),
  GET_MATCH_STATE("get_match_state"),
  GET_STATS("get_stats"),
  RECONNECT("reconnect");

  private final String value;

  InboundMessageType(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static Optional<InboundMessageType> fromValue(String type) {
    for (InboundMessageType candidate : values()) {
      if (candidate.value.equals(type)) {
        return Optional.of(candidate);
      }
    }
    return Optional.empty();
  }
}
