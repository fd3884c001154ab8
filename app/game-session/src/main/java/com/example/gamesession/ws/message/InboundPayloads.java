/*
 * どこで: Game Session WebSocket
 * 何を: 受信メッセージ種別ごとの payload 形を定義する
 * なぜ: JsonNode の手動読み取りを避け、欠落項目をレコードの null として扱うため
 */
package com.example.gamesession.ws.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.math.BigDecimal;

public final class InboundPayloads {

  private InboundPayloads() {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record CreateMatch(
      String kind,
      BigDecimal stake,
      String currency,
      String playerId,
      String account,
      String matchId) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record JoinMatch(String matchId, String playerId, String account) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record FindRandomMatch(
      BigDecimal stake, String currency, String playerId, String account) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record SubmitMove(String matchId, String playerId, String move) {}

  /** leave_match / get_match_state / reconnect で共通。 */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record PlayerRef(String playerId, String matchId) {}
}
