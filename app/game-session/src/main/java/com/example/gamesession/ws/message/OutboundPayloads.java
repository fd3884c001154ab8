package com.example.gamesession.ws.message;

import com.example.gamesession.model.FinishReason;
import com.example.gamesession.model.MatchView;
import com.example.gamesession.model.Move;
import com.example.gamesession.model.RegistryStats;
import com.example.gamesession.model.RoundResult;
import com.example.gamesession.model.SlotPosition;
import java.math.BigDecimal;

/** 送信 payload の形。フィールド名はクライアントとの取り決めどおり camelCase。 */
public final class OutboundPayloads {

  private OutboundPayloads() {}

  public record MatchEnvelope(String matchId, MatchView match) {}

  public record MatchJoined(
      String matchId, MatchView match, SlotPosition position, boolean started) {}

  public record RandomMatch(String matchId, MatchView match, boolean started, boolean queued) {}

  public record PlayerEvent(String matchId, String playerId, MatchView match) {}

  public record RoundTick(String matchId, int round, int countdown) {}

  public record MoveSubmitted(
      String matchId, String playerId, Move move, boolean autoAssigned, MatchView match) {}

  public record OpponentMoveSubmitted(String matchId, boolean bothSubmitted) {}

  public record RoundCompleted(String matchId, RoundResult roundResult, MatchView match) {}

  public record NextRound(String matchId, int round, MatchView match) {}

  public record Winner(String playerId, SlotPosition position, FinishReason reason) {}

  public record FinalScores(int player1, int player2) {}

  public record Payout(BigDecimal totalPot, BigDecimal winnerPayout, BigDecimal platformFee) {}

  public record MatchFinished(
      String matchId, MatchView match, Winner winner, FinalScores finalScores, Payout payout) {}

  public record ServerStats(RegistryStats stats, int connectedSessions) {}

  public record ErrorMessage(String code, String message) {}
}
