/*
 * どこで: Game Session WebSocket
 * 何を: エンジンのイベントを送信メッセージへ変換し、該当プレイヤーへ配信する
 * なぜ: 誰に何を見せるか（相手の手を伏せる等）を転送層で決めるため
 */
package com.example.gamesession.ws;

import com.example.gamesession.engine.GameEventListener;
import com.example.gamesession.model.MatchView;
import com.example.gamesession.model.Move;
import com.example.gamesession.model.RoundResult;
import com.example.gamesession.model.SlotPosition;
import com.example.gamesession.ws.message.OutboundMessage;
import com.example.gamesession.ws.message.OutboundPayloads;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class WebSocketGameEventListener implements GameEventListener {

  private final WebSocketSessionGateway gateway;

  @Override
  public void onPlayerJoined(MatchView match, String playerId) {
    broadcast(
        match,
        OutboundMessageType.PLAYER_JOINED,
        new OutboundPayloads.PlayerEvent(match.matchId(), playerId, match));
  }

  @Override
  public void onMatchStarted(MatchView match) {
    broadcast(
        match,
        OutboundMessageType.MATCH_STARTED,
        new OutboundPayloads.MatchEnvelope(match.matchId(), match));
  }

  @Override
  public void onRoundTick(MatchView match, int countdown) {
    broadcast(
        match,
        OutboundMessageType.ROUND_TICK,
        new OutboundPayloads.RoundTick(match.matchId(), match.currentRound(), countdown));
  }

  @Override
  public void onMoveSubmitted(MatchView match, String playerId, Move move, boolean autoAssigned) {
    gateway.sendToPlayer(
        playerId,
        new OutboundMessage(
            OutboundMessageType.MOVE_SUBMITTED,
            new OutboundPayloads.MoveSubmitted(
                match.matchId(),
                playerId,
                move,
                autoAssigned,
                match.withOpponentMoveHidden(playerId))));
    final SlotPosition position = match.positionOf(playerId);
    if (position == null) {
      return;
    }
    gateway.sendToPlayer(
        match.player(position.opponent()).playerId(),
        new OutboundMessage(
            OutboundMessageType.OPPONENT_MOVE_SUBMITTED,
            new OutboundPayloads.OpponentMoveSubmitted(
                match.matchId(), match.bothMovesSubmitted())));
  }

  @Override
  public void onRoundCompleted(MatchView match, RoundResult result) {
    broadcast(
        match,
        OutboundMessageType.ROUND_COMPLETED,
        new OutboundPayloads.RoundCompleted(match.matchId(), result, match));
  }

  @Override
  public void onNextRound(MatchView match) {
    broadcast(
        match,
        OutboundMessageType.NEXT_ROUND,
        new OutboundPayloads.NextRound(match.matchId(), match.currentRound(), match));
  }

  @Override
  public void onMatchFinished(MatchView match) {
    final SlotPosition winnerPosition = match.positionOf(match.winner());
    final OutboundPayloads.Winner winner =
        match.winner() == null
            ? null
            : new OutboundPayloads.Winner(match.winner(), winnerPosition, match.finishReason());
    broadcast(
        match,
        OutboundMessageType.MATCH_FINISHED,
        new OutboundPayloads.MatchFinished(
            match.matchId(),
            match,
            winner,
            new OutboundPayloads.FinalScores(match.player1().wins(), match.player2().wins()),
            new OutboundPayloads.Payout(
                match.totalPot(), match.winnerPayout(), match.platformFee())));
  }

  @Override
  public void onPlayerLeft(MatchView match, String playerId) {
    broadcast(
        match,
        OutboundMessageType.PLAYER_LEFT,
        new OutboundPayloads.PlayerEvent(match.matchId(), playerId, match));
  }

  @Override
  public void onPlayerDisconnected(MatchView match, String playerId) {
    final OutboundMessage message =
        new OutboundMessage(
            OutboundMessageType.PLAYER_DISCONNECTED,
            new OutboundPayloads.PlayerEvent(match.matchId(), playerId, match));
    for (String occupant : match.occupants()) {
      if (!occupant.equals(playerId)) {
        gateway.sendToPlayer(occupant, message);
      }
    }
  }

  private void broadcast(MatchView match, OutboundMessageType type, Object payload) {
    final OutboundMessage message = new OutboundMessage(type, payload);
    for (String occupant : match.occupants()) {
      gateway.sendToPlayer(occupant, message);
    }
  }
}
