/*
 * どこで: Game Session WebSocket
 * 何を: 受信エンベロープを種別ごとに SessionRegistry の操作へ振り分け、応答/エラーを返す
 * なぜ: 転送層の関心（JSON、セッション、MDC）をエンジンから切り離すため
 */
package com.example.gamesession.ws;

import com.example.gamesession.engine.CreateMatchCommand;
import com.example.gamesession.engine.GameErrorCode;
import com.example.gamesession.engine.GameSessionException;
import com.example.gamesession.engine.JoinMatchCommand;
import com.example.gamesession.engine.JoinOutcome;
import com.example.gamesession.engine.LeaveOutcome;
import com.example.gamesession.engine.RandomMatchCommand;
import com.example.gamesession.engine.RandomMatchOutcome;
import com.example.gamesession.engine.SessionRegistry;
import com.example.gamesession.model.Currency;
import com.example.gamesession.model.MatchKind;
import com.example.gamesession.model.MatchView;
import com.example.gamesession.ws.message.InboundPayloads;
import com.example.gamesession.ws.message.OutboundMessage;
import com.example.gamesession.ws.message.OutboundPayloads;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

@Component
public class GameWebSocketHandler extends TextWebSocketHandler {

  private static final Logger logger = LoggerFactory.getLogger(GameWebSocketHandler.class);

  private final SessionRegistry sessionRegistry;
  private final WebSocketSessionGateway gateway;
  private final ObjectMapper objectMapper;

  @SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "shared Spring beans")
  public GameWebSocketHandler(
      SessionRegistry sessionRegistry, WebSocketSessionGateway gateway, ObjectMapper objectMapper) {
    this.sessionRegistry = sessionRegistry;
    this.gateway = gateway;
    this.objectMapper = objectMapper;
  }

  @Override
  public void afterConnectionEstablished(@NonNull WebSocketSession session) {
    gateway.register(session);
    logger.info("websocket connected sessionId={}", session.getId());
  }

  @Override
  protected void handleTextMessage(
      @NonNull WebSocketSession session, @NonNull TextMessage message) {
    final List<String> mdcKeys = new ArrayList<>();
    putMdc(mdcKeys, "session_id", session.getId());
    try {
      final JsonNode root = objectMapper.readTree(message.getPayload());
      final String type = root.path("type").asText(null);
      final JsonNode payload =
          root.hasNonNull("payload") ? root.get("payload") : JsonNodeFactory.instance.objectNode();
      putMdc(mdcKeys, "player_id", payload.path("playerId").asText(null));
      putMdc(mdcKeys, "match_id", payload.path("matchId").asText(null));
      final InboundMessageType messageType =
          InboundMessageType.fromValue(type)
              .orElseThrow(
                  () ->
                      new GameSessionException(
                          GameErrorCode.INVALID_REQUEST, "unknown message type: " + type));
      dispatch(session.getId(), messageType, payload);
    } catch (GameSessionException ex) {
      logger.info("request rejected code={} message={}", ex.getCode(), ex.getMessage());
      sendError(session.getId(), ex.getCode(), ex.getMessage());
    } catch (JsonProcessingException ex) {
      logger.info("malformed message sessionId={}", session.getId());
      sendError(session.getId(), GameErrorCode.INVALID_REQUEST, "malformed message");
    } catch (RuntimeException ex) {
      logger.error("message handling failed sessionId={}", session.getId(), ex);
      sendError(session.getId(), GameErrorCode.INVALID_REQUEST, "request failed");
    } finally {
      mdcKeys.forEach(MDC::remove);
    }
  }

  @Override
  public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
    gateway
        .unregister(session.getId())
        .ifPresent(playerId -> sessionRegistry.disconnect(playerId, session.getId()));
    logger.info("websocket closed sessionId={} status={}", session.getId(), status.getCode());
  }

  @Override
  public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
    logger.warn("websocket transport error sessionId={}", session.getId(), exception);
  }

  private void dispatch(String sessionId, InboundMessageType type, JsonNode payload)
      throws JsonProcessingException {
    switch (type) {
      case CREATE_MATCH -> handleCreate(sessionId, read(payload, InboundPayloads.CreateMatch.class));
      case JOIN_MATCH -> handleJoin(sessionId, read(payload, InboundPayloads.JoinMatch.class));
      case FIND_RANDOM_MATCH ->
          handleFindRandom(sessionId, read(payload, InboundPayloads.FindRandomMatch.class));
      case SUBMIT_MOVE -> handleSubmitMove(sessionId, read(payload, InboundPayloads.SubmitMove.class));
      case LEAVE_MATCH -> handleLeave(sessionId, read(payload, InboundPayloads.PlayerRef.class));
      case GET_MATCH_STATE ->
          handleMatchState(sessionId, read(payload, InboundPayloads.PlayerRef.class));
      case GET_STATS -> handleStats(sessionId);
      case RECONNECT -> handleReconnect(sessionId, read(payload, InboundPayloads.PlayerRef.class));
    }
  }

  private void handleCreate(String sessionId, InboundPayloads.CreateMatch request) {
    final String playerId = bindPlayer(sessionId, request.playerId());
    final MatchView match =
        sessionRegistry.createMatch(
            new CreateMatchCommand(
                parseKind(request.kind()),
                request.stake(),
                parseCurrency(request.currency()),
                playerId,
                sessionId,
                request.account(),
                request.matchId()));
    send(
        sessionId,
        OutboundMessageType.MATCH_CREATED,
        new OutboundPayloads.MatchEnvelope(match.matchId(), match));
  }

  private void handleJoin(String sessionId, InboundPayloads.JoinMatch request) {
    final String playerId = bindPlayer(sessionId, request.playerId());
    final JoinOutcome outcome =
        sessionRegistry.joinMatch(
            new JoinMatchCommand(request.matchId(), playerId, sessionId, request.account()));
    send(
        sessionId,
        OutboundMessageType.MATCH_JOINED,
        new OutboundPayloads.MatchJoined(
            outcome.match().matchId(), outcome.match(), outcome.position(), outcome.started()));
  }

  private void handleFindRandom(String sessionId, InboundPayloads.FindRandomMatch request) {
    final String playerId = bindPlayer(sessionId, request.playerId());
    final RandomMatchOutcome outcome =
        sessionRegistry.findOrCreateRandomMatch(
            new RandomMatchCommand(
                playerId,
                sessionId,
                request.stake(),
                parseCurrency(request.currency()),
                request.account()));
    final OutboundMessageType type =
        outcome.queued() ? OutboundMessageType.MATCH_CREATED : OutboundMessageType.MATCH_FOUND;
    send(
        sessionId,
        type,
        new OutboundPayloads.RandomMatch(
            outcome.match().matchId(), outcome.match(), outcome.started(), outcome.queued()));
  }

  private void handleSubmitMove(String sessionId, InboundPayloads.SubmitMove request) {
    final String playerId = bindPlayer(sessionId, request.playerId());
    // 応答は move_submitted / round_completed イベントとして届く
    sessionRegistry.submitMove(playerId, request.move(), request.matchId());
  }

  private void handleLeave(String sessionId, InboundPayloads.PlayerRef request) {
    final String playerId = resolvePlayerId(sessionId, request.playerId());
    final LeaveOutcome outcome = sessionRegistry.leaveMatch(playerId);
    send(
        sessionId,
        OutboundMessageType.PLAYER_LEFT,
        new OutboundPayloads.PlayerEvent(outcome.matchId(), playerId, outcome.match()));
  }

  private void handleMatchState(String sessionId, InboundPayloads.PlayerRef request) {
    final MatchView match;
    if (request.matchId() != null && !request.matchId().isBlank()) {
      match =
          sessionRegistry
              .getMatch(request.matchId())
              .orElseThrow(
                  () ->
                      new GameSessionException(
                          GameErrorCode.MATCH_NOT_FOUND, "match not found: " + request.matchId()));
    } else {
      final String playerId = resolvePlayerId(sessionId, request.playerId());
      match =
          sessionRegistry
              .getPlayerMatch(playerId)
              .orElseThrow(
                  () ->
                      new GameSessionException(
                          GameErrorCode.PLAYER_NOT_IN_ANY_MATCH,
                          "player is not in any match: " + playerId));
    }
    final String viewer = gateway.playerOf(sessionId).orElse(null);
    send(
        sessionId,
        OutboundMessageType.MATCH_STATE,
        new OutboundPayloads.MatchEnvelope(match.matchId(), hideForViewer(match, viewer)));
  }

  private void handleStats(String sessionId) {
    send(
        sessionId,
        OutboundMessageType.SERVER_STATS,
        new OutboundPayloads.ServerStats(sessionRegistry.stats(), gateway.sessionCount()));
  }

  private void handleReconnect(String sessionId, InboundPayloads.PlayerRef request) {
    final String playerId = bindPlayer(sessionId, request.playerId());
    final MatchView match =
        sessionRegistry
            .getPlayerMatch(playerId)
            .orElseThrow(
                () ->
                    new GameSessionException(
                        GameErrorCode.PLAYER_NOT_IN_ANY_MATCH,
                        "player is not in any match: " + playerId));
    send(
        sessionId,
        OutboundMessageType.MATCH_STATE,
        new OutboundPayloads.MatchEnvelope(match.matchId(), match.withOpponentMoveHidden(playerId)));
  }

  /** セッションへプレイヤーを関連付け、関連付けが新しければ座席の接続も付け替える。 */
  private String bindPlayer(String sessionId, String rawPlayerId) {
    final String playerId = resolvePlayerId(sessionId, rawPlayerId);
    if (gateway.bind(sessionId, playerId)) {
      sessionRegistry.attachSession(playerId, sessionId);
    }
    return playerId;
  }

  private <T> T read(JsonNode payload, Class<T> type) throws JsonProcessingException {
    return objectMapper.treeToValue(payload, type);
  }

  /** ペイロードの playerId、無ければセッションに関連付いたプレイヤーを返す。 */
  private String resolvePlayerId(String sessionId, String playerId) {
    if (playerId != null && !playerId.isBlank()) {
      return playerId;
    }
    return gateway
        .playerOf(sessionId)
        .orElseThrow(
            () -> new GameSessionException(GameErrorCode.INVALID_REQUEST, "playerId is required"));
  }

  private static MatchKind parseKind(String kind) {
    if (kind == null || kind.isBlank()) {
      return MatchKind.PUBLIC;
    }
    try {
      return MatchKind.fromValue(kind);
    } catch (IllegalArgumentException ex) {
      throw new GameSessionException(GameErrorCode.INVALID_REQUEST, ex.getMessage());
    }
  }

  private static Currency parseCurrency(String currency) {
    if (currency == null || currency.isBlank()) {
      return Currency.POINTS;
    }
    try {
      return Currency.fromValue(currency);
    } catch (IllegalArgumentException ex) {
      throw new GameSessionException(GameErrorCode.INVALID_STAKE, ex.getMessage());
    }
  }

  private static MatchView hideForViewer(MatchView match, String viewer) {
    return viewer == null ? match : match.withOpponentMoveHidden(viewer);
  }

  private void send(String sessionId, OutboundMessageType type, Object payload) {
    gateway.sendToSession(sessionId, new OutboundMessage(type, payload));
  }

  private void sendError(String sessionId, GameErrorCode code, String message) {
    send(sessionId, OutboundMessageType.ERROR, new OutboundPayloads.ErrorMessage(code.name(), message));
  }

  private static void putMdc(List<String> keys, String key, String value) {
    if (value == null || value.isBlank()) {
      return;
    }
    MDC.put(key, value);
    keys.add(key);
  }
}
