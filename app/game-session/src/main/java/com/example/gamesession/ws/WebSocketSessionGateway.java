/*
 * どこで: Game Session WebSocket
 * 何を: 接続中セッションとプレイヤーの対応を保持し、JSON エンベロープを送信する
 * なぜ: エンジンは playerId だけを知り、送信先の解決と I/O をこの層へ閉じ込めるため
 */
package com.example.gamesession.ws;

import com.example.gamesession.ws.message.OutboundMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;

@Component
public class WebSocketSessionGateway {

  private static final Logger logger = LoggerFactory.getLogger(WebSocketSessionGateway.class);
  private static final int SEND_TIME_LIMIT_MILLIS = 10_000;
  private static final int BUFFER_SIZE_LIMIT_BYTES = 512 * 1024;

  private final ObjectMapper objectMapper;
  private final ConcurrentMap<String, WebSocketSession> sessions = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, String> sessionPlayers = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, String> playerSessions = new ConcurrentHashMap<>();

  @SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "ObjectMapper is a shared Spring bean")
  public WebSocketSessionGateway(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public void register(WebSocketSession session) {
    sessions.put(
        session.getId(),
        new ConcurrentWebSocketSessionDecorator(
            session, SEND_TIME_LIMIT_MILLIS, BUFFER_SIZE_LIMIT_BYTES));
  }

  /** セッションへプレイヤーを関連付ける。関連付けが変わった場合に true。 */
  public boolean bind(String sessionId, String playerId) {
    if (!sessions.containsKey(sessionId)) {
      return false;
    }
    final String previousPlayer = sessionPlayers.put(sessionId, playerId);
    if (previousPlayer != null && !previousPlayer.equals(playerId)) {
      playerSessions.remove(previousPlayer, sessionId);
    }
    final String previousSession = playerSessions.put(playerId, sessionId);
    return !sessionId.equals(previousSession);
  }

  /** セッションを破棄し、関連付けられていたプレイヤーを返す。 */
  public Optional<String> unregister(String sessionId) {
    sessions.remove(sessionId);
    final String playerId = sessionPlayers.remove(sessionId);
    if (playerId == null) {
      return Optional.empty();
    }
    playerSessions.remove(playerId, sessionId);
    return Optional.of(playerId);
  }

  public Optional<String> playerOf(String sessionId) {
    return Optional.ofNullable(sessionPlayers.get(sessionId));
  }

  public int sessionCount() {
    return sessions.size();
  }

  public void sendToPlayer(String playerId, OutboundMessage message) {
    if (playerId == null) {
      return;
    }
    final String sessionId = playerSessions.get(playerId);
    if (sessionId == null) {
      logger.debug("no session bound playerId={} type={}", playerId, message.type().value());
      return;
    }
    sendToSession(sessionId, message);
  }

  public void sendToSession(String sessionId, OutboundMessage message) {
    final WebSocketSession session = sessions.get(sessionId);
    if (session == null || !session.isOpen()) {
      return;
    }
    try {
      session.sendMessage(new TextMessage(objectMapper.writeValueAsString(message)));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize outbound message", ex);
    } catch (IOException | SessionLimitExceededException ex) {
      logger.warn(
          "websocket send failed sessionId={} type={}", sessionId, message.type().value(), ex);
    }
  }
}
