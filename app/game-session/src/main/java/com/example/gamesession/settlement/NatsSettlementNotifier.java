/*
 * どこで: Game Session の清算連携
 * 何を: 決着イベントを JetStream へ publish する
 * なぜ: 清算サービスへ非同期に、Nats-Msg-Id の重複排除付きで引き渡すため
 */
package com.example.gamesession.settlement;

import com.example.common.trace.TraceIds;
import com.example.gamesession.config.SettlementNatsProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsSettlementNotifier implements SettlementNotifier {

  static final String EVENT_TYPE = "MATCH_SETTLED";

  private static final Logger logger = LoggerFactory.getLogger(NatsSettlementNotifier.class);

  private final JetStream jetStream;
  private final SettlementNatsProperties properties;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "JetStream and ObjectMapper are shared Spring beans")
  public NatsSettlementNotifier(
      JetStream jetStream,
      SettlementNatsProperties properties,
      ObjectMapper objectMapper,
      Clock clock) {
    this.jetStream = jetStream;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @Override
  public boolean notifyMatchSettled(
      String matchId, String winnerAccount, String loserAccount, BigDecimal stake) {
    if (matchId == null || matchId.isBlank()) {
      throw new IllegalArgumentException("matchId is required");
    }
    final MatchSettledEvent event =
        new MatchSettledEvent(
            UUID.randomUUID().toString(),
            EVENT_TYPE,
            Instant.now(clock).toString(),
            matchId,
            winnerAccount,
            loserAccount,
            stake,
            TraceIds.currentOrNew());
    final Headers headers = new Headers();
    // 清算は 1 マッチ 1 回なので match id を重複排除キーにする
    headers.add("Nats-Msg-Id", matchId);
    try {
      final byte[] payload = objectMapper.writeValueAsBytes(event);
      final PublishAck ack = jetStream.publish(properties.subject(), headers, payload);
      if (ack == null) {
        return false;
      }
      if (ack.isDuplicate()) {
        logger.info("settlement event already published matchId={}", matchId);
      }
      return true;
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize settlement event", ex);
    } catch (IOException | JetStreamApiException ex) {
      throw new IllegalStateException("failed to publish settlement event", ex);
    }
  }
}
